package com.gentoro.agentgraph.identity;

import com.gentoro.agentgraph.context.RequestContext;
import java.util.Objects;

/** Fixed token, for local gateways and tests. */
public class StaticTokenProvider implements AccessTokenProvider {
  private final String token;

  public StaticTokenProvider(String token) {
    this.token = Objects.requireNonNull(token, "token");
  }

  @Override
  public String getAccessToken(RequestContext context) {
    return token;
  }
}
