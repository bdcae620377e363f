package com.gentoro.agentgraph.identity;

import com.gentoro.agentgraph.context.RequestContext;

/** Source of bearer tokens for the tool gateway. */
@FunctionalInterface
public interface AccessTokenProvider {
  /**
   * @throws com.gentoro.agentgraph.exception.NetworkException when the identity provider cannot be
   *     reached or refuses the request
   */
  String getAccessToken(RequestContext context);
}
