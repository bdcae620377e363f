package com.gentoro.agentgraph.identity;

import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.utility.StringUtility;
import java.util.Objects;

/**
 * Caches the first token obtained from the delegate for the lifetime of one request. Create one
 * per request; never share instances between requests.
 */
public final class RequestScopedTokenProvider implements AccessTokenProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(RequestScopedTokenProvider.class);

  private final AccessTokenProvider delegate;
  private String token;

  public RequestScopedTokenProvider(AccessTokenProvider delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public synchronized String getAccessToken(RequestContext context) {
    if (token == null) {
      token = delegate.getAccessToken(context);
      log.debug("Cached access token {} for this request", StringUtility.redact(token));
    }
    return token;
  }
}
