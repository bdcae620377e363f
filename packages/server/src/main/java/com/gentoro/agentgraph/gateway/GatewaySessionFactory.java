package com.gentoro.agentgraph.gateway;

import com.gentoro.agentgraph.context.RequestContext;

@FunctionalInterface
public interface GatewaySessionFactory {
  /**
   * Open a session authenticated with the given bearer token.
   *
   * @throws com.gentoro.agentgraph.exception.NetworkException when the gateway is unreachable
   */
  GatewaySession open(String accessToken, RequestContext context);
}
