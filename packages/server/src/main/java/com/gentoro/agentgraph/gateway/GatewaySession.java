package com.gentoro.agentgraph.gateway;

import com.gentoro.agentgraph.catalog.CatalogSource;

/**
 * Authenticated connection to the tool gateway. Held open for catalog discovery and every node
 * execution of one request, then closed.
 */
public interface GatewaySession extends AutoCloseable {

  /** Listing operation bound to this session; capabilities it returns call through this session. */
  CatalogSource catalogSource();

  @Override
  void close();
}
