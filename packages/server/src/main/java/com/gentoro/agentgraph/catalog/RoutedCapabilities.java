package com.gentoro.agentgraph.catalog;

import java.util.List;

/**
 * Capabilities routed to one node.
 *
 * @param fallback true when the keyword matched nothing and the whole catalog was assigned
 */
public record RoutedCapabilities(String keyword, List<Capability> capabilities, boolean fallback) {
  public RoutedCapabilities {
    capabilities = List.copyOf(capabilities);
  }
}
