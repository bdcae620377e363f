package com.gentoro.agentgraph.catalog;

import java.util.List;

/**
 * One page of the remote capability listing.
 *
 * @param nextCursor continuation token; null or blank when this is the last page
 */
public record CatalogPage(List<Capability> capabilities, String nextCursor) {
  public CatalogPage {
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
  }

  public boolean hasMore() {
    return nextCursor != null && !nextCursor.isBlank();
  }
}
