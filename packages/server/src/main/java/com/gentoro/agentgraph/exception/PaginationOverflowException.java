package com.gentoro.agentgraph.exception;

import java.util.Map;

/** Catalog listing kept returning a cursor past the configured page cap. */
public class PaginationOverflowException extends CatalogException {
  public PaginationOverflowException(int maxPages, int capabilitiesSoFar) {
    super(
        AgentGraphErrorCode.RESOURCE_EXHAUSTED,
        "Catalog pagination exceeded %d pages".formatted(maxPages),
        Map.of("maxPages", maxPages, "capabilities", capabilitiesSoFar));
  }
}
