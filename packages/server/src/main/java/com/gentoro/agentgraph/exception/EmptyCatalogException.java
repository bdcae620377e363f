package com.gentoro.agentgraph.exception;

import java.util.Map;

/** The gateway listed no capabilities at all. */
public class EmptyCatalogException extends CatalogException {
  public EmptyCatalogException(int pages) {
    super(
        AgentGraphErrorCode.CATALOG_ERROR,
        "The tool gateway returned no capabilities",
        Map.of("pages", pages));
  }
}
