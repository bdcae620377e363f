package com.gentoro.agentgraph.exception;

import java.util.Map;

/** The tool catalog could not be assembled: empty, malformed or unbounded. */
public class CatalogException extends AgentGraphException {
  public CatalogException(String message) {
    super(AgentGraphErrorCode.CATALOG_ERROR, message);
  }

  public CatalogException(String message, Throwable cause) {
    super(AgentGraphErrorCode.CATALOG_ERROR, message, cause);
  }

  protected CatalogException(AgentGraphErrorCode code, String message, Map<String, ?> context) {
    super(code, message, context);
  }
}
