package com.gentoro.agentgraph.exception;

/** Malformed graph construction. A programming error, raised by the builder. */
public class GraphValidationException extends AgentGraphException {
  public GraphValidationException(String message) {
    super(AgentGraphErrorCode.GRAPH_VALIDATION_ERROR, message);
  }
}
