package com.gentoro.agentgraph.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends AgentGraphException {
  public ValidationException(String message) {
    super(AgentGraphErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AgentGraphErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
