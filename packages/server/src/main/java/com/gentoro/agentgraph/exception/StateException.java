package com.gentoro.agentgraph.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends AgentGraphException {
  public StateException(String message) {
    super(AgentGraphErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(AgentGraphErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
