package com.gentoro.agentgraph.exception;

/** Requested resource does not exist. */
public class NotFoundException extends AgentGraphException {
  public NotFoundException(String message) {
    super(AgentGraphErrorCode.NOT_FOUND, message);
  }
}
