package com.gentoro.agentgraph.exception;

/** JSON/YAML (de)serialization failure. */
public class SerializationException extends AgentGraphException {
  public SerializationException(String message, Throwable cause) {
    super(AgentGraphErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
