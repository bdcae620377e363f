package com.gentoro.agentgraph.exception;

/** Missing or invalid configuration detected at startup or at the start of a request. */
public class ConfigException extends AgentGraphException {
  public ConfigException(String message) {
    super(AgentGraphErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AgentGraphErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
