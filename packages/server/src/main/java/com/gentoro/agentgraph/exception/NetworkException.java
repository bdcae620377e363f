package com.gentoro.agentgraph.exception;

/** Network-level communication error (HTTP, sockets, timeouts, token exchange). */
public class NetworkException extends AgentGraphException {
  public NetworkException(String message) {
    super(AgentGraphErrorCode.NETWORK_ERROR, message);
  }

  /** For failures with a more specific code, such as rejected credentials. */
  public NetworkException(AgentGraphErrorCode code, String message) {
    super(code, message);
  }

  public NetworkException(String message, Throwable cause) {
    super(AgentGraphErrorCode.NETWORK_ERROR, message, cause);
  }
}
