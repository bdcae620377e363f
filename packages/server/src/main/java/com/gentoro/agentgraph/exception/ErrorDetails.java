package com.gentoro.agentgraph.exception;

import java.util.Map;

/** Lightweight DTO to expose structured error information to logs, node results and responses. */
public final class ErrorDetails {
  public final String type;
  public final String message;
  public final AgentGraphErrorCode code;
  public final Map<String, Object> context;

  public ErrorDetails(
      String type, String message, AgentGraphErrorCode code, Map<String, Object> context) {
    this.type = type;
    this.message = message;
    this.code = code;
    this.context = context == null ? Map.of() : context;
  }

  @Override
  public String toString() {
    return type + "[" + code + "]: " + message;
  }
}
