package com.gentoro.agentgraph.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;
import com.gentoro.agentgraph.exception.CatalogException;
import com.gentoro.agentgraph.exception.ConfigException;
import com.gentoro.agentgraph.exception.NetworkException;
import com.gentoro.agentgraph.exception.PromptException;
import com.gentoro.agentgraph.exception.ValidationException;
import java.util.Locale;

/** Coarse class of a request failure, as reported to the chat client. */
public enum ErrorCategory {
  /** Missing settings, invalid payload, broken prompt templates. */
  CONFIGURATION(500),
  /** Identity provider or gateway unreachable. */
  CONNECTIVITY(502),
  /** Capability catalog empty, malformed or too long. */
  CAPABILITY(502),
  GENERIC(500);

  private final int httpStatus;

  ErrorCategory(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ErrorCategory of(Throwable t) {
    if (t instanceof ConfigException
        || t instanceof ValidationException
        || t instanceof PromptException) {
      return CONFIGURATION;
    }
    if (t instanceof NetworkException) return CONNECTIVITY;
    if (t instanceof CatalogException) return CAPABILITY;
    return GENERIC;
  }
}
