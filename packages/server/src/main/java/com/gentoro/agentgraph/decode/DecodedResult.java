package com.gentoro.agentgraph.decode;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * Classified runtime response.
 *
 * @param data set for {@link Kind#STRUCTURED}
 * @param text set for {@link Kind#TEXT} and {@link Kind#ERROR}
 */
public record DecodedResult(Kind kind, JsonNode data, String text) {

  public enum Kind {
    ERROR,
    EMPTY,
    STRUCTURED,
    TEXT
  }

  public DecodedResult {
    Objects.requireNonNull(kind, "kind");
  }

  public static DecodedResult empty() {
    return new DecodedResult(Kind.EMPTY, null, null);
  }

  public static DecodedResult error(String message) {
    return new DecodedResult(Kind.ERROR, null, message);
  }

  public static DecodedResult structured(JsonNode data) {
    return new DecodedResult(Kind.STRUCTURED, Objects.requireNonNull(data, "data"), null);
  }

  public static DecodedResult text(String text) {
    return new DecodedResult(Kind.TEXT, null, text);
  }

  public boolean isError() {
    return kind == Kind.ERROR;
  }
}
