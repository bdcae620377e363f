package com.gentoro.agentgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** GraphRun lifecycle: {@code pending -> running -> completed | failed}. */
public enum RunStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
