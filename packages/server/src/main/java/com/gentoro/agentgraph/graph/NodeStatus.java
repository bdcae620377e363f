package com.gentoro.agentgraph.graph;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Per-node lifecycle: {@code pending -> running -> completed | failed}, or {@code skipped}. */
public enum NodeStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  SKIPPED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == SKIPPED;
  }

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
