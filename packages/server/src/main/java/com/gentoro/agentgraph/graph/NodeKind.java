package com.gentoro.agentgraph.graph;

/** What a node produces when executed. */
public enum NodeKind {
  /** Agent output kept as text (tool results included). */
  TEXT,
  /** Agent output parsed into structured JSON blocks where possible. */
  STRUCTURED,
  /** No-op node marking the end of a pipeline; never calls the agent runtime. */
  TERMINAL
}
