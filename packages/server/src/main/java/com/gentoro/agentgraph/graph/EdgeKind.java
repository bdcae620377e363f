package com.gentoro.agentgraph.graph;

public enum EdgeKind {
  /** Fires whenever the source completes. */
  UNCONDITIONAL,
  /** Fires when its condition holds against the run state. */
  CONDITIONAL,
  /** Structural link that never fires; stops propagation past the source. */
  TERMINAL
}
