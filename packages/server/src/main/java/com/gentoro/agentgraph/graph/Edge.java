package com.gentoro.agentgraph.graph;

import java.util.Objects;

/**
 * Directed link between two nodes.
 *
 * @param condition evaluated only for {@link EdgeKind#CONDITIONAL} edges
 * @param input computes the target's input when the edge fires
 */
public record Edge(String from, String to, EdgeKind kind, EdgeCondition condition, NodeInput input) {

  public Edge {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(kind, "kind");
    condition =
        switch (kind) {
          case UNCONDITIONAL -> EdgeCondition.ALWAYS;
          case TERMINAL -> EdgeCondition.NEVER;
          case CONDITIONAL -> Objects.requireNonNull(condition, "condition");
        };
    input = input == null ? NodeInput.runInput() : input;
  }

  /** True when the edge should schedule its target given the current run state. */
  public boolean fires(GraphRun run) {
    return switch (kind) {
      case UNCONDITIONAL -> true;
      case TERMINAL -> false;
      case CONDITIONAL -> condition.test(run);
    };
  }

  @Override
  public String toString() {
    return from + " -" + kind.name().toLowerCase() + "-> " + to;
  }
}
