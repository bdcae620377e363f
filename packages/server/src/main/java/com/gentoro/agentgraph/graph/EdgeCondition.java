package com.gentoro.agentgraph.graph;

/**
 * Predicate over the accumulated run state deciding whether a conditional edge fires. Must be
 * pure and deterministic for a given run state.
 */
@FunctionalInterface
public interface EdgeCondition {
  EdgeCondition ALWAYS = run -> true;
  EdgeCondition NEVER = run -> false;

  boolean test(GraphRun run);

  /** Fires when the named node completed. */
  static EdgeCondition completed(String nodeId) {
    return run -> run.nodeStatus(nodeId) == NodeStatus.COMPLETED;
  }

  /** Fires when the named node produced non-blank text. */
  static EdgeCondition producedText(String nodeId) {
    return run -> run.result(nodeId).map(r -> !r.text().isBlank()).orElse(false);
  }
}
