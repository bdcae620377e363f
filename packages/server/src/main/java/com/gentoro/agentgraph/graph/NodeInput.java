package com.gentoro.agentgraph.graph;

import java.util.Objects;

/**
 * Computes the input handed to the target of a fired edge.
 *
 * <p>The default passes the run's initial input on unchanged. {@link #fixed(String)} hands every
 * target the same prompt regardless of upstream output. {@link #upstreamText()} threads the
 * upstream node's text into the target.
 */
@FunctionalInterface
public interface NodeInput {
  String resolve(GraphRun run, NodeResult upstream);

  static NodeInput runInput() {
    return (run, upstream) -> run.initialInput();
  }

  static NodeInput fixed(String prompt) {
    Objects.requireNonNull(prompt, "prompt");
    return (run, upstream) -> prompt;
  }

  /** Upstream text output, or the run input when the upstream produced no text. */
  static NodeInput upstreamText() {
    return (run, upstream) -> {
      String text = upstream == null ? "" : upstream.text();
      return text.isBlank() ? run.initialInput() : text;
    };
  }
}
