package com.gentoro.agentgraph.graph.event;

import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;

/**
 * Receives lifecycle events of a graph run. Called on the executor's driver thread;
 * implementations should return quickly. Exceptions thrown here are logged and do not affect the
 * run.
 */
public interface GraphEventSink {

  void onRunStarted(GraphRun run);

  void onNodeStarted(GraphRun run, String nodeId);

  void onNodeFinished(GraphRun run, NodeResult result);

  /**
   * Called periodically while {@code nodeId} is running. Sinks holding a connection use it to
   * notice a client that went away.
   */
  default void onHeartbeat(GraphRun run, String nodeId) {}

  /** Last event of a run; {@code run} is already completed or failed. */
  void onRunFinished(GraphRun run);
}
