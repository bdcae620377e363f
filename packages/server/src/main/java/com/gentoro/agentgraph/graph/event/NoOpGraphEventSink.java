package com.gentoro.agentgraph.graph.event;

import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;

/** Used when nobody listens for graph events. */
public class NoOpGraphEventSink implements GraphEventSink {
  @Override
  public void onRunStarted(GraphRun run) {}

  @Override
  public void onNodeStarted(GraphRun run, String nodeId) {}

  @Override
  public void onNodeFinished(GraphRun run, NodeResult result) {}

  @Override
  public void onRunFinished(GraphRun run) {}
}
