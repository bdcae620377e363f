package com.gentoro.agentgraph.graph.event;

import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.util.Map;
import java.util.Objects;

/**
 * Writes every graph event as one JSON line under the {@code [graph.event]} marker, so log
 * consumers can follow a run without a streaming client.
 */
public class LoggingGraphEventSink implements GraphEventSink {
  private final org.slf4j.Logger log;

  public LoggingGraphEventSink(org.slf4j.Logger logger) {
    this.log = Objects.requireNonNull(logger, "logger");
  }

  @Override
  public void onRunStarted(GraphRun run) {
    emit(GraphEvents.runStarted(run));
  }

  @Override
  public void onNodeStarted(GraphRun run, String nodeId) {
    emit(GraphEvents.nodeStarted(nodeId));
  }

  @Override
  public void onNodeFinished(GraphRun run, NodeResult result) {
    emit(GraphEvents.nodeFinished(result));
  }

  @Override
  public void onRunFinished(GraphRun run) {
    emit(GraphEvents.runFinished(run));
  }

  void emit(Map<String, Object> payload) {
    log.info("[graph.event] {}", JacksonUtility.toJson(payload));
  }
}
