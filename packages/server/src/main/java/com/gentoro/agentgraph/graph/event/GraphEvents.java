package com.gentoro.agentgraph.graph.event;

import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Payload shapes shared by the event sinks. Node events look like {@code {"type":"node",
 * "name":"slack_agent","phase":"start"}}; run events use {@code "type":"run"}.
 */
public final class GraphEvents {
  private GraphEvents() {}

  public static Map<String, Object> runStarted(GraphRun run) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "run");
    payload.put("phase", "start");
    payload.put("entry", run.graph().entryPoint());
    payload.put("total_nodes", run.totalNodes());
    return payload;
  }

  public static Map<String, Object> nodeStarted(String nodeId) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "node");
    payload.put("name", nodeId);
    payload.put("phase", "start");
    return payload;
  }

  public static Map<String, Object> nodeFinished(NodeResult result) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "node");
    payload.put("name", result.nodeId());
    payload.put("phase", "end");
    payload.put("status", result.status().wireName());
    payload.put("execution_time_ms", result.durationMs());
    if (result.error() != null) payload.put("error", result.error().message);
    return payload;
  }

  public static Map<String, Object> runFinished(GraphRun run) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "run");
    payload.put("phase", "end");
    payload.put("status", run.status().name().toLowerCase(java.util.Locale.ROOT));
    payload.put("completed_nodes", run.completedNodes());
    payload.put("failed_nodes", run.failedNodes());
    payload.put("execution_time_ms", run.executionTimeMs());
    return payload;
  }
}
