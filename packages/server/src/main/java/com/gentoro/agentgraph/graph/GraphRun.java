package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.TokenUsage;
import com.gentoro.agentgraph.exception.StateException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one execution of a {@link Graph}. Mutated only by {@link GraphExecutor} on the driver
 * thread; readers see results in completion order.
 */
public final class GraphRun {
  private final Graph graph;
  private final String initialInput;
  private final Map<String, NodeStatus> nodeStatuses = new LinkedHashMap<>();
  private final Map<String, NodeResult> results = new LinkedHashMap<>();
  private RunStatus status = RunStatus.PENDING;
  private long startedNanos;
  private long executionTimeMs;
  private Throwable failureCause;

  GraphRun(Graph graph, String initialInput) {
    this.graph = Objects.requireNonNull(graph, "graph");
    this.initialInput = initialInput == null ? "" : initialInput;
    for (String id : graph.nodeIds()) {
      nodeStatuses.put(id, NodeStatus.PENDING);
    }
  }

  public Graph graph() {
    return graph;
  }

  public String initialInput() {
    return initialInput;
  }

  public RunStatus status() {
    return status;
  }

  public NodeStatus nodeStatus(String nodeId) {
    return nodeStatuses.get(nodeId);
  }

  /** Per-node status in declaration order. */
  public Map<String, NodeStatus> nodeStatuses() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(nodeStatuses));
  }

  public Optional<NodeResult> result(String nodeId) {
    return Optional.ofNullable(results.get(nodeId));
  }

  /** Results of executed nodes in completion order. */
  public List<NodeResult> results() {
    return List.copyOf(results.values());
  }

  /** Ids of skipped nodes in declaration order. */
  public List<String> skippedNodes() {
    return nodeStatuses.entrySet().stream()
        .filter(e -> e.getValue() == NodeStatus.SKIPPED)
        .map(Map.Entry::getKey)
        .toList();
  }

  public int totalNodes() {
    return nodeStatuses.size();
  }

  public int completedNodes() {
    return count(NodeStatus.COMPLETED);
  }

  public int failedNodes() {
    return count(NodeStatus.FAILED);
  }

  public TokenUsage totalUsage() {
    return results.values().stream()
        .map(NodeResult::usage)
        .reduce(TokenUsage.ZERO, TokenUsage::plus);
  }

  public long executionTimeMs() {
    return executionTimeMs;
  }

  public Optional<Throwable> failureCause() {
    return Optional.ofNullable(failureCause);
  }

  private int count(NodeStatus s) {
    return (int) nodeStatuses.values().stream().filter(v -> v == s).count();
  }

  void start() {
    if (status != RunStatus.PENDING) {
      throw new StateException("Graph run already started (status " + status + ")");
    }
    status = RunStatus.RUNNING;
    startedNanos = System.nanoTime();
  }

  void markRunning(String nodeId) {
    nodeStatuses.put(nodeId, NodeStatus.RUNNING);
  }

  void record(NodeResult result) {
    results.put(result.nodeId(), result);
    nodeStatuses.put(result.nodeId(), result.status());
  }

  /** Skips every node that never ran and settles the run status. */
  void finish(Throwable cause) {
    nodeStatuses.replaceAll((id, s) -> s.isTerminal() ? s : NodeStatus.SKIPPED);
    failureCause = cause;
    status = cause != null || failedNodes() > 0 ? RunStatus.FAILED : RunStatus.COMPLETED;
    executionTimeMs = (System.nanoTime() - startedNanos) / 1_000_000L;
  }
}
