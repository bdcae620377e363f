package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.exception.GraphValidationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable builder for {@link Graph}. Structural errors are reported by {@link #build()}, never
 * during execution.
 *
 * <pre>{@code
 * Graph graph =
 *     new GraphBuilder()
 *         .addNode(slack)
 *         .addNode(tavily)
 *         .addEdge("slack_agent", "tavily_agent")
 *         .setEntryPoint("slack_agent")
 *         .build();
 * }</pre>
 */
public class GraphBuilder {
  private final List<GraphNode> nodes = new ArrayList<>();
  private final List<Edge> edges = new ArrayList<>();
  private String entryPoint;

  public GraphBuilder addNode(GraphNode node) {
    nodes.add(Objects.requireNonNull(node, "node"));
    return this;
  }

  public GraphBuilder addEdge(String from, String to) {
    edges.add(new Edge(from, to, EdgeKind.UNCONDITIONAL, null, null));
    return this;
  }

  public GraphBuilder addEdge(String from, String to, EdgeCondition condition) {
    return addEdge(from, to, condition, null);
  }

  /**
   * Edge with an optional condition and input resolver. A null condition makes the edge
   * unconditional.
   */
  public GraphBuilder addEdge(String from, String to, EdgeCondition condition, NodeInput input) {
    EdgeKind kind = condition == null ? EdgeKind.UNCONDITIONAL : EdgeKind.CONDITIONAL;
    edges.add(new Edge(from, to, kind, condition, input));
    return this;
  }

  /** Structural link that never schedules its target. */
  public GraphBuilder addTerminalEdge(String from, String to) {
    edges.add(new Edge(from, to, EdgeKind.TERMINAL, null, null));
    return this;
  }

  public GraphBuilder setEntryPoint(String nodeId) {
    this.entryPoint = nodeId;
    return this;
  }

  public Graph build() {
    Map<String, GraphNode> byId = new LinkedHashMap<>();
    for (GraphNode node : nodes) {
      if (byId.putIfAbsent(node.id(), node) != null) {
        throw new GraphValidationException("Duplicate node id '%s'".formatted(node.id()));
      }
    }
    if (entryPoint == null || entryPoint.isBlank()) {
      throw new GraphValidationException("No entry point set");
    }
    if (!byId.containsKey(entryPoint)) {
      throw new GraphValidationException(
          "Entry point '%s' is not a node of the graph".formatted(entryPoint));
    }
    for (Edge edge : edges) {
      if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
        throw new GraphValidationException(
            "Edge %s references an undefined node".formatted(edge));
      }
    }

    Set<String> reached = new HashSet<>();
    Deque<String> pending = new ArrayDeque<>();
    pending.push(entryPoint);
    while (!pending.isEmpty()) {
      String id = pending.pop();
      if (!reached.add(id)) continue;
      for (Edge edge : edges) {
        if (edge.from().equals(id)) pending.push(edge.to());
      }
    }
    List<String> unreachable =
        byId.keySet().stream().filter(id -> !reached.contains(id)).toList();
    if (!unreachable.isEmpty()) {
      throw new GraphValidationException(
          "Nodes %s are not reachable from entry point '%s'".formatted(unreachable, entryPoint));
    }
    return new Graph(byId, edges, entryPoint);
  }
}
