package com.gentoro.agentgraph.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, validated agent graph: nodes and edges in declaration order plus the entry node.
 * Instances come only from {@link GraphBuilder#build()}.
 */
public final class Graph {
  private final Map<String, GraphNode> nodes;
  private final List<Edge> edges;
  private final String entryPoint;

  Graph(Map<String, GraphNode> nodes, List<Edge> edges, String entryPoint) {
    this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
    this.edges = List.copyOf(edges);
    this.entryPoint = Objects.requireNonNull(entryPoint, "entryPoint");
  }

  public GraphNode node(String id) {
    return nodes.get(id);
  }

  public List<GraphNode> nodes() {
    return List.copyOf(nodes.values());
  }

  public List<String> nodeIds() {
    return List.copyOf(nodes.keySet());
  }

  public List<Edge> edges() {
    return edges;
  }

  /** Edges leaving {@code nodeId}, in declaration order. */
  public List<Edge> outgoing(String nodeId) {
    return edges.stream().filter(e -> e.from().equals(nodeId)).toList();
  }

  public String entryPoint() {
    return entryPoint;
  }

  public int size() {
    return nodes.size();
  }

  @Override
  public String toString() {
    return "Graph{entry=" + entryPoint + ", nodes=" + nodes.keySet() + ", edges=" + edges + "}";
  }
}
