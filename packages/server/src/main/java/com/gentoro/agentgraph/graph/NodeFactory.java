package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentRuntime;
import com.gentoro.agentgraph.catalog.Capability;
import java.util.List;
import java.util.Objects;

/** Builds graph nodes bound to one agent runtime. */
public class NodeFactory {
  private final AgentRuntime runtime;

  public NodeFactory(AgentRuntime runtime) {
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  /**
   * Text-producing node, or a {@link TerminalNode} when there are no capabilities and no prompt.
   */
  public GraphNode build(String id, List<Capability> capabilities, String prompt) {
    if (isDegenerate(capabilities, prompt)) {
      return new TerminalNode(id);
    }
    return new AgentNode(id, capabilities == null ? List.of() : capabilities, prompt, runtime);
  }

  /** Structured-data node, or a {@link TerminalNode} for the degenerate case. */
  public GraphNode structured(String id, List<Capability> capabilities, String prompt) {
    if (isDegenerate(capabilities, prompt)) {
      return new TerminalNode(id);
    }
    return new StructuredAgentNode(
        id, capabilities == null ? List.of() : capabilities, prompt, runtime);
  }

  public GraphNode terminal(String id) {
    return new TerminalNode(id);
  }

  private static boolean isDegenerate(List<Capability> capabilities, String prompt) {
    return (capabilities == null || capabilities.isEmpty()) && (prompt == null || prompt.isBlank());
  }
}
