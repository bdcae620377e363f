package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.context.RequestContext;
import java.util.List;
import java.util.Objects;

/** Degenerate node with no capabilities and no prompt. Executing it produces nothing. */
public class TerminalNode implements GraphNode {
  private final String id;

  public TerminalNode(String id) {
    this.id = Objects.requireNonNull(id, "id");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TERMINAL;
  }

  @Override
  public List<Capability> capabilities() {
    return List.of();
  }

  @Override
  public String systemPrompt() {
    return "";
  }

  @Override
  public List<AgentInvocationResult> execute(String input, RequestContext context) {
    return List.of();
  }
}
