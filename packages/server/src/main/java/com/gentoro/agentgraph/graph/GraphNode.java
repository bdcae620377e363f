package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.context.RequestContext;
import java.util.List;

/**
 * One agent-execution unit of a graph: a capability subset plus instructions. Executed at most
 * once per run.
 */
public interface GraphNode {
  /** Unique within a graph. */
  String id();

  NodeKind kind();

  List<Capability> capabilities();

  String systemPrompt();

  /**
   * Run the node once.
   *
   * @return agent results in production order; empty for a terminal node
   * @throws com.gentoro.agentgraph.exception.NodeExecutionException when the agent runtime fails
   */
  List<AgentInvocationResult> execute(String input, RequestContext context);
}
