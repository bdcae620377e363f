package com.gentoro.agentgraph.agent;

import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.context.RequestContext;
import java.util.List;
import java.util.Objects;

/**
 * Everything the agent runtime needs for one call: which node asks, its instructions, the
 * capabilities it may use, and the user-turn input.
 */
public record AgentInvocation(
    String nodeId,
    String systemPrompt,
    List<Capability> capabilities,
    String input,
    RequestContext context) {

  public AgentInvocation {
    Objects.requireNonNull(nodeId, "nodeId");
    systemPrompt = systemPrompt == null ? "" : systemPrompt;
    capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    input = input == null ? "" : input;
    Objects.requireNonNull(context, "context");
  }
}
