package com.gentoro.agentgraph.agent;

import java.util.List;

/** One message produced by a single agent invocation: ordered content blocks plus usage. */
public record AgentInvocationResult(List<ContentBlock> content, TokenUsage usage) {
  public AgentInvocationResult {
    content = content == null ? List.of() : List.copyOf(content);
    usage = usage == null ? TokenUsage.ZERO : usage;
  }

  public static AgentInvocationResult ofText(String text, TokenUsage usage) {
    return new AgentInvocationResult(List.of(ContentBlock.text(text)), usage);
  }
}
