package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.agent.TokenUsage;
import com.gentoro.agentgraph.exception.ErrorDetails;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Outcome of one node execution.
 *
 * @param invocations agent results in the order the node produced them; empty for terminal nodes
 *     and failed nodes
 * @param error set only when {@code status} is {@link NodeStatus#FAILED}
 */
public record NodeResult(
    String nodeId,
    List<AgentInvocationResult> invocations,
    long durationMs,
    NodeStatus status,
    TokenUsage usage,
    ErrorDetails error) {

  public NodeResult {
    Objects.requireNonNull(nodeId, "nodeId");
    invocations = invocations == null ? List.of() : List.copyOf(invocations);
    Objects.requireNonNull(status, "status");
    usage = usage == null ? TokenUsage.ZERO : usage;
  }

  public static NodeResult completed(
      String nodeId, List<AgentInvocationResult> invocations, long durationMs) {
    TokenUsage usage =
        invocations.stream()
            .map(AgentInvocationResult::usage)
            .reduce(TokenUsage.ZERO, TokenUsage::plus);
    return new NodeResult(nodeId, invocations, durationMs, NodeStatus.COMPLETED, usage, null);
  }

  public static NodeResult failed(String nodeId, long durationMs, Throwable cause) {
    return new NodeResult(
        nodeId,
        List.of(),
        durationMs,
        NodeStatus.FAILED,
        TokenUsage.ZERO,
        ExceptionUtil.toErrorDetails(cause));
  }

  /** Top-level text of every invocation, trimmed, one invocation per line. */
  public String text() {
    return invocations.stream()
        .map(
            inv ->
                inv.content().stream()
                    .filter(ContentBlock.TextBlock.class::isInstance)
                    .map(b -> ((ContentBlock.TextBlock) b).text())
                    .collect(Collectors.joining("\n"))
                    .trim())
        .filter(s -> !s.isEmpty())
        .collect(Collectors.joining("\n"));
  }
}
