package com.gentoro.agentgraph.agent;

/**
 * The external agent runtime: model invocation plus the tool-calling loop. The graph engine calls
 * it once per node execution and treats any exception as a failure of that node.
 *
 * <p>Implementations must honour thread interruption so that a cancelled run can abandon an
 * in-flight invocation.
 */
@FunctionalInterface
public interface AgentRuntime {
  AgentInvocationResult invoke(AgentInvocation invocation);
}
