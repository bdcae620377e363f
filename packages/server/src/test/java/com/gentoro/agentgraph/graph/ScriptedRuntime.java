package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocation;
import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.AgentRuntime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/** Agent runtime answering per node id; records every invocation it receives. */
final class ScriptedRuntime implements AgentRuntime {
  final List<AgentInvocation> invocations = new ArrayList<>();
  private final Map<String, Function<AgentInvocation, AgentInvocationResult>> answers =
      new HashMap<>();

  ScriptedRuntime answer(String nodeId, Function<AgentInvocation, AgentInvocationResult> answer) {
    answers.put(nodeId, answer);
    return this;
  }

  @Override
  public synchronized AgentInvocationResult invoke(AgentInvocation invocation) {
    invocations.add(invocation);
    Function<AgentInvocation, AgentInvocationResult> answer = answers.get(invocation.nodeId());
    if (answer == null) {
      throw new IllegalStateException("no answer scripted for " + invocation.nodeId());
    }
    return answer.apply(invocation);
  }

  synchronized List<String> calledNodes() {
    return invocations.stream().map(AgentInvocation::nodeId).toList();
  }
}
