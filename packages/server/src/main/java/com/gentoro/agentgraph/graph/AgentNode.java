package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocation;
import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.AgentRuntime;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NodeExecutionException;
import java.util.List;
import java.util.Objects;

/** Node backed by one call into the agent runtime; keeps the agent output as produced. */
public class AgentNode implements GraphNode {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(AgentNode.class);

  private final String id;
  private final List<Capability> capabilities;
  private final String systemPrompt;
  private final AgentRuntime runtime;

  public AgentNode(
      String id, List<Capability> capabilities, String systemPrompt, AgentRuntime runtime) {
    this.id = Objects.requireNonNull(id, "id");
    this.capabilities = List.copyOf(capabilities);
    this.systemPrompt = Objects.requireNonNullElse(systemPrompt, "");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public NodeKind kind() {
    return NodeKind.TEXT;
  }

  @Override
  public List<Capability> capabilities() {
    return capabilities;
  }

  @Override
  public String systemPrompt() {
    return systemPrompt;
  }

  @Override
  public List<AgentInvocationResult> execute(String input, RequestContext context) {
    log.debug("Node {} invoking agent runtime with {} capabilities", id, capabilities.size());
    AgentInvocationResult result;
    try {
      result =
          runtime.invoke(new AgentInvocation(id, systemPrompt, capabilities, input, context));
    } catch (NodeExecutionException e) {
      throw e;
    } catch (Exception e) {
      throw new NodeExecutionException(
          id, "Agent invocation for node '%s' failed: %s".formatted(id, ExceptionUtil.describe(e)), e);
    }
    if (result == null) {
      throw new NodeExecutionException(
          id, "Agent runtime returned no result for node '%s'".formatted(id), null);
    }
    return List.of(postProcess(result));
  }

  /** Hook for node kinds that reshape the agent output. */
  protected AgentInvocationResult postProcess(AgentInvocationResult result) {
    return result;
  }
}
