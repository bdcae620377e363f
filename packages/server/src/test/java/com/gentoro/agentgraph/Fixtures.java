package com.gentoro.agentgraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.agent.TokenUsage;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.util.List;

/** Shared builders for tests. */
public final class Fixtures {
  private Fixtures() {}

  public static RequestContext context() {
    return new RequestContext("session-1", "user-1", "workload-1", "correlation-1");
  }

  public static Capability capability(String name) {
    return new Capability(
        name,
        "test capability " + name,
        null,
        args -> new ContentBlock.ToolResultBlock(name, List.of(ContentBlock.text("ok")), false));
  }

  public static AgentInvocationResult text(String text) {
    return AgentInvocationResult.ofText(text, new TokenUsage(10, 5));
  }

  public static JsonNode json(String raw) {
    try {
      return JacksonUtility.getJsonMapper().readTree(raw);
    } catch (Exception e) {
      throw new IllegalArgumentException(raw, e);
    }
  }
}
