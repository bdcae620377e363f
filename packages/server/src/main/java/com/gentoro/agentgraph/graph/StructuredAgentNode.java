package com.gentoro.agentgraph.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.AgentRuntime;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.utility.JacksonUtility;
import com.gentoro.agentgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;

/**
 * Agent node whose text output is expected to be JSON. Each text block holding a JSON object or
 * array, bare or inside a {@code ```json} fence, becomes a structured block; anything else stays
 * text.
 */
public class StructuredAgentNode extends AgentNode {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(StructuredAgentNode.class);

  public StructuredAgentNode(
      String id, List<Capability> capabilities, String systemPrompt, AgentRuntime runtime) {
    super(id, capabilities, systemPrompt, runtime);
  }

  @Override
  public NodeKind kind() {
    return NodeKind.STRUCTURED;
  }

  @Override
  protected AgentInvocationResult postProcess(AgentInvocationResult result) {
    List<ContentBlock> blocks = new ArrayList<>(result.content().size());
    for (ContentBlock block : result.content()) {
      if (block instanceof ContentBlock.TextBlock text) {
        JsonNode parsed = parseJson(text.text());
        blocks.add(parsed != null ? ContentBlock.structured(parsed) : block);
      } else {
        blocks.add(block);
      }
    }
    return new AgentInvocationResult(blocks, result.usage());
  }

  private JsonNode parseJson(String text) {
    String candidate = StringUtility.extractSnippet(text, "json");
    if (candidate == null) candidate = text.trim();
    if (!(candidate.startsWith("{") || candidate.startsWith("["))) return null;
    try {
      JsonNode node = JacksonUtility.getStrictJsonMapper().readTree(candidate);
      return node != null && node.isContainerNode() ? node : null;
    } catch (Exception e) {
      log.debug("Node {} output is not JSON, keeping it as text", id());
      return null;
    }
  }
}
