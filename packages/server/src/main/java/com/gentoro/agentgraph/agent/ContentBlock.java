package com.gentoro.agentgraph.agent;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Objects;

/**
 * One block of an agent message: plain text, a structured JSON value, or the result of a tool call
 * which itself holds text/structured blocks.
 *
 * <p>Tool results nest only as deep as the agent runtime produces them; consumers flatten with an
 * explicit depth cap.
 */
public interface ContentBlock {

  record TextBlock(String text) implements ContentBlock {
    public TextBlock {
      text = text == null ? "" : text;
    }
  }

  record StructuredBlock(JsonNode data) implements ContentBlock {
    public StructuredBlock {
      Objects.requireNonNull(data, "data");
    }
  }

  record ToolResultBlock(String toolName, List<ContentBlock> content, boolean error)
      implements ContentBlock {
    public ToolResultBlock {
      content = content == null ? List.of() : List.copyOf(content);
    }
  }

  static ContentBlock text(String text) {
    return new TextBlock(text);
  }

  static ContentBlock structured(JsonNode data) {
    return new StructuredBlock(data);
  }

  static ContentBlock toolResult(String toolName, List<ContentBlock> content, boolean error) {
    return new ToolResultBlock(toolName, content, error);
  }
}
