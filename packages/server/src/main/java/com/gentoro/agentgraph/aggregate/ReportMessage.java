package com.gentoro.agentgraph.aggregate;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One message of an agent entry: {@code {"type":"text","content":"..."}} or {@code
 * {"type":"json","content":{...}}}.
 */
@JsonPropertyOrder({"type", "content"})
public record ReportMessage(String type, Object content) {
  public static final String TEXT = "text";
  public static final String JSON = "json";

  public static ReportMessage text(String text) {
    return new ReportMessage(TEXT, text);
  }

  public static ReportMessage json(JsonNode data) {
    return new ReportMessage(JSON, data);
  }
}
