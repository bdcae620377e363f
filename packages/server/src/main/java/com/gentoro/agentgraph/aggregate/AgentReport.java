package com.gentoro.agentgraph.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.agentgraph.graph.NodeStatus;
import java.util.List;

/** Per-node entry of the report. */
@JsonPropertyOrder({"name", "messages", "execution_time_ms", "status", "tokens_used", "error"})
public record AgentReport(
    @JsonProperty("name") String name,
    @JsonProperty("messages") List<ReportMessage> messages,
    @JsonProperty("execution_time_ms") long executionTimeMs,
    @JsonProperty("status") NodeStatus status,
    @JsonProperty("tokens_used") long tokensUsed,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

  public AgentReport {
    messages = messages == null ? List.of() : List.copyOf(messages);
  }
}
