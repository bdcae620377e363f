package com.gentoro.agentgraph.aggregate;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.agentgraph.graph.RunStatus;
import java.util.List;

/**
 * Aggregated outcome of one graph run, as returned to the chat client. Field order is fixed so the
 * same run always serializes to the same bytes.
 */
@JsonPropertyOrder({
  "status",
  "agents",
  "total_execution_time_ms",
  "total_tokens",
  "mcp_tools_used",
  "full_text",
  "metadata",
  "error"
})
public record Report(
    @JsonProperty("status") RunStatus status,
    @JsonProperty("agents") List<AgentReport> agents,
    @JsonProperty("total_execution_time_ms") long totalExecutionTimeMs,
    @JsonProperty("total_tokens") long totalTokens,
    @JsonProperty("mcp_tools_used") boolean capabilitiesUsed,
    @JsonProperty("full_text") String fullText,
    @JsonProperty("metadata") ReportMetadata metadata,
    @JsonProperty("error") @JsonInclude(JsonInclude.Include.NON_NULL) String error) {

  /** Shown as {@code full_text} when no node produced any text. */
  public static final String NO_CONTENT = "(no content)";

  public Report {
    agents = agents == null ? List.of() : List.copyOf(agents);
  }
}
