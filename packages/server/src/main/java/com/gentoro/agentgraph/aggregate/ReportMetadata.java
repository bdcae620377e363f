package com.gentoro.agentgraph.aggregate;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"session_id", "total_nodes", "completed_nodes", "failed_nodes"})
public record ReportMetadata(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("total_nodes") int totalNodes,
    @JsonProperty("completed_nodes") int completedNodes,
    @JsonProperty("failed_nodes") int failedNodes) {}
