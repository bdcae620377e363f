package com.gentoro.agentgraph.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.exception.ErrorDetails;
import com.gentoro.agentgraph.exception.ExceptionUtil;

/** The single error object returned for a failed request. */
@JsonPropertyOrder({"error", "category", "code"})
public record ErrorResponse(
    @JsonProperty("error") String error,
    @JsonProperty("category") ErrorCategory category,
    @JsonProperty("code") AgentGraphErrorCode code) {

  public static ErrorResponse from(Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    return new ErrorResponse(details.message, ErrorCategory.of(t), details.code);
  }
}
