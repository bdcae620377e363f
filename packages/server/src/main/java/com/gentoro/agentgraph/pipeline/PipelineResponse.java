package com.gentoro.agentgraph.pipeline;

import com.gentoro.agentgraph.aggregate.Report;
import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.utility.JacksonUtility;

/** Either the aggregated report or the error object of one request. */
public record PipelineResponse(Report report, ErrorResponse error) {

  public static PipelineResponse of(Report report) {
    return new PipelineResponse(report, null);
  }

  public static PipelineResponse failure(ErrorResponse error) {
    return new PipelineResponse(null, error);
  }

  public boolean isError() {
    return error != null;
  }

  /**
   * 400 for a malformed payload, otherwise by error category. A report is always 200, failed nodes
   * are reported in the body.
   */
  public int httpStatus() {
    if (!isError()) return 200;
    if (error.code() == AgentGraphErrorCode.INVALID_ARGUMENT) return 400;
    return error.category().httpStatus();
  }

  public String toJson() {
    return JacksonUtility.toJson(isError() ? error : report);
  }
}
