package com.gentoro.agentgraph.context;

import java.util.Objects;
import java.util.UUID;

/**
 * Per-request identity passed explicitly from catalog discovery through graph execution to report
 * aggregation. Immutable; one instance per inbound invocation.
 *
 * @param sessionId chat session the request belongs to
 * @param userId identity the runtime acts for
 * @param workloadName workload identity used for token exchange
 * @param correlationId unique id of this request, used to correlate log lines
 */
public record RequestContext(
    String sessionId, String userId, String workloadName, String correlationId) {

  public RequestContext {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(workloadName, "workloadName");
    Objects.requireNonNull(correlationId, "correlationId");
  }

  /** New context with a freshly generated correlation id. */
  public static RequestContext create(String sessionId, String userId, String workloadName) {
    return new RequestContext(
        sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId,
        userId,
        workloadName,
        UUID.randomUUID().toString());
  }
}
