package com.gentoro.agentgraph.context;

import org.slf4j.MDC;

/**
 * Puts the identifiers of a {@link RequestContext} into the SLF4J MDC for the lifetime of a
 * try-with-resources block and removes them on close.
 */
public final class LogContext implements AutoCloseable {
  public static final String MDC_SESSION_ID = "sessionId";
  public static final String MDC_CORRELATION_ID = "correlationId";
  public static final String MDC_USER_ID = "userId";

  public LogContext(RequestContext context) {
    if (context != null) {
      MDC.put(MDC_SESSION_ID, context.sessionId());
      MDC.put(MDC_CORRELATION_ID, context.correlationId());
      MDC.put(MDC_USER_ID, context.userId());
    }
  }

  @Override
  public void close() {
    MDC.remove(MDC_SESSION_ID);
    MDC.remove(MDC_CORRELATION_ID);
    MDC.remove(MDC_USER_ID);
  }
}
