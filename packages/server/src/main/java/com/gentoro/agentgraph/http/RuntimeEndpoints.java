package com.gentoro.agentgraph.http;

import com.gentoro.agentgraph.pipeline.PipelineService;
import java.time.Duration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;

/** Registers the runtime endpoints ({@code /invocations}, {@code /ping}) on the shared server. */
public final class RuntimeEndpoints {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(RuntimeEndpoints.class);

  private RuntimeEndpoints() {}

  public static void register(
      EmbeddedJettyServer server, PipelineService pipeline, Duration requestTimeout) {
    server
        .getContextHandler()
        .addServlet(
            new ServletHolder(new InvocationServlet(pipeline, requestTimeout)), "/invocations");
    server.getContextHandler().addServlet(new ServletHolder(new PingServlet()), "/ping");
    log.info("Runtime endpoints registered at /invocations and /ping");
  }
}
