package com.gentoro.agentgraph.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.exception.ValidationException;
import com.gentoro.agentgraph.graph.CancellationSignal;
import com.gentoro.agentgraph.graph.event.NoOpGraphEventSink;
import com.gentoro.agentgraph.pipeline.ErrorResponse;
import com.gentoro.agentgraph.pipeline.PipelineResponse;
import com.gentoro.agentgraph.pipeline.PipelineService;
import com.gentoro.agentgraph.utility.JacksonUtility;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * {@code POST /invocations}. Answers with one JSON document (the report or the error object), or,
 * when the client accepts {@code text/event-stream}, with node events followed by that document.
 */
public class InvocationServlet extends HttpServlet {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(InvocationServlet.class);

  /** Caller identity forwarded by the chat front end. */
  public static final String USER_ID_HEADER = "X-Runtime-User-Id";

  private final transient PipelineService pipeline;
  private final Duration requestTimeout;

  /** {@code requestTimeout} bounds one invocation; the running node is abandoned when it expires. */
  public InvocationServlet(PipelineService pipeline, Duration requestTimeout) {
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
  }

  @Override
  protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
    resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
    JsonNode body;
    try {
      body = JacksonUtility.getJsonMapper().readTree(req.getInputStream());
    } catch (IOException e) {
      log.warn("Unreadable invocation body: {}", e.getMessage());
      writeJson(
          resp,
          PipelineResponse.failure(
              ErrorResponse.from(new ValidationException("Invalid payload: body is not JSON", e))));
      return;
    }

    String userId = req.getHeader(USER_ID_HEADER);
    String accept = req.getHeader("Accept");
    if (accept != null && accept.contains("text/event-stream")) {
      resp.setStatus(200);
      resp.setContentType("text/event-stream");
      resp.setHeader("Cache-Control", "no-cache");
      PrintWriter writer = resp.getWriter();
      CancellationSignal signal = new CancellationSignal().cancelAfter(requestTimeout);
      SseGraphEventSink events = new SseGraphEventSink(writer, signal);
      PipelineResponse response = pipeline.invoke(body, userId, events, signal);
      events.send(response.toJson());
      return;
    }

    CancellationSignal signal = new CancellationSignal().cancelAfter(requestTimeout);
    writeJson(resp, pipeline.invoke(body, userId, new NoOpGraphEventSink(), signal));
  }

  private static void writeJson(HttpServletResponse resp, PipelineResponse response)
      throws IOException {
    resp.setStatus(response.httpStatus());
    resp.setContentType("application/json");
    try (PrintWriter out = resp.getWriter()) {
      out.print(response.toJson());
    }
  }
}
