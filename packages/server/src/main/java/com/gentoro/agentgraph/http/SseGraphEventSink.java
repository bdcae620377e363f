package com.gentoro.agentgraph.http;

import com.gentoro.agentgraph.graph.CancellationSignal;
import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;
import com.gentoro.agentgraph.graph.event.GraphEventSink;
import com.gentoro.agentgraph.graph.event.GraphEvents;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Streams node events as server-sent events ({@code data: {...}}), with a keepalive comment on every
 * heartbeat. A write error means the client went away; the run is then cancelled through the
 * signal.
 */
public class SseGraphEventSink implements GraphEventSink {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(SseGraphEventSink.class);

  private final PrintWriter writer;
  private final CancellationSignal signal;

  public SseGraphEventSink(PrintWriter writer, CancellationSignal signal) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.signal = Objects.requireNonNull(signal, "signal");
  }

  @Override
  public void onRunStarted(GraphRun run) {}

  @Override
  public void onNodeStarted(GraphRun run, String nodeId) {
    send(JacksonUtility.toJson(GraphEvents.nodeStarted(nodeId)));
  }

  @Override
  public void onNodeFinished(GraphRun run, NodeResult result) {
    send(JacksonUtility.toJson(GraphEvents.nodeFinished(result)));
  }

  /** SSE comment line; ignored by clients, but fails once the connection is gone. */
  @Override
  public void onHeartbeat(GraphRun run, String nodeId) {
    write(": keepalive\n\n");
  }

  @Override
  public void onRunFinished(GraphRun run) {}

  /** Write one event. Also used for the final report or error. */
  public void send(String json) {
    write("data: " + json + "\n\n");
  }

  private synchronized void write(String frame) {
    if (writer.checkError()) return;
    writer.write(frame);
    writer.flush();
    if (writer.checkError()) {
      log.warn("Event stream client disconnected, cancelling run");
      signal.cancel("client disconnected");
    }
  }
}
