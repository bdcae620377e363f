package com.gentoro.agentgraph.graph;

import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NodeExecutionException;
import com.gentoro.agentgraph.graph.event.GraphEventSink;
import com.gentoro.agentgraph.graph.event.NoOpGraphEventSink;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import org.slf4j.MDC;

/**
 * Sequential graph executor.
 *
 * <p>Scheduled nodes run one at a time in FIFO order, each at most once. A completed node fires its
 * outgoing edges in declaration order; a failed node fires nothing. Nodes that never get scheduled
 * end as {@link NodeStatus#SKIPPED}.
 *
 * <p>Every node runs on a single worker thread owned by the run while the calling thread waits
 * with a deadline, so a cancelled or timed-out node can be abandoned. Such a node fails with a
 * {@link AgentGraphErrorCode#CANCELLED} error, the run fails and the remaining nodes are skipped.
 */
public class GraphExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(GraphExecutor.class);

  private static final long POLL_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

  private final Duration nodeTimeout;

  public GraphExecutor(Duration nodeTimeout) {
    this.nodeTimeout = Objects.requireNonNull(nodeTimeout, "nodeTimeout");
    if (nodeTimeout.isZero() || nodeTimeout.isNegative()) {
      throw new IllegalArgumentException("nodeTimeout must be positive: " + nodeTimeout);
    }
  }

  public GraphRun execute(Graph graph, String initialInput, RequestContext context) {
    return execute(
        graph, initialInput, context, new CancellationSignal(), new NoOpGraphEventSink());
  }

  public GraphRun execute(
      Graph graph,
      String initialInput,
      RequestContext context,
      CancellationSignal signal,
      GraphEventSink events) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(signal, "signal");
    Objects.requireNonNull(events, "events");

    GraphRun run = new GraphRun(graph, initialInput);
    Deque<Scheduled> queue = new ArrayDeque<>();
    Set<String> scheduled = new HashSet<>();
    queue.add(new Scheduled(graph.entryPoint(), run.initialInput()));
    scheduled.add(graph.entryPoint());

    ExecutorService worker =
        Executors.newSingleThreadExecutor(
            r -> {
              Thread t = new Thread(r, "graph-node-" + context.correlationId());
              t.setDaemon(true);
              return t;
            });

    Throwable runCause = null;
    run.start();
    notify(events, e -> e.onRunStarted(run));
    log.info(
        "Graph run started: {} nodes, entry '{}'", graph.size(), graph.entryPoint());
    try {
      while (!queue.isEmpty()) {
        Scheduled next = queue.poll();
        GraphNode node = graph.node(next.nodeId());

        run.markRunning(node.id());
        notify(events, e -> e.onNodeStarted(run, node.id()));
        log.info("Node '{}' ({}) started", node.id(), node.kind());

        long started = System.nanoTime();
        NodeResult result;
        boolean abandoned = false;
        try {
          List<AgentInvocationResult> output =
              runOnWorker(worker, run, node, next.input(), context, signal, events);
          result = NodeResult.completed(node.id(), output, elapsedMs(started));
        } catch (NodeExecutionException e) {
          abandoned = e.getCode() == AgentGraphErrorCode.CANCELLED;
          result = NodeResult.failed(node.id(), elapsedMs(started), e);
          if (runCause == null) runCause = e;
          log.error("Node '{}' failed: {}", node.id(), ExceptionUtil.describe(e));
        }

        run.record(result);
        NodeResult finished = result;
        notify(events, e -> e.onNodeFinished(run, finished));
        log.info(
            "Node '{}' finished with status {} in {} ms",
            node.id(),
            result.status(),
            result.durationMs());

        if (abandoned) break;
        if (result.status() == NodeStatus.COMPLETED) {
          runCause = schedule(graph, run, result, queue, scheduled, events, runCause);
        }
      }
    } catch (RuntimeException e) {
      log.error("Graph run aborted: {}", ExceptionUtil.describe(e), e);
      if (runCause == null) runCause = e;
    } finally {
      worker.shutdownNow();
      run.finish(runCause);
      log.info(
          "Graph run {}: {} completed, {} failed, {} skipped in {} ms",
          run.status(),
          run.completedNodes(),
          run.failedNodes(),
          run.skippedNodes().size(),
          run.executionTimeMs());
      notify(events, e -> e.onRunFinished(run));
    }
    return run;
  }

  /** Fires the outgoing edges of a completed node; returns the (possibly updated) run cause. */
  private Throwable schedule(
      Graph graph,
      GraphRun run,
      NodeResult upstream,
      Deque<Scheduled> queue,
      Set<String> scheduled,
      GraphEventSink events,
      Throwable runCause) {
    for (Edge edge : graph.outgoing(upstream.nodeId())) {
      if (scheduled.contains(edge.to())) continue;
      try {
        if (!edge.fires(run)) {
          log.debug("Edge {} not taken", edge);
          continue;
        }
        String input = edge.input().resolve(run, upstream);
        queue.add(new Scheduled(edge.to(), input));
        scheduled.add(edge.to());
        log.debug("Edge {} fired", edge);
      } catch (RuntimeException e) {
        NodeExecutionException failure =
            new NodeExecutionException(
                edge.to(),
                "Evaluating edge %s failed: %s".formatted(edge, ExceptionUtil.describe(e)),
                e);
        log.error(failure.getMessage());
        scheduled.add(edge.to());
        NodeResult failed = NodeResult.failed(edge.to(), 0L, failure);
        run.record(failed);
        notify(events, s -> s.onNodeFinished(run, failed));
        if (runCause == null) runCause = failure;
      }
    }
    return runCause;
  }

  private List<AgentInvocationResult> runOnWorker(
      ExecutorService worker,
      GraphRun run,
      GraphNode node,
      String input,
      RequestContext context,
      CancellationSignal signal,
      GraphEventSink events) {
    Map<String, String> mdc = MDC.getCopyOfContextMap();
    Future<List<AgentInvocationResult>> future =
        worker.submit(
            () -> {
              if (mdc != null) MDC.setContextMap(mdc);
              try {
                return node.execute(input, context);
              } finally {
                MDC.clear();
              }
            });

    long deadline = System.nanoTime() + nodeTimeout.toNanos();
    while (true) {
      if (signal.isCancelled()) {
        future.cancel(true);
        throw NodeExecutionException.cancelled(node.id(), signal.reason(), null);
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0) {
        future.cancel(true);
        throw NodeExecutionException.cancelled(
            node.id(), "timed out after " + nodeTimeout, null);
      }
      try {
        List<AgentInvocationResult> output =
            future.get(Math.min(remaining, POLL_NANOS), TimeUnit.NANOSECONDS);
        return output == null ? List.of() : output;
      } catch (TimeoutException e) {
        notify(events, s -> s.onHeartbeat(run, node.id()));
      } catch (ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        if (cause instanceof NodeExecutionException nee) throw nee;
        throw new NodeExecutionException(
            node.id(),
            "Node '%s' failed: %s".formatted(node.id(), ExceptionUtil.describe(cause)),
            cause);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        future.cancel(true);
        throw NodeExecutionException.cancelled(node.id(), "executor thread interrupted", e);
      }
    }
  }

  private static void notify(GraphEventSink events, Consumer<GraphEventSink> call) {
    try {
      call.accept(events);
    } catch (RuntimeException e) {
      log.warn("Graph event sink failed: {}", ExceptionUtil.describe(e));
    }
  }

  private static long elapsedMs(long startedNanos) {
    return (System.nanoTime() - startedNanos) / 1_000_000L;
  }

  private record Scheduled(String nodeId, String input) {}
}
