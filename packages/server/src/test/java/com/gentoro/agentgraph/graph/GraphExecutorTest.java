package com.gentoro.agentgraph.graph;

import static com.gentoro.agentgraph.Fixtures.capability;
import static com.gentoro.agentgraph.Fixtures.context;
import static com.gentoro.agentgraph.Fixtures.text;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.graph.event.GraphEventSink;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("GraphExecutor")
class GraphExecutorTest {
  private final GraphExecutor executor = new GraphExecutor(Duration.ofSeconds(10));

  private static Graph slackTavilyBlock(NodeFactory factory, NodeInput followUp) {
    return new GraphBuilder()
        .addNode(factory.build("slack_agent", List.of(capability("slack___history")), "fetch"))
        .addNode(factory.build("tavily_agent", List.of(capability("tavily___extract")), "sum"))
        .addNode(factory.terminal("block_agent"))
        .addEdge("slack_agent", "tavily_agent", null, followUp)
        .addTerminalEdge("tavily_agent", "block_agent")
        .setEntryPoint("slack_agent")
        .build();
  }

  @Test
  @DisplayName("Two agents run in order; the terminal edge target is skipped")
  void runsChainAndSkipsTerminalTarget() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer("slack_agent", inv -> text("https://example.com/a"))
            .answer("tavily_agent", inv -> text("Page A is about testing."));

    GraphRun run =
        executor.execute(
            slackTavilyBlock(new NodeFactory(runtime), NodeInput.fixed("Summarize the URLs")),
            "Summarize Slack URLs",
            context());

    assertEquals(RunStatus.COMPLETED, run.status());
    assertEquals(List.of("slack_agent", "tavily_agent"), runtime.calledNodes());
    assertEquals("Summarize Slack URLs", runtime.invocations.get(0).input());
    assertEquals("Summarize the URLs", runtime.invocations.get(1).input());
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("block_agent"));
    assertEquals(List.of("block_agent"), run.skippedNodes());
    assertEquals(2, run.completedNodes());
    assertEquals(0, run.failedNodes());
    assertEquals(30, run.totalUsage().totalTokens());
    assertEquals(
        List.of("slack_agent", "tavily_agent"),
        run.results().stream().map(NodeResult::nodeId).toList());
  }

  @Test
  @DisplayName("Entry failure fails the run and skips everything downstream")
  void entryFailureSkipsDownstream() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "slack_agent",
                inv -> {
                  throw new IllegalStateException("gateway said no");
                })
            .answer("tavily_agent", inv -> text("never"));

    GraphRun run =
        executor.execute(
            slackTavilyBlock(new NodeFactory(runtime), null), "prompt", context());

    assertEquals(RunStatus.FAILED, run.status());
    assertEquals(NodeStatus.FAILED, run.nodeStatus("slack_agent"));
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("tavily_agent"));
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("block_agent"));
    assertEquals(List.of("slack_agent"), runtime.calledNodes());
    NodeResult failed = run.result("slack_agent").orElseThrow();
    assertEquals(AgentGraphErrorCode.NODE_EXECUTION_ERROR, failed.error().code);
    assertTrue(failed.error().message.contains("gateway said no"));
    assertTrue(run.failureCause().isPresent());
  }

  @Test
  @DisplayName("A condition that never holds leaves its target skipped")
  void falseConditionSkipsTarget() {
    ScriptedRuntime runtime =
        new ScriptedRuntime().answer("a", inv -> text("   ")).answer("b", inv -> text("b"));
    NodeFactory factory = new NodeFactory(runtime);
    Graph graph =
        new GraphBuilder()
            .addNode(factory.build("a", List.of(), "prompt a"))
            .addNode(factory.build("b", List.of(), "prompt b"))
            .addEdge("a", "b", EdgeCondition.producedText("a"))
            .setEntryPoint("a")
            .build();

    GraphRun run = executor.execute(graph, "go", context());

    assertEquals(RunStatus.COMPLETED, run.status());
    assertEquals(NodeStatus.COMPLETED, run.nodeStatus("a"));
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("b"));
    assertEquals(List.of("a"), runtime.calledNodes());
  }

  @Test
  @DisplayName("Upstream text can be threaded into the next node")
  void upstreamTextThreading() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer("slack_agent", inv -> text("  https://example.com/x  "))
            .answer("tavily_agent", inv -> text("summary"));

    executor.execute(
        slackTavilyBlock(new NodeFactory(runtime), NodeInput.upstreamText()), "prompt", context());

    assertEquals("https://example.com/x", runtime.invocations.get(1).input());
  }

  @Test
  @DisplayName("A node reachable twice runs once")
  void nodeRunsAtMostOnce() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer("a", inv -> text("a"))
            .answer("b", inv -> text("b"))
            .answer("c", inv -> text("c"))
            .answer("d", inv -> text("d"));
    NodeFactory f = new NodeFactory(runtime);
    Graph diamond =
        new GraphBuilder()
            .addNode(f.build("a", List.of(), "p"))
            .addNode(f.build("b", List.of(), "p"))
            .addNode(f.build("c", List.of(), "p"))
            .addNode(f.build("d", List.of(), "p"))
            .addEdge("a", "b")
            .addEdge("a", "c")
            .addEdge("b", "d")
            .addEdge("c", "d")
            .setEntryPoint("a")
            .build();

    GraphRun run = executor.execute(diamond, "go", context());

    assertEquals(List.of("a", "b", "c", "d"), runtime.calledNodes());
    assertEquals(4, run.completedNodes());
  }

  @Test
  @DisplayName("Timed-out node fails as cancelled and the rest is skipped")
  void nodeTimeout() {
    CountDownLatch interrupted = new CountDownLatch(1);
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "slack_agent",
                inv -> {
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException e) {
                    interrupted.countDown();
                    Thread.currentThread().interrupt();
                  }
                  return text("late");
                });

    GraphRun run =
        new GraphExecutor(Duration.ofMillis(200))
            .execute(slackTavilyBlock(new NodeFactory(runtime), null), "prompt", context());

    assertEquals(RunStatus.FAILED, run.status());
    NodeResult result = run.result("slack_agent").orElseThrow();
    assertEquals(NodeStatus.FAILED, result.status());
    assertEquals(AgentGraphErrorCode.CANCELLED, result.error().code);
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("tavily_agent"));
    assertDoesNotThrow(() -> assertTrue(interrupted.await(5, TimeUnit.SECONDS)));
  }

  @Test
  @DisplayName("Cancelling the signal abandons the running node")
  void cancellation() throws Exception {
    CountDownLatch started = new CountDownLatch(1);
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "slack_agent",
                inv -> {
                  started.countDown();
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return text("late");
                });
    CancellationSignal signal = new CancellationSignal();
    Thread canceller =
        new Thread(
            () -> {
              try {
                started.await(5, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              signal.cancel("user abort");
            });
    canceller.start();

    GraphRun run =
        executor.execute(
            slackTavilyBlock(new NodeFactory(runtime), null),
            "prompt",
            context(),
            signal,
            new com.gentoro.agentgraph.graph.event.NoOpGraphEventSink());
    canceller.join();

    assertEquals(RunStatus.FAILED, run.status());
    assertEquals(AgentGraphErrorCode.CANCELLED, run.result("slack_agent").orElseThrow().error().code);
    assertTrue(run.result("slack_agent").orElseThrow().error().message.contains("user abort"));
    assertEquals(NodeStatus.SKIPPED, run.nodeStatus("tavily_agent"));
  }

  @Test
  @DisplayName("A throwing edge condition fails its target, not the run loop")
  void throwingConditionFailsTarget() {
    ScriptedRuntime runtime = new ScriptedRuntime().answer("a", inv -> text("a"));
    NodeFactory f = new NodeFactory(runtime);
    Graph graph =
        new GraphBuilder()
            .addNode(f.build("a", List.of(), "p"))
            .addNode(f.build("b", List.of(), "p"))
            .addEdge(
                "a",
                "b",
                run -> {
                  throw new IllegalStateException("bad predicate");
                })
            .setEntryPoint("a")
            .build();

    GraphRun run = executor.execute(graph, "go", context());

    assertEquals(RunStatus.FAILED, run.status());
    assertEquals(NodeStatus.COMPLETED, run.nodeStatus("a"));
    assertEquals(NodeStatus.FAILED, run.nodeStatus("b"));
    assertEquals(List.of("a"), runtime.calledNodes());
  }

  @Test
  @DisplayName("Events arrive in lifecycle order")
  void emitsEvents() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer("slack_agent", inv -> text("x"))
            .answer("tavily_agent", inv -> text("y"));
    List<String> events = new ArrayList<>();
    GraphEventSink sink =
        new GraphEventSink() {
          @Override
          public void onRunStarted(GraphRun run) {
            events.add("run:start");
          }

          @Override
          public void onNodeStarted(GraphRun run, String nodeId) {
            events.add(nodeId + ":start");
          }

          @Override
          public void onNodeFinished(GraphRun run, NodeResult result) {
            events.add(nodeId(result) + ":" + result.status().wireName());
          }

          @Override
          public void onRunFinished(GraphRun run) {
            events.add("run:" + run.status().name().toLowerCase());
          }

          private String nodeId(NodeResult r) {
            return r.nodeId();
          }
        };

    executor.execute(
        slackTavilyBlock(new NodeFactory(runtime), null),
        "go",
        context(),
        new CancellationSignal(),
        sink);

    assertEquals(
        List.of(
            "run:start",
            "slack_agent:start",
            "slack_agent:completed",
            "tavily_agent:start",
            "tavily_agent:completed",
            "run:completed"),
        events);
  }

  @Test
  @DisplayName("A sink can cancel the running node from its heartbeat")
  void heartbeatCancelsRunningNode() {
    ScriptedRuntime runtime =
        new ScriptedRuntime()
            .answer(
                "slack_agent",
                inv -> {
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                  }
                  return text("late");
                });
    CancellationSignal signal = new CancellationSignal();
    List<String> beats = new ArrayList<>();
    GraphEventSink sink =
        new com.gentoro.agentgraph.graph.event.NoOpGraphEventSink() {
          @Override
          public void onHeartbeat(GraphRun run, String nodeId) {
            beats.add(nodeId);
            if (beats.size() == 2) signal.cancel("client disconnected");
          }
        };

    GraphRun run =
        executor.execute(
            slackTavilyBlock(new NodeFactory(runtime), null), "prompt", context(), signal, sink);

    assertEquals(RunStatus.FAILED, run.status());
    assertEquals(List.of("slack_agent", "slack_agent"), beats);
    NodeResult result = run.result("slack_agent").orElseThrow();
    assertEquals(AgentGraphErrorCode.CANCELLED, result.error().code);
    assertTrue(result.error().message.contains("client disconnected"));
    assertTrue(result.durationMs() < 5_000);
  }
}
