package com.gentoro.agentgraph.aggregate;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.agent.AgentInvocationResult;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeResult;
import com.gentoro.agentgraph.graph.NodeStatus;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Folds a finished {@link GraphRun} into a {@link Report}.
 *
 * <p>Text and structured content of every invocation is collected, including content nested in
 * tool results up to {@link #MAX_DEPTH} levels. The aggregator reads nothing but the run, so
 * aggregating the same run twice gives equal reports.
 */
public class ResultAggregator {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(ResultAggregator.class);

  /** Deepest tool-result nesting that is still collected. */
  public static final int MAX_DEPTH = 3;

  private final CapabilityUsageDetector detector;

  public ResultAggregator(CapabilityUsageDetector detector) {
    this.detector = Objects.requireNonNull(detector, "detector");
  }

  public ResultAggregator() {
    this(new CapabilityUsageDetector());
  }

  public Report aggregate(GraphRun run, RequestContext context) {
    Objects.requireNonNull(run, "run");
    Objects.requireNonNull(context, "context");

    List<AgentReport> agents = new ArrayList<>();
    List<String> labelled = new ArrayList<>();
    boolean capabilitiesUsed = false;

    for (NodeResult result : run.results()) {
      Collected collected = new Collected();
      for (AgentInvocationResult invocation : result.invocations()) {
        collect(result.nodeId(), invocation, collected);
      }
      String text = String.join("\n", collected.texts);

      List<ReportMessage> messages = new ArrayList<>();
      if (!text.isEmpty()) {
        messages.add(ReportMessage.text(text));
        labelled.add("[" + result.nodeId() + "]\n" + text);
      }
      collected.structured.forEach(data -> messages.add(ReportMessage.json(data)));

      capabilitiesUsed |= collected.sawToolResult || detector.detect(text);
      agents.add(
          new AgentReport(
              result.nodeId(),
              messages,
              result.durationMs(),
              result.status(),
              result.usage().totalTokens(),
              result.error() == null ? null : result.error().message));
    }

    for (String skipped : run.skippedNodes()) {
      agents.add(new AgentReport(skipped, List.of(), 0L, NodeStatus.SKIPPED, 0L, null));
    }

    String fullText = labelled.isEmpty() ? Report.NO_CONTENT : String.join("\n\n", labelled);
    Report report =
        new Report(
            run.status(),
            agents,
            run.executionTimeMs(),
            run.totalUsage().totalTokens(),
            capabilitiesUsed,
            fullText,
            new ReportMetadata(
                context.sessionId(), run.totalNodes(), run.completedNodes(), run.failedNodes()),
            run.failureCause().map(ExceptionUtil::describe).orElse(null));
    log.debug(
        "Aggregated {} agents, capabilities used: {}", agents.size(), report.capabilitiesUsed());
    return report;
  }

  /** Flattens one invocation with an explicit stack; pushes children in reverse to keep order. */
  private void collect(String nodeId, AgentInvocationResult invocation, Collected into) {
    List<String> texts = new ArrayList<>();
    Deque<Frame> stack = new ArrayDeque<>();
    pushAll(stack, invocation.content(), 0);
    while (!stack.isEmpty()) {
      Frame frame = stack.pop();
      if (frame.block() instanceof ContentBlock.TextBlock text) {
        texts.add(text.text());
      } else if (frame.block() instanceof ContentBlock.StructuredBlock structured) {
        into.structured.add(structured.data());
      } else if (frame.block() instanceof ContentBlock.ToolResultBlock toolResult) {
        into.sawToolResult = true;
        if (frame.depth() + 1 > MAX_DEPTH) {
          log.warn(
              "Node {}: dropping content of tool result '{}' nested deeper than {} levels",
              nodeId,
              toolResult.toolName(),
              MAX_DEPTH);
          continue;
        }
        pushAll(stack, toolResult.content(), frame.depth() + 1);
      }
    }
    String text = String.join("\n", texts).trim();
    if (!text.isEmpty()) into.texts.add(text);
  }

  private static void pushAll(Deque<Frame> stack, List<ContentBlock> blocks, int depth) {
    for (int i = blocks.size() - 1; i >= 0; i--) {
      stack.push(new Frame(blocks.get(i), depth));
    }
  }

  private record Frame(ContentBlock block, int depth) {}

  private static final class Collected {
    final List<String> texts = new ArrayList<>();
    final List<JsonNode> structured = new ArrayList<>();
    boolean sawToolResult;
  }
}
