package com.gentoro.agentgraph.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.agent.AgentRuntime;
import com.gentoro.agentgraph.aggregate.CapabilityUsageDetector;
import com.gentoro.agentgraph.aggregate.Report;
import com.gentoro.agentgraph.aggregate.ResultAggregator;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.catalog.Catalog;
import com.gentoro.agentgraph.catalog.CapabilityRouter;
import com.gentoro.agentgraph.catalog.RoutedCapabilities;
import com.gentoro.agentgraph.catalog.ToolCatalogFetcher;
import com.gentoro.agentgraph.config.AgentGraphSettings;
import com.gentoro.agentgraph.context.LogContext;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.gateway.GatewaySession;
import com.gentoro.agentgraph.gateway.GatewaySessionFactory;
import com.gentoro.agentgraph.graph.CancellationSignal;
import com.gentoro.agentgraph.graph.Graph;
import com.gentoro.agentgraph.graph.GraphBuilder;
import com.gentoro.agentgraph.graph.GraphExecutor;
import com.gentoro.agentgraph.graph.GraphRun;
import com.gentoro.agentgraph.graph.NodeFactory;
import com.gentoro.agentgraph.graph.NodeInput;
import com.gentoro.agentgraph.graph.event.GraphEventSink;
import com.gentoro.agentgraph.graph.event.LoggingGraphEventSink;
import com.gentoro.agentgraph.identity.AccessTokenProvider;
import com.gentoro.agentgraph.identity.RequestScopedTokenProvider;
import com.gentoro.agentgraph.prompt.PromptRepository;
import com.gentoro.agentgraph.prompt.PromptTemplate;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One invocation end to end: payload, token, gateway session, catalog, graph, report.
 *
 * <p>The graph is {@code slack_agent -> tavily_agent -terminal-> block_agent}. Failures before
 * the graph runs become a single {@link ErrorResponse}; node failures are reported inside the
 * {@link Report}.
 */
public class PipelineService {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(PipelineService.class);

  public static final String SLACK_NODE = "slack_agent";
  public static final String TAVILY_NODE = "tavily_agent";
  public static final String BLOCK_NODE = "block_agent";

  private final AgentGraphSettings settings;
  private final PipelineSettings pipeline;
  private final AccessTokenProvider tokenProvider;
  private final GatewaySessionFactory sessionFactory;
  private final PromptRepository prompts;
  private final NodeFactory nodeFactory;
  private final CapabilityRouter router = new CapabilityRouter();

  public PipelineService(
      AgentGraphSettings settings,
      AccessTokenProvider tokenProvider,
      GatewaySessionFactory sessionFactory,
      AgentRuntime runtime,
      PromptRepository prompts) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.pipeline = PipelineSettings.from(settings.configuration());
    this.tokenProvider = Objects.requireNonNull(tokenProvider, "tokenProvider");
    this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
    this.nodeFactory = new NodeFactory(Objects.requireNonNull(runtime, "runtime"));
    this.prompts = Objects.requireNonNull(prompts, "prompts");
  }

  public PipelineResponse invoke(JsonNode body, String userId) {
    return invoke(body, userId, new LoggingGraphEventSink(log), new CancellationSignal());
  }

  /**
   * @param userId caller identity from the request; null falls back to {@code identity.user-id}
   */
  public PipelineResponse invoke(
      JsonNode body, String userId, GraphEventSink events, CancellationSignal signal) {
    InvocationPayload payload;
    try {
      settings.validate();
      payload = InvocationPayload.resolve(body);
    } catch (RuntimeException e) {
      log.error("Rejected invocation: {}", ExceptionUtil.describe(e));
      return PipelineResponse.failure(ErrorResponse.from(e));
    }

    RequestContext context =
        RequestContext.create(
            payload.sessionId(),
            userId == null || userId.isBlank() ? settings.userId() : userId,
            settings.workloadName());
    try (LogContext ignored = new LogContext(context)) {
      log.info("Invocation received, prompt of {} chars", payload.prompt().length());
      try {
        Report report = run(payload, context, events, signal);
        log.info("Invocation finished with status {}", report.status());
        return PipelineResponse.of(report);
      } catch (RuntimeException e) {
        log.error("Invocation failed: {}", ExceptionUtil.describe(e), e);
        return PipelineResponse.failure(ErrorResponse.from(e));
      }
    }
  }

  private Report run(
      InvocationPayload payload,
      RequestContext context,
      GraphEventSink events,
      CancellationSignal signal) {
    AccessTokenProvider tokens = new RequestScopedTokenProvider(tokenProvider);
    String token = tokens.getAccessToken(context);

    try (GatewaySession session = sessionFactory.open(token, context)) {
      Catalog catalog =
          new ToolCatalogFetcher(settings.catalogMaxPages())
              .fetchAll(session.catalogSource(), context);
      Graph graph = buildGraph(catalog);
      GraphRun run =
          new GraphExecutor(settings.nodeTimeout())
              .execute(graph, payload.prompt(), context, signal, events);
      return new ResultAggregator(new CapabilityUsageDetector(settings.capabilityIndicators()))
          .aggregate(run, context);
    }
  }

  Graph buildGraph(Catalog catalog) {
    RoutedCapabilities slack = router.route(catalog, pipeline.slackKeyword());
    RoutedCapabilities tavily = router.route(catalog, pipeline.tavilyKeyword());
    List<Capability> unrouted =
        router.remainder(catalog, pipeline.slackKeyword(), pipeline.tavilyKeyword());
    if (!unrouted.isEmpty()) {
      log.debug("Capabilities not routed to any agent: {}", unrouted);
    }

    PromptTemplate slackPrompt = prompts.get(SLACK_NODE);
    PromptTemplate tavilyPrompt = prompts.get(TAVILY_NODE);
    Map<String, Object> vars = Map.of("channel", pipeline.channel());
    String followUp =
        pipeline.followUpPrompt() != null
            ? pipeline.followUpPrompt()
            : tavilyPrompt.render(PromptTemplate.Role.USER, vars);

    return new GraphBuilder()
        .addNode(
            nodeFactory.build(
                SLACK_NODE,
                slack.capabilities(),
                slackPrompt.render(PromptTemplate.Role.SYSTEM, vars)))
        .addNode(
            nodeFactory.build(
                TAVILY_NODE,
                tavily.capabilities(),
                tavilyPrompt.render(PromptTemplate.Role.SYSTEM, vars)))
        .addNode(nodeFactory.terminal(BLOCK_NODE))
        .addEdge(SLACK_NODE, TAVILY_NODE, null, NodeInput.fixed(followUp))
        .addTerminalEdge(TAVILY_NODE, BLOCK_NODE)
        .setEntryPoint(SLACK_NODE)
        .build();
  }
}
