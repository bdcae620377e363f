package com.gentoro.agentgraph;

import com.anthropic.client.okhttp.AnthropicOkHttpClient;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentgraph.agent.AgentRuntime;
import com.gentoro.agentgraph.agent.AnthropicAgentRuntime;
import com.gentoro.agentgraph.client.ConsoleClient;
import com.gentoro.agentgraph.client.RuntimeClient;
import com.gentoro.agentgraph.config.AgentGraphSettings;
import com.gentoro.agentgraph.exception.ConfigException;
import com.gentoro.agentgraph.exception.StateException;
import com.gentoro.agentgraph.gateway.McpGatewaySessionFactory;
import com.gentoro.agentgraph.http.EmbeddedJettyServer;
import com.gentoro.agentgraph.http.OkHttpFactory;
import com.gentoro.agentgraph.http.RuntimeEndpoints;
import com.gentoro.agentgraph.identity.AccessTokenProvider;
import com.gentoro.agentgraph.identity.AccessTokenProviders;
import com.gentoro.agentgraph.logging.LoggingService;
import com.gentoro.agentgraph.pipeline.PipelineResponse;
import com.gentoro.agentgraph.pipeline.PipelineService;
import com.gentoro.agentgraph.prompt.ClasspathPromptRepository;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/** Application context: wires configuration, pipeline and the selected mode. */
public class AgentGraph {
  private static final org.slf4j.Logger log = LoggingService.getLogger(AgentGraph.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private AgentGraphSettings settings;
  private EmbeddedJettyServer httpServer;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);
  private final CountDownLatch shutdownLatch = new CountDownLatch(1);
  private volatile Thread shutdownHook;

  public AgentGraph(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    this.settings = AgentGraphSettings.from(configuration());

    switch (startupParameters.mode()) {
      case "server" -> startServer();
      case "client" -> runConsoleClient();
      case "dry-run" -> dryRun(startupParameters.getParameter("prompt", String.class));
      default -> throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private void startServer() {
    PipelineService pipeline = createPipeline();
    this.httpServer = new EmbeddedJettyServer(configuration());
    httpServer.prepare();
    RuntimeEndpoints.register(httpServer, pipeline, settings.requestTimeout());
    try {
      httpServer.start();
    } catch (RuntimeException e) {
      shutdown();
      throw e;
    }
    waitShutdownSignal();
  }

  private void runConsoleClient() {
    String url =
        configuration().getString("client.runtime-url", "http://localhost:8080/invocations");
    Duration readTimeout =
        Duration.parse(configuration().getString("client.read-timeout", "PT10M"));
    RuntimeClient client =
        new RuntimeClient(
            OkHttpFactory.create(Duration.ofSeconds(10), readTimeout), url, settings.userId());
    log.info("Console client talking to {}", url);
    new ConsoleClient(client, System.out).run(System.in);
  }

  private void dryRun(String prompt) {
    ObjectNode body = JsonNodeFactory.instance.objectNode().put("prompt", prompt);
    PipelineResponse response = createPipeline().invoke(body, null);
    System.out.println(response.toJson());
  }

  PipelineService createPipeline() {
    return new PipelineService(
        settings,
        tokenProvider(),
        new McpGatewaySessionFactory(
            settings.gatewayUrl(), settings.gatewayRequestTimeout(), settings.workloadName()),
        agentRuntime(),
        new ClasspathPromptRepository(configuration().getString("prompt.location", "prompts")));
  }

  /** A misconfigured identity provider is reported on every request instead of at startup. */
  private AccessTokenProvider tokenProvider() {
    try {
      return AccessTokenProviders.fromSettings(settings);
    } catch (ConfigException e) {
      log.warn("Identity provider not configured: {}", e.getMessage());
      return context -> {
        throw e;
      };
    }
  }

  private AgentRuntime agentRuntime() {
    String apiKey = AgentGraphSettings.value(configuration(), "agent.anthropic.api-key");
    if (apiKey == null) {
      log.warn("agent.anthropic.api-key is not set, every agent node will fail");
      return invocation -> {
        throw new ConfigException("Missing agent.anthropic.api-key (ANTHROPIC_API_KEY)");
      };
    }
    return new AnthropicAgentRuntime(
        AnthropicOkHttpClient.builder().apiKey(apiKey).build(),
        settings.model(),
        configuration().getLong("agent.max-tokens", 4096L),
        configuration().getInt("agent.max-turns", 16));
  }

  /** Block until Ctrl+C or JVM termination, then release resources. */
  public void waitShutdownSignal() {
    if (shutdownHook == null) {
      synchronized (this) {
        if (shutdownHook == null) {
          shutdownHook = new Thread(this::shutdown, "agentgraph-shutdown-hook");
          Runtime.getRuntime().addShutdownHook(shutdownHook);
        }
      }
    }
    try {
      shutdownLatch.await();
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  /** Safe to call multiple times; executed only once. */
  public void shutdown() {
    if (shuttingDown.compareAndSet(false, true)) {
      try {
        if (httpServer != null) httpServer.close();
      } catch (RuntimeException e) {
        log.warn("Error while stopping http server", e);
      } finally {
        shutdownLatch.countDown();
      }
    }
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("AgentGraph not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }
}
