package com.gentoro.agentgraph.config;

import com.gentoro.agentgraph.exception.ConfigException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Request-time settings resolved from the application configuration.
 *
 * <p>Required keys are checked by {@link #validate()}, which reports every missing key at once.
 * A value still holding an unresolved {@code ${env:...}} placeholder counts as missing.
 *
 * <ul>
 *   <li><b>gateway.url</b> – MCP gateway endpoint; required when {@code settings.strict} is true
 *   <li><b>identity.scope</b> – OAuth2 scope for gateway tokens; required
 *   <li><b>identity.workload-name</b> – default "slack-gateway-agent"
 *   <li><b>identity.user-id</b> – default "m2m-user-001"
 *   <li><b>agent.model</b> – model identifier passed to the agent runtime
 * </ul>
 */
public final class AgentGraphSettings {
  public static final String DEFAULT_WORKLOAD_NAME = "slack-gateway-agent";
  public static final String DEFAULT_USER_ID = "m2m-user-001";
  public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";
  public static final String LOCAL_GATEWAY_URL = "http://localhost:8000/mcp";
  public static final int DEFAULT_MAX_PAGES = 10_000;

  private final Configuration configuration;
  private final boolean strict;
  private final String gatewayUrl;
  private final String scope;
  private final String workloadName;
  private final String userId;
  private final String model;

  private AgentGraphSettings(Configuration configuration) {
    this.configuration = configuration;
    this.strict = configuration.getBoolean("settings.strict", true);
    this.gatewayUrl = value(configuration, "gateway.url");
    this.scope = value(configuration, "identity.scope");
    this.workloadName =
        Objects.requireNonNullElse(
            value(configuration, "identity.workload-name"), DEFAULT_WORKLOAD_NAME);
    this.userId =
        Objects.requireNonNullElse(value(configuration, "identity.user-id"), DEFAULT_USER_ID);
    this.model = Objects.requireNonNullElse(value(configuration, "agent.model"), DEFAULT_MODEL);
  }

  public static AgentGraphSettings from(Configuration configuration) {
    return new AgentGraphSettings(Objects.requireNonNull(configuration, "configuration"));
  }

  /**
   * Fail with a single {@link ConfigException} naming every missing required key.
   *
   * @return this instance, for chaining
   */
  public AgentGraphSettings validate() {
    List<String> missing = new ArrayList<>();
    if (strict && gatewayUrl == null) missing.add("gateway.url (GATEWAY_URL)");
    if (scope == null) missing.add("identity.scope (COGNITO_SCOPE)");
    if (!missing.isEmpty()) {
      throw new ConfigException(
          "Missing required configuration: %s".formatted(String.join(", ", missing)));
    }
    return this;
  }

  public boolean strict() {
    return strict;
  }

  public String gatewayUrl() {
    return gatewayUrl != null ? gatewayUrl : LOCAL_GATEWAY_URL;
  }

  public String scope() {
    return scope;
  }

  public String workloadName() {
    return workloadName;
  }

  public String userId() {
    return userId;
  }

  public String model() {
    return model;
  }

  public int catalogMaxPages() {
    return configuration.getInt("catalog.max-pages", DEFAULT_MAX_PAGES);
  }

  public Duration nodeTimeout() {
    return duration("graph.node-timeout", Duration.ofMinutes(5));
  }

  /** Upper bound for one {@code /invocations} request, after which the run is cancelled. */
  public Duration requestTimeout() {
    return duration("http.request-timeout", Duration.ofMinutes(10));
  }

  public Duration gatewayRequestTimeout() {
    return duration("gateway.request-timeout", Duration.ofSeconds(60));
  }

  public List<String> capabilityIndicators() {
    List<String> configured = configuration.getList(String.class, "report.capability-indicators");
    if (configured == null || configured.isEmpty()) {
      return List.of("Tool #", "slack", "tavily");
    }
    return List.copyOf(configured);
  }

  /** Raw access for components that own their own sub-namespace (pipeline, identity, client). */
  public Configuration configuration() {
    return configuration;
  }

  private Duration duration(String key, Duration fallback) {
    String raw = value(configuration, key);
    if (raw == null) return fallback;
    try {
      return Duration.parse(raw);
    } catch (Exception e) {
      throw new ConfigException("Invalid ISO-8601 duration for %s: %s".formatted(key, raw), e);
    }
  }

  /** Trimmed value, or null when blank or still an unresolved {@code ${...}} placeholder. */
  public static String value(Configuration cfg, String key) {
    String raw = cfg.getString(key, null);
    if (raw == null) return null;
    String trimmed = raw.trim();
    if (trimmed.isEmpty() || trimmed.startsWith("${")) return null;
    return trimmed;
  }
}
