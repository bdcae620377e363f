package com.gentoro.agentgraph.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.exception.ConfigException;
import java.time.Duration;
import java.util.List;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AgentGraphSettingsTest {

  @Test
  @DisplayName("Defaults apply when optional keys are absent")
  void defaults() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("identity.scope", "gateway/invoke");
    cfg.addProperty("gateway.url", "https://gw.example.com/mcp");

    AgentGraphSettings settings = AgentGraphSettings.from(cfg).validate();

    assertEquals(AgentGraphSettings.DEFAULT_WORKLOAD_NAME, settings.workloadName());
    assertEquals(AgentGraphSettings.DEFAULT_USER_ID, settings.userId());
    assertEquals(AgentGraphSettings.DEFAULT_MODEL, settings.model());
    assertEquals(AgentGraphSettings.DEFAULT_MAX_PAGES, settings.catalogMaxPages());
    assertEquals(Duration.ofMinutes(5), settings.nodeTimeout());
    assertEquals(Duration.ofMinutes(10), settings.requestTimeout());
    assertEquals(List.of("Tool #", "slack", "tavily"), settings.capabilityIndicators());
    assertTrue(settings.strict());
  }

  @Test
  @DisplayName("Every missing required key is named in one error")
  void missingKeys() {
    ConfigException ex =
        assertThrows(
            ConfigException.class, () -> AgentGraphSettings.from(new BaseConfiguration()).validate());
    assertTrue(ex.getMessage().contains("gateway.url"));
    assertTrue(ex.getMessage().contains("identity.scope"));
  }

  @Test
  @DisplayName("Unresolved placeholders count as missing")
  void unresolvedPlaceholder() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("identity.scope", "${env:COGNITO_SCOPE}");
    cfg.addProperty("gateway.url", "  ");

    assertNull(AgentGraphSettings.value(cfg, "identity.scope"));
    assertNull(AgentGraphSettings.value(cfg, "gateway.url"));
    assertThrows(ConfigException.class, () -> AgentGraphSettings.from(cfg).validate());
  }

  @Test
  @DisplayName("Lenient mode falls back to the local gateway")
  void lenientGateway() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("settings.strict", false);
    cfg.addProperty("identity.scope", "gateway/invoke");

    AgentGraphSettings settings = AgentGraphSettings.from(cfg).validate();

    assertEquals(AgentGraphSettings.LOCAL_GATEWAY_URL, settings.gatewayUrl());
  }

  @Test
  void overrides() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("identity.user-id", " alice ");
    cfg.addProperty("graph.node-timeout", "PT30S");
    cfg.addProperty("http.request-timeout", "PT90S");
    cfg.addProperty("catalog.max-pages", 7);
    cfg.addProperty("report.capability-indicators", List.of("mcp"));

    AgentGraphSettings settings = AgentGraphSettings.from(cfg);

    assertEquals("alice", settings.userId());
    assertEquals(Duration.ofSeconds(30), settings.nodeTimeout());
    assertEquals(Duration.ofSeconds(90), settings.requestTimeout());
    assertEquals(7, settings.catalogMaxPages());
    assertEquals(List.of("mcp"), settings.capabilityIndicators());
  }

  @Test
  void invalidDuration() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("graph.node-timeout", "five minutes");
    assertThrows(ConfigException.class, () -> AgentGraphSettings.from(cfg).nodeTimeout());
  }
}
