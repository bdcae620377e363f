package com.gentoro.agentgraph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.config.AgentGraphSettings;
import com.gentoro.agentgraph.exception.ConfigException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  @DisplayName("Bundled application.yaml loads with its defaults")
  void loadsBundledConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:application.yaml").config();
    AgentGraphSettings settings = AgentGraphSettings.from(cfg);

    assertEquals(8080, cfg.getInt("http.port"));
    assertEquals("test-strands-agents", cfg.getString("pipeline.channel"));
    assertEquals(List.of("Tool #", "slack", "tavily"), settings.capabilityIndicators());
    assertEquals(Duration.ofMinutes(5), settings.nodeTimeout());
    assertEquals(Duration.ofSeconds(60), settings.gatewayRequestTimeout());
  }

  @Test
  @DisplayName("Env file lines are parsed with comments, exports and quotes")
  void parsesEnvFile(@TempDir Path dir) throws IOException {
    Path env = dir.resolve(".env.local");
    Files.writeString(
        env, "# comment\nGATEWAY_URL=https://gw/mcp\nexport COGNITO_SCOPE='a/b'\nbroken\nEMPTY=\n");

    Map<String, String> values = ConfigurationProvider.EnvLookup.parse(env);

    assertEquals("https://gw/mcp", values.get("GATEWAY_URL"));
    assertEquals("a/b", values.get("COGNITO_SCOPE"));
    assertEquals("", values.get("EMPTY"));
    assertEquals(3, values.size());
  }

  @Test
  @DisplayName("YAML files on disk load through a file URI")
  void loadsFile(@TempDir Path dir) throws IOException {
    Path yaml = dir.resolve("app.yaml");
    Files.writeString(yaml, "pipeline:\n  channel: links\nhttp:\n  port: 9090\n");

    Configuration cfg = new ConfigurationProvider(yaml.toUri().toString()).config();

    assertEquals("links", cfg.getString("pipeline.channel"));
    assertEquals(9090, cfg.getInt("http.port"));
  }

  @Test
  void missingFileIsConfigError() {
    assertThrows(
        ConfigException.class, () -> new ConfigurationProvider("/does/not/exist/agentgraph.yaml"));
  }
}
