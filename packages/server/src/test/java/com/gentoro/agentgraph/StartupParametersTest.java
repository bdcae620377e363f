package com.gentoro.agentgraph;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StartupParametersTest {

  @Test
  void defaults() {
    StartupParameters params = new StartupParameters(new String[0]);
    assertEquals("server", params.mode());
    assertEquals("classpath:application.yaml", params.configFile());
  }

  @Test
  void parsesNamedValues() {
    StartupParameters params =
        new StartupParameters(
            new String[] {"--mode", "dry-run", "--prompt", "hello", "--config-file", "/etc/a.yaml"});
    assertEquals("dry-run", params.mode());
    assertEquals("hello", params.getParameter("prompt", String.class));
    assertEquals("/etc/a.yaml", params.configFile());
  }

  @Test
  void rejectsInvalidMode() {
    assertThrows(
        IllegalArgumentException.class, () -> new StartupParameters(new String[] {"--mode", "x"}));
    assertThrows(
        IllegalArgumentException.class,
        () -> new StartupParameters(new String[] {"--mode", "dry-run"}));
  }
}
