package com.gentoro.agentgraph.agent;

import static com.gentoro.agentgraph.Fixtures.capability;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.catalog.Capability;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AnthropicAgentRuntimeTest {

  @Test
  @DisplayName("Capability names are mapped to legal tool names")
  void toolNames() {
    assertEquals("slack___history", AnthropicAgentRuntime.toolName("slack___history"));
    assertEquals("tavily_extract_v2", AnthropicAgentRuntime.toolName("tavily.extract v2"));
    assertEquals(64, AnthropicAgentRuntime.toolName("x".repeat(100)).length());
  }

  @Test
  @DisplayName("Capabilities whose tool names collide all stay reachable")
  void collidingToolNamesGetSuffixes() {
    Capability dotted = capability("a.b");
    Capability spaced = capability("a b");
    Capability underscored = capability("a_b");
    Capability longOne = capability("y".repeat(70));
    Capability longTwo = capability("y".repeat(80));

    Map<String, Capability> byToolName =
        AnthropicAgentRuntime.toolNames(List.of(dotted, spaced, underscored, longOne, longTwo));

    assertEquals(
        List.of("a_b", "a_b_2", "a_b_3", "y".repeat(64), "y".repeat(62) + "_2"),
        new ArrayList<>(byToolName.keySet()));
    assertSame(dotted, byToolName.get("a_b"));
    assertSame(spaced, byToolName.get("a_b_2"));
    assertSame(underscored, byToolName.get("a_b_3"));
    assertSame(longTwo, byToolName.get("y".repeat(62) + "_2"));
  }
}
