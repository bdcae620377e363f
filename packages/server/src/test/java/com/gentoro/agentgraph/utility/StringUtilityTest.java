package com.gentoro.agentgraph.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class StringUtilityTest {

  @Test
  void extractsFencedSnippet() {
    String text = "Here:\n```json\n{\"a\":1}\n```\nand more ```json\n[2]\n```";
    assertEquals("{\"a\":1}", StringUtility.extractSnippet(text, "json"));
    assertNull(StringUtility.extractSnippet("no fences", "json"));
  }

  @Test
  void indentsEveryLine() {
    assertEquals("  a\n  b", StringUtility.formatWithIndent("a\r\nb\n", 2));
  }

  @Test
  void redactsSecrets() {
    String redacted = StringUtility.redact("eyJhbGciOiJSUzI1NiJ9.payload");
    assertFalse(redacted.contains("payload"));
    assertTrue(redacted.endsWith("(28 chars)"));
  }
}
