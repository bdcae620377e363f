package com.gentoro.agentgraph.aggregate;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Heuristic: decides from agent text whether gateway capabilities were used, by looking for
 * configured marker strings (case-insensitive). It can report false positives, e.g. a summary that
 * merely mentions Slack.
 */
public class CapabilityUsageDetector {
  public static final List<String> DEFAULT_INDICATORS = List.of("Tool #", "slack", "tavily");

  private final List<String> indicators;

  public CapabilityUsageDetector(List<String> indicators) {
    Objects.requireNonNull(indicators, "indicators");
    this.indicators =
        indicators.stream()
            .filter(s -> s != null && !s.isBlank())
            .map(s -> s.toLowerCase(Locale.ROOT))
            .toList();
  }

  public CapabilityUsageDetector() {
    this(DEFAULT_INDICATORS);
  }

  public boolean detect(String text) {
    if (text == null || text.isEmpty()) return false;
    String haystack = text.toLowerCase(Locale.ROOT);
    return indicators.stream().anyMatch(haystack::contains);
  }

  public List<String> indicators() {
    return indicators;
  }
}
