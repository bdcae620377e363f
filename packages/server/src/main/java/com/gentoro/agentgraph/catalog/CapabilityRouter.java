package com.gentoro.agentgraph.catalog;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Assigns catalog subsets to nodes by keyword affinity: case-insensitive substring match on the
 * capability name, in catalog order.
 */
public class CapabilityRouter {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(CapabilityRouter.class);

  /**
   * Route the catalog for one keyword. When nothing matches, the entire catalog is returned and the
   * result is flagged as a fallback.
   */
  public RoutedCapabilities route(Catalog catalog, String keyword) {
    List<Capability> matched = matchOnly(catalog, keyword);
    if (matched.isEmpty()) {
      log.warn(
          "No capability matches keyword '{}'; assigning all {} capabilities. Catalog: {}",
          keyword,
          catalog.size(),
          catalog.names());
      return new RoutedCapabilities(keyword, catalog.capabilities(), true);
    }
    log.info("Keyword '{}' routed {} capabilities", keyword, matched.size());
    return new RoutedCapabilities(keyword, matched, false);
  }

  /** Capabilities whose name contains the keyword, ignoring case. May be empty. */
  public List<Capability> matchOnly(Catalog catalog, String keyword) {
    String needle = normalize(keyword);
    if (needle.isEmpty()) return List.of();
    return catalog.capabilities().stream()
        .filter(c -> normalize(c.name()).contains(needle))
        .toList();
  }

  /** Capabilities matched by none of the keywords. */
  public List<Capability> remainder(Catalog catalog, String... keywords) {
    List<String> needles =
        Arrays.stream(keywords).map(CapabilityRouter::normalize).filter(k -> !k.isEmpty()).toList();
    return catalog.capabilities().stream()
        .filter(c -> needles.stream().noneMatch(normalize(c.name())::contains))
        .toList();
  }

  private static String normalize(String s) {
    return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
  }
}
