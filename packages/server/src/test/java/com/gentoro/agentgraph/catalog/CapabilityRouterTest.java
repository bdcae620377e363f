package com.gentoro.agentgraph.catalog;

import static com.gentoro.agentgraph.Fixtures.capability;
import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CapabilityRouter")
class CapabilityRouterTest {
  private final CapabilityRouter router = new CapabilityRouter();
  private final Catalog catalog =
      new Catalog(
          List.of(
              capability("SlackTarget___conversations_history"),
              capability("tavily___extract"),
              capability("weather___forecast"),
              capability("slack___users_list")));

  @Test
  @DisplayName("Matches case-insensitively and keeps catalog order")
  void partitionsByKeyword() {
    RoutedCapabilities slack = router.route(catalog, "slack");
    RoutedCapabilities tavily = router.route(catalog, "TAVILY");

    assertThat(slack.fallback()).isFalse();
    assertThat(slack.capabilities())
        .extracting(Capability::name)
        .containsExactly("SlackTarget___conversations_history", "slack___users_list");
    assertThat(tavily.capabilities()).extracting(Capability::name).containsExactly("tavily___extract");
  }

  @Test
  @DisplayName("Keywords split the catalog into disjoint parts plus a remainder")
  void partitionIsDisjoint() {
    List<Capability> slack = router.matchOnly(catalog, "slack");
    List<Capability> tavily = router.matchOnly(catalog, "tavily");
    List<Capability> rest = router.remainder(catalog, "slack", "tavily");

    assertThat(slack).doesNotContainAnyElementsOf(tavily);
    assertThat(rest).extracting(Capability::name).containsExactly("weather___forecast");
    assertThat(slack.size() + tavily.size() + rest.size()).isEqualTo(catalog.size());
  }

  @Test
  @DisplayName("No match falls back to the whole catalog and says so")
  void fallbackToWholeCatalog() {
    RoutedCapabilities routed = router.route(catalog, "github");

    assertThat(routed.fallback()).isTrue();
    assertThat(routed.capabilities()).containsExactlyElementsOf(catalog.capabilities());
    assertThat(router.matchOnly(catalog, "github")).isEmpty();
  }
}
