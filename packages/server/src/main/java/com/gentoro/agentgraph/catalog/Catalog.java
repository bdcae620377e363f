package com.gentoro.agentgraph.catalog;

import java.util.List;
import java.util.Optional;

/** Ordered, immutable set of capabilities available for one session. */
public final class Catalog {
  private final List<Capability> capabilities;

  public Catalog(List<Capability> capabilities) {
    this.capabilities = List.copyOf(capabilities);
  }

  public List<Capability> capabilities() {
    return capabilities;
  }

  public int size() {
    return capabilities.size();
  }

  public boolean isEmpty() {
    return capabilities.isEmpty();
  }

  public List<String> names() {
    return capabilities.stream().map(Capability::name).toList();
  }

  public Optional<Capability> find(String name) {
    return capabilities.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  @Override
  public String toString() {
    return "Catalog" + names();
  }
}
