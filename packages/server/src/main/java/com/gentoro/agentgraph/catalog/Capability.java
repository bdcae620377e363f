package com.gentoro.agentgraph.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * A single invocable operation exposed by the tool gateway. Read-only once fetched.
 *
 * @param name identifier, also used as display name for routing
 * @param description free text shown to the model
 * @param inputSchema JSON schema of the arguments (an object schema, possibly empty)
 * @param handle invocation handle bound to the gateway session that listed the capability
 */
public record Capability(String name, String description, JsonNode inputSchema, CapabilityHandle handle) {

  public Capability {
    Objects.requireNonNull(name, "name");
    description = description == null ? "" : description;
    inputSchema = inputSchema == null ? JsonNodeFactory.instance.objectNode() : inputSchema;
    Objects.requireNonNull(handle, "handle");
  }

  @Override
  public String toString() {
    return name;
  }
}
