package com.gentoro.agentgraph.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentgraph.agent.ContentBlock;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.catalog.CatalogPage;
import com.gentoro.agentgraph.catalog.CatalogSource;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NetworkException;
import com.gentoro.agentgraph.utility.JacksonUtility;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Gateway session over an initialized MCP client. */
public class McpGatewaySession implements GatewaySession, CatalogSource {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(McpGatewaySession.class);

  private final McpSyncClient client;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public McpGatewaySession(McpSyncClient client) {
    this.client = Objects.requireNonNull(client, "client");
  }

  @Override
  public CatalogSource catalogSource() {
    return this;
  }

  @Override
  public CatalogPage listPage(String cursor) {
    McpSchema.ListToolsResult result = client.listTools(cursor);
    List<Capability> capabilities = new ArrayList<>();
    for (McpSchema.Tool tool : result.tools()) {
      capabilities.add(toCapability(tool));
    }
    return new CatalogPage(capabilities, result.nextCursor());
  }

  private Capability toCapability(McpSchema.Tool tool) {
    JsonNode schema =
        tool.inputSchema() == null ? null : mapper.valueToTree(tool.inputSchema());
    return new Capability(
        tool.name(), tool.description(), schema, arguments -> call(tool.name(), arguments));
  }

  ContentBlock.ToolResultBlock call(String toolName, Map<String, Object> arguments) {
    log.debug("Calling gateway tool {}", toolName);
    McpSchema.CallToolResult result;
    try {
      result =
          client.callTool(
              McpSchema.CallToolRequest.builder()
                  .name(toolName)
                  .arguments(arguments == null ? Map.of() : arguments)
                  .build());
    } catch (RuntimeException e) {
      throw new NetworkException(
          "Gateway call to %s failed: %s".formatted(toolName, ExceptionUtil.describe(e)), e);
    }

    List<ContentBlock> blocks = new ArrayList<>();
    if (result.content() != null) {
      for (McpSchema.Content content : result.content()) {
        if (content instanceof McpSchema.TextContent text) {
          blocks.add(ContentBlock.text(text.text()));
        } else {
          blocks.add(ContentBlock.structured(mapper.valueToTree(content)));
        }
      }
    }
    if (result.structuredContent() != null) {
      blocks.add(ContentBlock.structured(mapper.valueToTree(result.structuredContent())));
    }
    boolean error = Boolean.TRUE.equals(result.isError());
    if (error) {
      log.warn("Gateway tool {} reported an error", toolName);
    }
    return new ContentBlock.ToolResultBlock(toolName, blocks, error);
  }

  @Override
  public void close() {
    try {
      client.closeGracefully();
    } catch (RuntimeException e) {
      log.warn("Closing gateway session failed: {}", ExceptionUtil.describe(e));
    }
  }
}
