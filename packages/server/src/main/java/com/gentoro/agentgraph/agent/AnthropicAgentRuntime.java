package com.gentoro.agentgraph.agent;

import com.anthropic.client.AnthropicClient;
import com.anthropic.core.JsonValue;
import com.anthropic.models.messages.ContentBlockParam;
import com.anthropic.models.messages.Message;
import com.anthropic.models.messages.MessageCreateParams;
import com.anthropic.models.messages.MessageParam;
import com.anthropic.models.messages.StopReason;
import com.anthropic.models.messages.Tool;
import com.anthropic.models.messages.ToolResultBlockParam;
import com.anthropic.models.messages.ToolUseBlock;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.catalog.Capability;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NodeExecutionException;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * {@link AgentRuntime} on the Anthropic Messages API with a tool-calling loop over the node's
 * capabilities.
 *
 * <p>The returned content holds every tool result in call order followed by the text of the final
 * assistant turn. Text the model emits between tool calls is not kept.
 */
public class AnthropicAgentRuntime implements AgentRuntime {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(AnthropicAgentRuntime.class);

  private static final TypeReference<HashMap<String, Object>> ARGUMENTS_TYPE =
      new TypeReference<HashMap<String, Object>>() {};

  private final AnthropicClient client;
  private final String model;
  private final long maxTokens;
  private final int maxTurns;

  public AnthropicAgentRuntime(AnthropicClient client, String model, long maxTokens, int maxTurns) {
    this.client = Objects.requireNonNull(client, "client");
    this.model = Objects.requireNonNull(model, "model");
    this.maxTokens = maxTokens;
    this.maxTurns = maxTurns;
  }

  @Override
  public AgentInvocationResult invoke(AgentInvocation invocation) {
    Map<String, Capability> byToolName = toolNames(invocation.capabilities());

    MessageCreateParams.Builder configBuilder =
        MessageCreateParams.builder().model(model).maxTokens(maxTokens);
    if (!invocation.systemPrompt().isBlank()) {
      configBuilder.system(invocation.systemPrompt());
    }
    byToolName.forEach((name, capability) -> configBuilder.addTool(convertTool(name, capability)));

    List<MessageParam> localMessages = new ArrayList<>();
    localMessages.add(
        MessageParam.builder().role(MessageParam.Role.USER).content(invocation.input()).build());

    List<ContentBlock> collected = new ArrayList<>();
    TokenUsage usage = TokenUsage.ZERO;
    Message response;
    int turn = 0;
    while (true) {
      if (Thread.currentThread().isInterrupted()) {
        throw NodeExecutionException.cancelled(
            invocation.nodeId(), "interrupted before model turn " + (turn + 1), null);
      }
      if (++turn > maxTurns) {
        throw new NodeExecutionException(
            invocation.nodeId(),
            "Agent for node '%s' did not finish within %d turns"
                .formatted(invocation.nodeId(), maxTurns),
            null);
      }

      long start = System.currentTimeMillis();
      configBuilder.messages(localMessages);
      response = client.messages().create(configBuilder.build());
      TokenUsage turnUsage =
          new TokenUsage(response.usage().inputTokens(), response.usage().outputTokens());
      usage = usage.plus(turnUsage);
      log.info(
          "[Inference] node {} turn {} ({}): {} ms, {} tokens",
          invocation.nodeId(),
          turn,
          model,
          System.currentTimeMillis() - start,
          turnUsage.totalTokens());

      List<ToolUseBlock> toolCalls = new ArrayList<>();
      response
          .content()
          .forEach(
              block -> {
                if (block.isToolUse()) toolCalls.add(block.asToolUse());
              });
      boolean wantsTools =
          response.stopReason().map(StopReason.TOOL_USE::equals).orElse(false);
      if (toolCalls.isEmpty() || !wantsTools) {
        break;
      }

      localMessages.add(response.toParam());
      List<ContentBlockParam> results = new ArrayList<>();
      for (ToolUseBlock toolCall : toolCalls) {
        ContentBlock.ToolResultBlock result = callTool(invocation, byToolName, toolCall);
        collected.add(result);
        results.add(
            ContentBlockParam.ofToolResult(
                ToolResultBlockParam.builder()
                    .toolUseId(toolCall.id())
                    .content(renderForModel(result))
                    .isError(result.error())
                    .build()));
      }
      localMessages.add(
          MessageParam.builder().role(MessageParam.Role.USER).contentOfBlockParams(results).build());
    }

    String finalText =
        response.content().stream()
            .filter(com.anthropic.models.messages.ContentBlock::isText)
            .map(block -> block.asText().text())
            .collect(Collectors.joining("\n"));
    collected.add(ContentBlock.text(finalText));
    return new AgentInvocationResult(collected, usage);
  }

  private ContentBlock.ToolResultBlock callTool(
      AgentInvocation invocation, Map<String, Capability> byToolName, ToolUseBlock toolCall) {
    Capability capability = byToolName.get(toolCall.name());
    if (capability == null) {
      log.warn("Model requested unknown tool {} in node {}", toolCall.name(), invocation.nodeId());
      return new ContentBlock.ToolResultBlock(
          toolCall.name(),
          List.of(
              ContentBlock.text(
                  "Tool not found: %s, the tools available are: %s"
                      .formatted(toolCall.name(), String.join(", ", byToolName.keySet())))),
          true);
    }
    try {
      Map<String, Object> arguments = toolCall._input().convert(ARGUMENTS_TYPE);
      log.debug("Node {} calling {}", invocation.nodeId(), capability.name());
      return capability.handle().call(arguments == null ? Map.of() : arguments);
    } catch (Exception e) {
      log.warn("Tool {} failed: {}", capability.name(), ExceptionUtil.describe(e));
      return new ContentBlock.ToolResultBlock(
          capability.name(),
          List.of(
              ContentBlock.text(
                  "Error executing tool %s: %s"
                      .formatted(capability.name(), ExceptionUtil.describe(e)))),
          true);
    }
  }

  private static String renderForModel(ContentBlock.ToolResultBlock result) {
    List<String> parts = new ArrayList<>();
    for (ContentBlock block : result.content()) {
      if (block instanceof ContentBlock.TextBlock text) {
        parts.add(text.text());
      } else if (block instanceof ContentBlock.StructuredBlock structured) {
        parts.add(structured.data().toString());
      }
    }
    return parts.isEmpty() ? "(empty result)" : String.join("\n", parts);
  }

  private static Tool convertTool(String name, Capability capability) {
    Tool.InputSchema.Builder schema = Tool.InputSchema.builder().type(JsonValue.from("object"));
    JsonNode source = capability.inputSchema();
    if (source.has("properties")) {
      schema.putAdditionalProperty(
          "properties",
          JsonValue.from(
              JacksonUtility.getJsonMapper().convertValue(source.get("properties"), Map.class)));
    }
    if (source.has("required")) {
      schema.putAdditionalProperty(
          "required",
          JsonValue.from(
              JacksonUtility.getJsonMapper().convertValue(source.get("required"), List.class)));
    }
    return Tool.builder()
        .name(name)
        .description(capability.description())
        .inputSchema(schema.build())
        .build();
  }

  /** Tool names accepted by the API: letters, digits, underscore and hyphen, at most 64. */
  /**
   * Tool name for each capability, in order. Names that clean up to one already taken get a
   * {@code _2}, {@code _3}, ... suffix.
   */
  static Map<String, Capability> toolNames(List<Capability> capabilities) {
    Map<String, Capability> byToolName = new LinkedHashMap<>();
    for (Capability capability : capabilities) {
      String base = toolName(capability.name());
      String name = base;
      for (int n = 2; byToolName.containsKey(name); n++) {
        String suffix = "_" + n;
        name = base.substring(0, Math.min(base.length(), 64 - suffix.length())) + suffix;
      }
      if (!name.equals(base)) {
        log.warn(
            "Tool name '{}' of capability '{}' is already taken, using '{}'",
            base,
            capability.name(),
            name);
      }
      byToolName.put(name, capability);
    }
    return byToolName;
  }

  static String toolName(String capabilityName) {
    String sanitized = capabilityName.replaceAll("[^a-zA-Z0-9_-]", "_");
    return sanitized.length() > 64 ? sanitized.substring(0, 64) : sanitized;
  }
}
