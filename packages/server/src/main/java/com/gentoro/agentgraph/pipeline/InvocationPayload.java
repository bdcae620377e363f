package com.gentoro.agentgraph.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.exception.ValidationException;
import com.gentoro.agentgraph.utility.JacksonUtility;

/**
 * Prompt and session id extracted from an inbound invocation body. Accepted shapes, first match
 * wins:
 *
 * <ul>
 *   <li>{@code {"input": {"prompt": "...", "session_id": "..."}}}
 *   <li>{@code {"input": "<json object with prompt>"}} or {@code {"input": "plain prompt"}}
 *   <li>{@code {"prompt": "...", "session_id": "..."}}
 * </ul>
 *
 * @param sessionId null when the caller supplied none
 */
public record InvocationPayload(String prompt, String sessionId) {

  public static InvocationPayload resolve(JsonNode body) {
    if (body == null || !body.isObject()) {
      throw new ValidationException("Invalid payload: expected a JSON object");
    }
    JsonNode input = body.get("input");
    String prompt;
    String sessionId = text(body.get("session_id"));
    if (input != null && input.isObject()) {
      prompt = text(input.get("prompt"));
      if (text(input.get("session_id")) != null) sessionId = text(input.get("session_id"));
    } else if (input != null && input.isTextual()) {
      JsonNode decoded = tryParse(input.asText());
      if (decoded != null && decoded.isObject()) {
        prompt = text(decoded.get("prompt"));
        if (text(decoded.get("session_id")) != null) sessionId = text(decoded.get("session_id"));
      } else {
        prompt = input.asText();
      }
    } else {
      prompt = text(body.get("prompt"));
    }
    if (prompt == null || prompt.isBlank()) {
      throw new ValidationException("Invalid payload: a non-empty 'prompt' field is required");
    }
    return new InvocationPayload(prompt, sessionId);
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull()) return null;
    String value = node.isTextual() ? node.asText() : node.toString();
    return value.isBlank() ? null : value;
  }

  private static JsonNode tryParse(String raw) {
    String trimmed = raw.trim();
    if (!trimmed.startsWith("{")) return null;
    try {
      return JacksonUtility.getStrictJsonMapper().readTree(trimmed);
    } catch (Exception e) {
      return null;
    }
  }
}
