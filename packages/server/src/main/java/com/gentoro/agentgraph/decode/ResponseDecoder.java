package com.gentoro.agentgraph.decode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.nio.charset.StandardCharsets;

/**
 * Turns a raw runtime response body into a {@link DecodedResult}.
 *
 * <p>The body is first read as one JSON document. When that fails it is read line by line as a
 * server-sent event stream ({@code data: } prefixes are stripped) and the first line that
 * classifies wins. Anything else is plain text. Decoding never throws.
 */
public class ResponseDecoder {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(ResponseDecoder.class);

  private final ObjectMapper mapper;

  public ResponseDecoder() {
    this(JacksonUtility.getStrictJsonMapper());
  }

  ResponseDecoder(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  public DecodedResult decode(byte[] body) {
    if (body == null || body.length == 0) {
      return DecodedResult.empty();
    }
    String raw = new String(body, StandardCharsets.UTF_8);
    if (raw.isBlank()) {
      return DecodedResult.empty();
    }

    DecodedResult whole = classify(parse(raw));
    if (whole != null) {
      return whole;
    }

    for (String line : raw.split("\\r?\\n")) {
      String candidate = line.trim();
      if (candidate.isEmpty()) continue;
      if (candidate.startsWith("data:")) {
        candidate = candidate.substring("data:".length()).trim();
      }
      DecodedResult decoded = classify(parse(candidate));
      if (decoded != null) {
        return decoded;
      }
    }

    log.debug("Response is not JSON, returning it as text ({} chars)", raw.length());
    return DecodedResult.text(raw);
  }

  public DecodedResult decode(String body) {
    return decode(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
  }

  /** Message for an {@code error} member that is JSON null. */
  static final String UNKNOWN_ERROR = "Unknown error";

  /** Null when the node does not classify (numbers, booleans, null, unparseable input). */
  private DecodedResult classify(JsonNode node) {
    if (node == null) return null;
    if (node.isObject()) {
      if (node.has("error")) {
        JsonNode error = node.get("error");
        if (error.isNull()) return DecodedResult.error(UNKNOWN_ERROR);
        return DecodedResult.error(error.isTextual() ? error.asText() : error.toString());
      }
      return DecodedResult.structured(node);
    }
    if (node.isArray()) {
      return DecodedResult.structured(node);
    }
    if (node.isTextual()) {
      JsonNode embedded = embeddedReport(node.asText());
      return embedded != null ? DecodedResult.structured(embedded) : DecodedResult.text(node.asText());
    }
    return null;
  }

  /** A JSON string that itself holds a report object ({@code agents} and {@code status}). */
  private JsonNode embeddedReport(String text) {
    String trimmed = text.trim();
    if (!trimmed.startsWith("{")) return null;
    JsonNode inner = parse(trimmed);
    if (inner != null && inner.isObject() && inner.has("agents") && inner.has("status")) {
      return inner;
    }
    return null;
  }

  private JsonNode parse(String text) {
    if (text.isEmpty()) return null;
    try {
      JsonNode node = mapper.readTree(text);
      return node == null || node.isMissingNode() ? null : node;
    } catch (Exception e) {
      log.trace("Not a JSON document: {}", e.getMessage());
      return null;
    }
  }
}
