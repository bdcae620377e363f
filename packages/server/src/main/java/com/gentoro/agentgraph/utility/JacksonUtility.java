package com.gentoro.agentgraph.utility;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.gentoro.agentgraph.exception.SerializationException;

/** Shared, preconfigured Jackson mappers. All are thread-safe once built. */
public final class JacksonUtility {
  private static final ObjectMapper YAML =
      YAMLMapper.builder()
          .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
          .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
          .build();

  /** Lenient reader, compact writer: unknown properties ignored, nulls omitted. */
  private static final ObjectMapper JSON =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
          .serializationInclusion(JsonInclude.Include.NON_NULL)
          .build();

  /** Rejects a document followed by anything but whitespace. */
  private static final ObjectMapper STRICT_JSON =
      JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build();

  private JacksonUtility() {}

  public static ObjectMapper getYamlMapper() {
    return YAML;
  }

  public static ObjectMapper getJsonMapper() {
    return JSON;
  }

  public static ObjectMapper getStrictJsonMapper() {
    return STRICT_JSON;
  }

  public static String toJson(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new SerializationException(
          "Could not serialize " + (value == null ? "null" : value.getClass().getSimpleName()), e);
    }
  }
}
