package com.gentoro.agentgraph.prompt;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NotFoundException;
import com.gentoro.agentgraph.exception.PromptException;
import com.gentoro.agentgraph.exception.ValidationException;
import com.gentoro.agentgraph.utility.JacksonUtility;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Loads prompt YAML templates from the classpath under a base directory, e.g. {@code "prompts"}
 * resolves {@code prompts/slack_agent.yaml}.
 *
 * <pre>
 * sections:
 *   - role: system
 *     id: instructions
 *     content: |
 *       ...
 * </pre>
 */
public class ClasspathPromptRepository implements PromptRepository {
  private final String basePath;
  private final ClassLoader classLoader;

  public ClasspathPromptRepository(String basePath) {
    this(basePath, Thread.currentThread().getContextClassLoader());
  }

  public ClasspathPromptRepository(String basePath, ClassLoader classLoader) {
    this.basePath = normalize(Objects.requireNonNull(basePath, "basePath"));
    this.classLoader =
        Objects.requireNonNullElseGet(
            classLoader, () -> ClasspathPromptRepository.class.getClassLoader());
  }

  @Override
  public PromptTemplate get(String name) {
    String id = name.startsWith("/") ? name.substring(1) : name;
    String resource = resolveExisting(id);
    if (resource == null) {
      throw new NotFoundException("Prompt not found on classpath: " + basePath + "/" + id);
    }
    try (InputStream is = classLoader.getResourceAsStream(resource)) {
      if (is == null) {
        throw new NotFoundException("Prompt resource not found: " + resource);
      }
      JsonNode root = JacksonUtility.getYamlMapper().readTree(is);
      JsonNode arr = root == null ? null : root.get("sections");
      if (arr == null || !arr.isArray()) {
        throw new ValidationException("Prompt YAML must contain a 'sections' array: " + id);
      }

      List<PromptTemplate.PromptSection> sections = new ArrayList<>();
      for (JsonNode n : arr) {
        String roleStr = n.path("role").asText("");
        PromptTemplate.Role role =
            switch (roleStr.toLowerCase(Locale.ROOT)) {
              case "system" -> PromptTemplate.Role.SYSTEM;
              case "user" -> PromptTemplate.Role.USER;
              default -> throw new ValidationException(
                  "Unknown role '" + roleStr + "' in prompt: " + id);
            };
        String sectionId = n.path("id").asText("");
        if (sectionId.isBlank()) {
          throw new ValidationException("Missing section id in prompt: " + id);
        }
        String content = n.path("content").asText("");
        if (content.isBlank()) {
          throw new ValidationException(
              "Empty content for section '" + sectionId + "' in prompt: " + id);
        }
        sections.add(
            new PromptTemplate.PromptSection(
                role, sectionId, n.path("enabled").asBoolean(true), content));
      }
      return new PebblePromptTemplate(id, sections);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e, ex -> new PromptException("Failed to read prompt file: " + name, ex));
    }
  }

  private String resolveExisting(String id) {
    String yaml = basePath + "/" + id + ".yaml";
    if (classLoader.getResource(yaml) != null) return yaml;
    String yml = basePath + "/" + id + ".yml";
    if (classLoader.getResource(yml) != null) return yml;
    return null;
  }

  private static String normalize(String p) {
    String out = p.trim();
    if (out.startsWith("classpath:")) out = out.substring("classpath:".length());
    if (out.startsWith("/")) out = out.substring(1);
    if (out.endsWith("/")) out = out.substring(0, out.length() - 1);
    return out;
  }
}
