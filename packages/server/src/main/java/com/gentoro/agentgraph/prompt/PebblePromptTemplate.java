package com.gentoro.agentgraph.prompt;

import com.gentoro.agentgraph.exception.PromptException;
import io.pebbletemplates.pebble.PebbleEngine;
import io.pebbletemplates.pebble.template.PebbleTemplate;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Pebble-backed {@link PromptTemplate}. Sections are compiled once, at construction. */
public class PebblePromptTemplate implements PromptTemplate {
  private static final PebbleEngine ENGINE =
      new PebbleEngine.Builder().strictVariables(true).autoEscaping(false).build();

  private final String id;
  private final List<PromptSection> sections;
  private final List<CompiledSection> compiled;

  private record CompiledSection(PromptSection section, PebbleTemplate template) {}

  public PebblePromptTemplate(String id, List<PromptSection> sections) {
    this.id = Objects.requireNonNull(id, "id");
    this.sections = List.copyOf(Objects.requireNonNull(sections, "sections"));
    this.compiled =
        this.sections.stream()
            .map(s -> new CompiledSection(s, ENGINE.getLiteralTemplate(s.content())))
            .toList();
  }

  @Override
  public String id() {
    return id;
  }

  @Override
  public List<PromptSection> sections() {
    return sections;
  }

  @Override
  public String render(Role role, Map<String, Object> vars) {
    Map<String, Object> ctx = vars == null ? Map.of() : new HashMap<>(vars);
    List<String> out = new ArrayList<>();
    for (CompiledSection cs : compiled) {
      PromptSection s = cs.section();
      if (s.role() != role || !s.enabled()) continue;
      try {
        StringWriter writer = new StringWriter();
        cs.template().evaluate(writer, ctx);
        out.add(writer.toString().trim());
      } catch (Exception e) {
        throw new PromptException(
            "Failed to render prompt section '" + s.id() + "' in template '" + id + "'", e);
      }
    }
    return String.join("\n\n", out);
  }
}
