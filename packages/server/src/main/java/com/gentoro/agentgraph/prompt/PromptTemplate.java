package com.gentoro.agentgraph.prompt;

import java.util.List;
import java.util.Map;

/** Immutable prompt made of role-tagged sections, rendered with template variables. */
public interface PromptTemplate {
  String id();

  List<PromptSection> sections();

  /**
   * Render every enabled section of the given role, joined by a blank line. Returns an empty
   * string when the template has no such section.
   */
  String render(Role role, Map<String, Object> vars);

  enum Role {
    SYSTEM,
    USER
  }

  record PromptSection(Role role, String id, boolean enabled, String content) {}
}
