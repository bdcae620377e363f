package com.gentoro.agentgraph.prompt;

/** Read-only source of prompt templates. */
public interface PromptRepository {
  /**
   * Load a prompt template by id, e.g. {@code "slack_agent"}.
   *
   * @throws com.gentoro.agentgraph.exception.NotFoundException when no such template exists
   * @throws com.gentoro.agentgraph.exception.PromptException when the template cannot be parsed
   */
  PromptTemplate get(String id);
}
