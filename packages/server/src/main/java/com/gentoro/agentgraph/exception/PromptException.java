package com.gentoro.agentgraph.exception;

/** Prompt template could not be loaded or rendered. */
public class PromptException extends AgentGraphException {
  public PromptException(String message) {
    super(AgentGraphErrorCode.PROMPT_ERROR, message);
  }

  public PromptException(String message, Throwable cause) {
    super(AgentGraphErrorCode.PROMPT_ERROR, message, cause);
  }
}
