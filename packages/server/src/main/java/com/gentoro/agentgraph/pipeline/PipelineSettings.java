package com.gentoro.agentgraph.pipeline;

import com.gentoro.agentgraph.config.AgentGraphSettings;
import java.util.Objects;
import org.apache.commons.configuration2.Configuration;

/**
 * Shape of the two-agent pipeline.
 *
 * @param followUpPrompt input of the summarizing node; null means the template's user section
 */
public record PipelineSettings(
    String channel, String slackKeyword, String tavilyKeyword, String followUpPrompt) {
  public static final String DEFAULT_CHANNEL = "test-strands-agents";

  public static PipelineSettings from(Configuration cfg) {
    return new PipelineSettings(
        Objects.requireNonNullElse(
            AgentGraphSettings.value(cfg, "pipeline.channel"), DEFAULT_CHANNEL),
        Objects.requireNonNullElse(AgentGraphSettings.value(cfg, "pipeline.slack-keyword"), "slack"),
        Objects.requireNonNullElse(
            AgentGraphSettings.value(cfg, "pipeline.tavily-keyword"), "tavily"),
        AgentGraphSettings.value(cfg, "pipeline.follow-up-prompt"));
  }
}
