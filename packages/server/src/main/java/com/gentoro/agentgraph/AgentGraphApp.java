package com.gentoro.agentgraph;

public class AgentGraphApp {

  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(AgentGraphApp.class);

  public static void main(String[] args) {
    try {
      AgentGraph app = new AgentGraph(args);
      app.initialize();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
