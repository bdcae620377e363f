package com.gentoro.agentgraph.graph.event;

import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

class LoggingGraphEventSinkTest {

  @Test
  void logsNodeStartAsJson() {
    Logger logger = mock(Logger.class);

    new LoggingGraphEventSink(logger).onNodeStarted(null, "slack_agent");

    verify(logger)
        .info(
            eq("[graph.event] {}"),
            eq("{\"type\":\"node\",\"name\":\"slack_agent\",\"phase\":\"start\"}"));
  }
}
