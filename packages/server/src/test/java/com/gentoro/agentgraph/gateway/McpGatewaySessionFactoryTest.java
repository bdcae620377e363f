package com.gentoro.agentgraph.gateway;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.exception.ConfigException;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class McpGatewaySessionFactoryTest {

  private static McpGatewaySessionFactory factory(String url) {
    return new McpGatewaySessionFactory(url, Duration.ofSeconds(5), "agentgraph-test");
  }

  @Test
  void splitsBaseAndEndpoint() {
    McpGatewaySessionFactory f = factory("https://gw.example.com:8443/gateway/mcp");
    assertEquals("https://gw.example.com:8443", f.baseUrl());
    assertEquals("/gateway/mcp", f.endpoint());
  }

  @Test
  void defaultsEndpointAndKeepsQuery() {
    assertEquals("/mcp", factory("http://localhost:8000").endpoint());
    assertEquals("/mcp?tenant=a", factory("http://localhost:8000/mcp?tenant=a").endpoint());
  }

  @Test
  void rejectsRelativeOrInvalidUrls() {
    assertThrows(ConfigException.class, () -> factory("/mcp"));
    assertThrows(ConfigException.class, () -> factory("http://bad host/mcp"));
  }
}
