package com.gentoro.agentgraph.gateway;

import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.ConfigException;
import com.gentoro.agentgraph.exception.ExceptionUtil;
import com.gentoro.agentgraph.exception.NetworkException;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpSchema;
import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/** Opens MCP Streamable HTTP sessions against the gateway URL with a bearer token. */
public class McpGatewaySessionFactory implements GatewaySessionFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(McpGatewaySessionFactory.class);

  private final String baseUrl;
  private final String endpoint;
  private final Duration requestTimeout;
  private final String clientName;

  public McpGatewaySessionFactory(String gatewayUrl, Duration requestTimeout, String clientName) {
    Objects.requireNonNull(gatewayUrl, "gatewayUrl");
    URI uri;
    try {
      uri = URI.create(gatewayUrl);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid gateway url: " + gatewayUrl, e);
    }
    if (uri.getScheme() == null || uri.getAuthority() == null) {
      throw new ConfigException("Gateway url must be absolute: " + gatewayUrl);
    }
    this.baseUrl = uri.getScheme() + "://" + uri.getAuthority();
    String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/mcp" : uri.getRawPath();
    this.endpoint = uri.getRawQuery() == null ? path : path + "?" + uri.getRawQuery();
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.clientName = Objects.requireNonNull(clientName, "clientName");
  }

  @Override
  public GatewaySession open(String accessToken, RequestContext context) {
    HttpClientStreamableHttpTransport transport =
        HttpClientStreamableHttpTransport.builder(baseUrl)
            .endpoint(endpoint)
            .customizeRequest(b -> b.header("Authorization", "Bearer " + accessToken))
            .build();

    McpSyncClient client =
        McpClient.sync(transport)
            .requestTimeout(requestTimeout)
            .clientInfo(new McpSchema.Implementation(clientName, "0.1.0"))
            .build();
    try {
      client.initialize();
    } catch (RuntimeException e) {
      client.close();
      throw new NetworkException(
          "Could not connect to gateway %s%s: %s"
              .formatted(baseUrl, endpoint, ExceptionUtil.describe(e)),
          e);
    }
    log.info("Gateway session opened at {}{}", baseUrl, endpoint);
    return new McpGatewaySession(client);
  }

  String baseUrl() {
    return baseUrl;
  }

  String endpoint() {
    return endpoint;
  }
}
