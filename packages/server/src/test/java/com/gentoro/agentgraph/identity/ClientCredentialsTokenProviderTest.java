package com.gentoro.agentgraph.identity;

import static com.gentoro.agentgraph.Fixtures.context;
import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.exception.NetworkException;
import com.gentoro.agentgraph.http.EmbeddedJettyServer;
import com.gentoro.agentgraph.http.OkHttpFactory;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;
import okhttp3.Credentials;
import org.apache.commons.configuration2.BaseConfiguration;
import org.eclipse.jetty.ee10.servlet.ServletHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Client-credentials token provider")
class ClientCredentialsTokenProviderTest {
  private EmbeddedJettyServer server;
  private final AtomicReference<String> authorization = new AtomicReference<>();
  private final AtomicReference<String> form = new AtomicReference<>();
  private volatile int status = 200;
  private volatile String answer = "{\"access_token\":\"abc.def.ghi\",\"token_type\":\"Bearer\"}";

  @BeforeEach
  void start() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("http.hostname", "127.0.0.1");
    cfg.addProperty("http.port", 0);
    server = new EmbeddedJettyServer(cfg);
    server.prepare();
    server
        .getContextHandler()
        .addServlet(
            new ServletHolder(
                new HttpServlet() {
                  @Override
                  protected void doPost(HttpServletRequest req, HttpServletResponse resp)
                      throws IOException {
                    authorization.set(req.getHeader("Authorization"));
                    form.set(new String(req.getInputStream().readAllBytes()));
                    resp.setStatus(status);
                    resp.setContentType("application/json");
                    resp.getWriter().print(answer);
                  }
                }),
            "/oauth2/token");
    server.start();
  }

  @AfterEach
  void stop() {
    server.close();
  }

  private ClientCredentialsTokenProvider provider() {
    return new ClientCredentialsTokenProvider(
        OkHttpFactory.create(),
        "http://127.0.0.1:" + server.getPort() + "/oauth2/token",
        "client-a",
        "secret-b",
        "gateway/invoke");
  }

  @Test
  void exchangesClientCredentials() {
    assertEquals("abc.def.ghi", provider().getAccessToken(context()));
    assertEquals(Credentials.basic("client-a", "secret-b"), authorization.get());
    assertTrue(form.get().contains("grant_type=client_credentials"));
    assertTrue(form.get().contains("scope=gateway%2Finvoke"));
  }

  @Test
  @DisplayName("Rejected credentials are reported as unauthenticated")
  void rejectedCredentialsAreUnauthenticated() {
    status = 401;
    answer = "{\"error\":\"invalid_client\"}";
    NetworkException ex =
        assertThrows(NetworkException.class, () -> provider().getAccessToken(context()));
    assertEquals(AgentGraphErrorCode.UNAUTHENTICATED, ex.getCode());
    assertTrue(ex.getMessage().contains("401"));
  }

  @Test
  void serverErrorIsNetworkError() {
    status = 503;
    answer = "{\"error\":\"unavailable\"}";
    NetworkException ex =
        assertThrows(NetworkException.class, () -> provider().getAccessToken(context()));
    assertEquals(AgentGraphErrorCode.NETWORK_ERROR, ex.getCode());
    assertTrue(ex.getMessage().contains("503"));
  }

  @Test
  void missingTokenIsNetworkException() {
    answer = "{\"token_type\":\"Bearer\"}";
    assertThrows(NetworkException.class, () -> provider().getAccessToken(context()));
  }

  @Test
  void unreachableEndpoint() {
    ClientCredentialsTokenProvider unreachable =
        new ClientCredentialsTokenProvider(
            OkHttpFactory.create(), "http://127.0.0.1:1/token", "a", "b", "c");
    assertThrows(NetworkException.class, () -> unreachable.getAccessToken(context()));
  }
}
