package com.gentoro.agentgraph.identity;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentgraph.context.RequestContext;
import com.gentoro.agentgraph.exception.AgentGraphErrorCode;
import com.gentoro.agentgraph.exception.NetworkException;
import com.gentoro.agentgraph.utility.JacksonUtility;
import com.gentoro.agentgraph.utility.StringUtility;
import java.io.IOException;
import java.util.Objects;
import okhttp3.Credentials;
import okhttp3.FormBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** OAuth2 client-credentials (machine to machine) grant against a token endpoint. */
public class ClientCredentialsTokenProvider implements AccessTokenProvider {
  private static final org.slf4j.Logger log =
      com.gentoro.agentgraph.logging.LoggingService.getLogger(
          ClientCredentialsTokenProvider.class);

  private final OkHttpClient http;
  private final String tokenUrl;
  private final String clientId;
  private final String clientSecret;
  private final String scope;

  public ClientCredentialsTokenProvider(
      OkHttpClient http, String tokenUrl, String clientId, String clientSecret, String scope) {
    this.http = Objects.requireNonNull(http, "http");
    this.tokenUrl = Objects.requireNonNull(tokenUrl, "tokenUrl");
    this.clientId = Objects.requireNonNull(clientId, "clientId");
    this.clientSecret = Objects.requireNonNull(clientSecret, "clientSecret");
    this.scope = Objects.requireNonNull(scope, "scope");
  }

  @Override
  public String getAccessToken(RequestContext context) {
    Request request =
        new Request.Builder()
            .url(tokenUrl)
            .header("Authorization", Credentials.basic(clientId, clientSecret))
            .post(
                new FormBody.Builder()
                    .add("grant_type", "client_credentials")
                    .add("scope", scope)
                    .build())
            .build();

    log.debug("Requesting access token for workload {}", context.workloadName());
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      String payload = body == null ? "" : body.string();
      if (response.code() == 401 || response.code() == 403) {
        throw new NetworkException(
            AgentGraphErrorCode.UNAUTHENTICATED,
            "Token endpoint rejected the client credentials (HTTP %d): %s"
                .formatted(response.code(), payload));
      }
      if (!response.isSuccessful()) {
        throw new NetworkException(
            "Token endpoint returned HTTP %d: %s".formatted(response.code(), payload));
      }
      JsonNode json = JacksonUtility.getJsonMapper().readTree(payload);
      JsonNode token = json == null ? null : json.get("access_token");
      if (token == null || !token.isTextual() || token.asText().isBlank()) {
        throw new NetworkException("Token endpoint response has no access_token");
      }
      log.info("Obtained access token {}", StringUtility.redact(token.asText()));
      return token.asText();
    } catch (IOException e) {
      throw new NetworkException("Could not obtain access token from " + tokenUrl, e);
    }
  }
}
