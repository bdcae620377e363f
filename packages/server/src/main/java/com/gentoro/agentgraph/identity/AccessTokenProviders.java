package com.gentoro.agentgraph.identity;

import com.gentoro.agentgraph.config.AgentGraphSettings;
import com.gentoro.agentgraph.exception.ConfigException;
import com.gentoro.agentgraph.http.OkHttpFactory;
import okhttp3.OkHttpClient;
import org.apache.commons.configuration2.Configuration;

/**
 * Picks the token source from configuration: {@code identity.token-url} selects the
 * client-credentials grant, {@code identity.access-token} a fixed token.
 */
public final class AccessTokenProviders {
  private AccessTokenProviders() {}

  public static AccessTokenProvider fromSettings(AgentGraphSettings settings) {
    return fromSettings(settings, OkHttpFactory.create());
  }

  public static AccessTokenProvider fromSettings(AgentGraphSettings settings, OkHttpClient http) {
    Configuration cfg = settings.configuration();
    String tokenUrl = AgentGraphSettings.value(cfg, "identity.token-url");
    if (tokenUrl != null) {
      String clientId = AgentGraphSettings.value(cfg, "identity.client-id");
      String clientSecret = AgentGraphSettings.value(cfg, "identity.client-secret");
      if (clientId == null || clientSecret == null || settings.scope() == null) {
        throw new ConfigException(
            "identity.token-url requires identity.client-id, identity.client-secret and"
                + " identity.scope");
      }
      return new ClientCredentialsTokenProvider(
          http, tokenUrl, clientId, clientSecret, settings.scope());
    }
    String staticToken = AgentGraphSettings.value(cfg, "identity.access-token");
    if (staticToken != null) {
      return new StaticTokenProvider(staticToken);
    }
    throw new ConfigException(
        "No identity provider configured: set identity.token-url or identity.access-token");
  }
}
