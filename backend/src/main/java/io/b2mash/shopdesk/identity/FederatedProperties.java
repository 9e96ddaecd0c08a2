package io.b2mash.shopdesk.identity;

import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * OAuth2 providers available for federated sign-in, keyed by the name used in {@code
 * /auth/federated/{provider}}.
 */
@ConfigurationProperties(prefix = "shopdesk.federated")
public record FederatedProperties(Map<String, Provider> providers) {

  public FederatedProperties {
    providers = providers != null ? Map.copyOf(providers) : Map.of();
  }

  /**
   * @param redirectUri the callback registered with the provider, normally {@code
   *     https://<host>/auth/callback?provider=<name>}
   */
  public record Provider(
      String authorizationUri,
      String tokenUri,
      String userInfoUri,
      String clientId,
      String clientSecret,
      String scope,
      String redirectUri) {}
}
