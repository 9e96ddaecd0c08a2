package io.b2mash.shopdesk.identity;

import com.nimbusds.jwt.JWTClaimsSet;
import io.b2mash.shopdesk.exception.IdentityLookupException;
import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.routing.RedirectTargets;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import io.b2mash.shopdesk.session.SessionTokenException;
import java.net.URI;
import java.text.ParseException;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * OAuth2 authorization-code client for federated sign-in. The {@code state} parameter is a
 * short-lived credential signed by {@link SessionTokenCodec} that binds the provider name and the
 * post-sign-in redirect target, so the callback needs no server-side storage.
 */
@Component
public class FederatedSignInClient {

  private static final Logger log = LoggerFactory.getLogger(FederatedSignInClient.class);

  static final String TYPE_STATE = "federated_state";
  private static final Duration STATE_TTL = Duration.ofMinutes(10);
  private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP =
      new ParameterizedTypeReference<>() {};

  private final FederatedProperties properties;
  private final SessionTokenCodec codec;
  private final RestClient restClient;

  public FederatedSignInClient(
      FederatedProperties properties, SessionTokenCodec codec, RestClient.Builder builder) {
    this.properties = properties;
    this.codec = codec;
    this.restClient = builder.build();
  }

  /** Builds the provider authorization URL that starts the sign-in. */
  public URI authorizationUri(String provider, String redirectTarget) {
    var config = provider(provider);
    String state =
        codec.sign(
            TYPE_STATE,
            null,
            new JWTClaimsSet.Builder()
                .claim("prv", provider)
                .claim("rdr", RedirectTargets.safe(redirectTarget)),
            STATE_TTL);
    return UriComponentsBuilder.fromUriString(config.authorizationUri())
        .queryParam("response_type", "code")
        .queryParam("client_id", config.clientId())
        .queryParam("redirect_uri", config.redirectUri())
        .queryParam("scope", config.scope() != null ? config.scope() : "openid email profile")
        .queryParam("state", state)
        .encode()
        .build()
        .toUri();
  }

  /**
   * Exchanges the callback's authorization code for the user's profile.
   *
   * @throws ValidationException if the provider is unknown or the state is invalid or expired
   * @throws IdentityLookupException if the provider cannot be reached
   */
  public FederatedProfile exchange(String provider, String code, String state) {
    var config = provider(provider);
    String redirectTarget = verifyState(provider, state);
    if (code == null || code.isBlank()) {
      throw new ValidationException("Sign-in failed", "Missing authorization code");
    }

    try {
      var form = new LinkedMultiValueMap<String, String>();
      form.add("grant_type", "authorization_code");
      form.add("code", code);
      form.add("redirect_uri", config.redirectUri());
      form.add("client_id", config.clientId());
      form.add("client_secret", config.clientSecret());

      Map<String, Object> token =
          restClient
              .post()
              .uri(config.tokenUri())
              .contentType(MediaType.APPLICATION_FORM_URLENCODED)
              .body(form)
              .retrieve()
              .body(JSON_MAP);
      Object accessToken = token != null ? token.get("access_token") : null;
      if (!(accessToken instanceof String bearer)) {
        throw new IdentityLookupException(
            "Provider " + provider + " returned no access token", null);
      }

      Map<String, Object> userInfo =
          restClient
              .get()
              .uri(config.userInfoUri())
              .headers(headers -> headers.setBearerAuth(bearer))
              .retrieve()
              .body(JSON_MAP);
      if (userInfo == null) {
        throw new IdentityLookupException("Provider " + provider + " returned no profile", null);
      }
      return new FederatedProfile(
          asString(userInfo.get("email")),
          Boolean.TRUE.equals(userInfo.get("email_verified")),
          asString(userInfo.get("name")),
          asString(userInfo.get("picture")),
          redirectTarget);
    } catch (RestClientException e) {
      log.warn("Federated sign-in exchange with {} failed: {}", provider, e.getMessage());
      throw new IdentityLookupException("Sign-in provider unavailable", e);
    }
  }

  private FederatedProperties.Provider provider(String name) {
    var config =
        name != null ? properties.providers().get(name.toLowerCase(Locale.ROOT)) : null;
    if (config == null) {
      throw new ValidationException("Unknown provider", "Sign-in provider is not configured");
    }
    return config;
  }

  private String verifyState(String provider, String state) {
    try {
      JWTClaimsSet claims = codec.verify(state, TYPE_STATE);
      if (!provider.equalsIgnoreCase(claims.getStringClaim("prv"))) {
        throw new ValidationException("Sign-in failed", "Sign-in state does not match provider");
      }
      return RedirectTargets.safe(claims.getStringClaim("rdr"));
    } catch (SessionTokenException | ParseException e) {
      log.info("security.auth_failed reason=federated_state provider={}", provider);
      throw new ValidationException("Sign-in failed", "Sign-in request is invalid or expired");
    }
  }

  private static String asString(Object value) {
    return value instanceof String s && !s.isBlank() ? s : null;
  }
}
