package io.b2mash.shopdesk.session;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Session credential settings.
 *
 * @param secret HMAC secret for HS256 signing, at least 32 bytes
 * @param ttl lifetime of a session credential
 * @param rotateWithin a credential closer than this to expiry is re-issued on the next request
 * @param cookieName cookie carrying the session credential
 * @param secureCookies whether cookies are flagged {@code Secure}
 */
@ConfigurationProperties(prefix = "shopdesk.session")
public record SessionProperties(
    String secret,
    Duration ttl,
    Duration rotateWithin,
    String cookieName,
    boolean secureCookies) {

  public SessionProperties {
    if (secret == null || secret.length() < 32) {
      throw new IllegalArgumentException("shopdesk.session.secret must be at least 32 characters");
    }
    ttl = ttl != null ? ttl : Duration.ofDays(7);
    rotateWithin = rotateWithin != null ? rotateWithin : Duration.ofDays(1);
    cookieName = cookieName != null ? cookieName : "sd_session";
  }
}
