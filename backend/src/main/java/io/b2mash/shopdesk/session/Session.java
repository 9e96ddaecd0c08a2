package io.b2mash.shopdesk.session;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * A live, identity-store-issued session. Immutable: the engine never edits claims in place, it
 * asks the identity store for a refreshed credential instead.
 */
public record Session(
    String subject, Set<Channel> verifiedChannels, Map<String, Object> claims, Instant expiresAt) {

  public Session {
    if (subject == null || subject.isBlank()) {
      throw new IllegalArgumentException("subject must not be blank");
    }
    verifiedChannels =
        verifiedChannels == null || verifiedChannels.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(Channel.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(verifiedChannels));
    claims =
        claims == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(claims));
  }

  public boolean isVerified(Channel channel) {
    return verifiedChannels.contains(channel);
  }

  /** Returns a string claim, or null when absent or not a string. */
  public String stringClaim(String name) {
    return claims.get(name) instanceof String value ? value : null;
  }

  public boolean isExpiredAt(Instant instant) {
    return expiresAt != null && !expiresAt.isAfter(instant);
  }
}
