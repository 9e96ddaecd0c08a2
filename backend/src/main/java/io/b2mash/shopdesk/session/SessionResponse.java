package io.b2mash.shopdesk.session;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

public record SessionResponse(
    String subject,
    Set<Channel> verifiedChannels,
    Map<String, Object> claims,
    Instant expiresAt) {

  public static SessionResponse from(Session session) {
    return new SessionResponse(
        session.subject(), session.verifiedChannels(), session.claims(), session.expiresAt());
  }
}
