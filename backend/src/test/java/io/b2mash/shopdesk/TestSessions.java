package io.b2mash.shopdesk;

import io.b2mash.shopdesk.routing.RouteProperties;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Shared fixtures for unit tests. */
public final class TestSessions {

  public static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  public static final String SECRET = "test-secret-key-that-is-at-least-32-bytes-long";

  public static Clock clockAt(Instant instant) {
    return Clock.fixed(instant, ZoneOffset.UTC);
  }

  public static SessionProperties sessionProperties() {
    return new SessionProperties(
        SECRET, Duration.ofDays(7), Duration.ofDays(1), "sd_session", false);
  }

  public static RouteProperties routeProperties() {
    return new RouteProperties(
        List.of(
            "/dashboard",
            "/parties",
            "/inventory",
            "/analytics",
            "/account_settings",
            "/settings",
            "/businesses",
            "/bills"),
        List.of("/login", "/signup"),
        List.of("/_next/static", "/_next/image", "/favicon.ico"),
        List.of("svg", "png", "jpg", "jpeg", "gif", "webp", "woff", "woff2", "ttf"),
        null,
        null);
  }

  public static Session session(String subject) {
    return new Session(
        subject, Set.of(Channel.EMAIL), Map.of("email", subject + "@example.com"), null);
  }

  private TestSessions() {}
}
