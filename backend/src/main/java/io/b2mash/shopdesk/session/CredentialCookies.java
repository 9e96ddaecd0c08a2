package io.b2mash.shopdesk.session;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.time.Duration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the request-scoped credentials (session, tenant pointer, OTP flow state). All
 * cookies are HttpOnly, SameSite=Lax and scoped to {@code /}.
 */
@Component
public class CredentialCookies {

  private final SessionProperties properties;

  public CredentialCookies(SessionProperties properties) {
    this.properties = properties;
  }

  public String sessionCookieName() {
    return properties.cookieName();
  }

  public String readSession(HttpServletRequest request) {
    return read(request, properties.cookieName());
  }

  public void writeSession(HttpServletResponse response, String credential) {
    write(response, properties.cookieName(), credential, properties.ttl());
  }

  public void clearSession(HttpServletResponse response) {
    clear(response, properties.cookieName());
  }

  /** Returns the value of the named cookie, or null when absent or empty. */
  public String read(HttpServletRequest request, String name) {
    Cookie[] cookies = request.getCookies();
    if (cookies == null) {
      return null;
    }
    for (Cookie cookie : cookies) {
      if (name.equals(cookie.getName())) {
        String value = cookie.getValue();
        return value == null || value.isEmpty() ? null : value;
      }
    }
    return null;
  }

  /** Emits exactly one {@code Set-Cookie} header for the named cookie. */
  public void write(HttpServletResponse response, String name, String value, Duration maxAge) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(name, value, maxAge).toString());
  }

  public void clear(HttpServletResponse response, String name) {
    response.addHeader(HttpHeaders.SET_COOKIE, build(name, "", Duration.ZERO).toString());
  }

  private ResponseCookie build(String name, String value, Duration maxAge) {
    return ResponseCookie.from(name, value)
        .httpOnly(true)
        .secure(properties.secureCookies())
        .sameSite("Lax")
        .path("/")
        .maxAge(maxAge)
        .build();
  }
}
