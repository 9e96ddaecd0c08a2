package io.b2mash.shopdesk.business;

import io.b2mash.shopdesk.session.CredentialCookies;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link TenantPointer} stored in an HttpOnly cookie. A write is visible to later reads within the
 * same request, and a write of the value already held emits no header.
 */
public class CookieTenantPointer implements TenantPointer {

  private final HttpServletRequest request;
  private final HttpServletResponse response;
  private final CredentialCookies cookies;
  private final TenancyProperties properties;

  private boolean written;
  private String current;

  public CookieTenantPointer(
      HttpServletRequest request,
      HttpServletResponse response,
      CredentialCookies cookies,
      TenancyProperties properties) {
    this.request = request;
    this.response = response;
    this.cookies = cookies;
    this.properties = properties;
  }

  @Override
  public Optional<String> get() {
    return Optional.ofNullable(written ? current : readCookie());
  }

  @Override
  public void set(UUID businessId) {
    String value = businessId.toString();
    if (value.equals(get().orElse(null))) {
      return;
    }
    cookies.write(response, properties.pointerCookieName(), value, properties.pointerTtl());
    written = true;
    current = value;
  }

  @Override
  public void clear() {
    if (get().isEmpty()) {
      return;
    }
    cookies.clear(response, properties.pointerCookieName());
    written = true;
    current = null;
  }

  private String readCookie() {
    return cookies.read(request, properties.pointerCookieName());
  }
}
