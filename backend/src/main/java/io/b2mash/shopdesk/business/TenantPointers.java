package io.b2mash.shopdesk.business;

import io.b2mash.shopdesk.session.CredentialCookies;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;

/** Creates the cookie-backed {@link TenantPointer} for a request. */
@Component
public class TenantPointers {

  private final CredentialCookies cookies;
  private final TenancyProperties properties;

  public TenantPointers(CredentialCookies cookies, TenancyProperties properties) {
    this.cookies = cookies;
    this.properties = properties;
  }

  public TenantPointer forRequest(HttpServletRequest request, HttpServletResponse response) {
    return new CookieTenantPointer(request, response, cookies, properties);
  }

  /** Clears the pointer cookie unconditionally, as on sign-out. */
  public void clear(HttpServletResponse response) {
    cookies.clear(response, properties.pointerCookieName());
  }
}
