package io.b2mash.shopdesk.security;

import io.b2mash.shopdesk.session.CredentialCookies;
import io.b2mash.shopdesk.session.ResolvedSession;
import io.b2mash.shopdesk.session.SessionAttributes;
import io.b2mash.shopdesk.session.SessionResolver;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the request's session to the Spring Security context for {@code /api/**} and {@code
 * /auth/**}. Reuses the result of {@link io.b2mash.shopdesk.routing.EdgeAuthorizationFilter}
 * when the gate already resolved the credential; otherwise resolves it here and writes any
 * rotated credential.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

  private final SessionResolver sessionResolver;
  private final CredentialCookies cookies;

  public SessionAuthenticationFilter(SessionResolver sessionResolver, CredentialCookies cookies) {
    this.sessionResolver = sessionResolver;
    this.cookies = cookies;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    if (!SessionAttributes.isResolved(request)) {
      ResolvedSession resolved =
          sessionResolver.resolve(cookies.readSession(request)).orElse(null);
      if (resolved != null && resolved.rotated()) {
        cookies.writeSession(response, resolved.rotatedCredential());
      }
      SessionAttributes.bind(request, resolved != null ? resolved.session() : null);
    }

    SessionAttributes.get(request)
        .ifPresent(
            session -> {
              var context = SecurityContextHolder.createEmptyContext();
              context.setAuthentication(new SessionAuthenticationToken(session));
              SecurityContextHolder.setContext(context);
            });
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI().substring(request.getContextPath().length());
    return !(path.startsWith("/api/") || path.startsWith("/auth/"));
  }
}
