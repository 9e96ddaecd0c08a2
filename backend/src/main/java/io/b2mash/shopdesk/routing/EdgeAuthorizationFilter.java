package io.b2mash.shopdesk.routing;

import io.b2mash.shopdesk.session.CredentialCookies;
import io.b2mash.shopdesk.session.SessionAttributes;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Runs the {@link EdgeAuthorizationGate} ahead of all other per-route logic. A denied request is
 * forwarded internally to the rewrite target, so the client keeps its original URL. A rotated
 * session credential is written to the response whatever the outcome, and the resolved session is
 * bound to the request for downstream filters.
 *
 * <p>Static assets are excluded via {@link #shouldNotFilter}.
 */
@Component
public class EdgeAuthorizationFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(EdgeAuthorizationFilter.class);

  private final EdgeAuthorizationGate gate;
  private final CredentialCookies cookies;

  public EdgeAuthorizationFilter(EdgeAuthorizationGate gate, CredentialCookies cookies) {
    this.gate = gate;
    this.cookies = cookies;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    String path = pathWithinApplication(request);
    GateDecision decision = gate.authorize(path, cookies.readSession(request));

    if (decision.rotatedCredential() != null) {
      cookies.writeSession(response, decision.rotatedCredential());
    }
    if (decision.sessionResolved()) {
      SessionAttributes.bind(request, decision.session());
    }

    if (decision.outcome() == GateDecision.Outcome.DENY_REWRITE) {
      log.info(
          "security.gate_denied path={} method={} target={}",
          path,
          request.getMethod(),
          decision.target());
      request.getRequestDispatcher(decision.target()).forward(request, response);
      return;
    }
    filterChain.doFilter(request, response);
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return gate.isStaticAsset(pathWithinApplication(request));
  }

  static String pathWithinApplication(HttpServletRequest request) {
    String uri = request.getRequestURI();
    String contextPath = request.getContextPath();
    if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
      return uri.substring(contextPath.length());
    }
    return uri;
  }
}
