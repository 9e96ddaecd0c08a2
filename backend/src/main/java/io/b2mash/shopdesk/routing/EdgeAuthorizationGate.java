package io.b2mash.shopdesk.routing;

import io.b2mash.shopdesk.session.ResolvedSession;
import io.b2mash.shopdesk.session.SessionResolver;
import org.springframework.stereotype.Component;

/**
 * Decides, per request path and credential, whether the request proceeds as is or is rewritten to
 * the unauthorized or authorized landing content. Only protected and auth-only paths cost a
 * session lookup. Never throws: an unusable credential counts as no session.
 */
@Component
public class EdgeAuthorizationGate {

  private final RouteClassifier classifier;
  private final SessionResolver sessionResolver;
  private final String unauthorizedTarget;
  private final String authorizedTarget;

  public EdgeAuthorizationGate(
      RouteClassifier classifier, SessionResolver sessionResolver, RouteProperties properties) {
    this.classifier = classifier;
    this.sessionResolver = sessionResolver;
    this.unauthorizedTarget = properties.unauthorizedTarget();
    this.authorizedTarget = properties.authorizedTarget();
  }

  public GateDecision authorize(String path, String credential) {
    RouteClass routeClass = classifier.classify(path);
    if (routeClass == RouteClass.PUBLIC) {
      return GateDecision.passThrough();
    }

    ResolvedSession resolved = sessionResolver.resolve(credential).orElse(null);
    boolean present = resolved != null;
    if (routeClass == RouteClass.PROTECTED) {
      return present
          ? GateDecision.allow(resolved)
          : GateDecision.denyRewrite(unauthorizedTarget, null);
    }
    return present
        ? GateDecision.denyRewrite(authorizedTarget, resolved)
        : GateDecision.allow(null);
  }

  public boolean isStaticAsset(String path) {
    return classifier.isStaticAsset(path);
  }
}
