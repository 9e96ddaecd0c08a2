package io.b2mash.shopdesk.routing;

import io.b2mash.shopdesk.session.ResolvedSession;
import io.b2mash.shopdesk.session.Session;

/**
 * Outcome of {@link EdgeAuthorizationGate#authorize}.
 *
 * @param outcome what the filter must do with the request
 * @param target internal rewrite target, set only for {@link Outcome#DENY_REWRITE}
 * @param resolved the session resolved for the request, or null when none was present or the path
 *     was never looked up
 */
public record GateDecision(Outcome outcome, String target, ResolvedSession resolved) {

  public enum Outcome {
    ALLOW,
    DENY_REWRITE,
    PASS_THROUGH
  }

  public static GateDecision allow(ResolvedSession resolved) {
    return new GateDecision(Outcome.ALLOW, null, resolved);
  }

  public static GateDecision denyRewrite(String target, ResolvedSession resolved) {
    return new GateDecision(Outcome.DENY_REWRITE, target, resolved);
  }

  public static GateDecision passThrough() {
    return new GateDecision(Outcome.PASS_THROUGH, null, null);
  }

  /** True when the session was looked up, whether or not one was found. */
  public boolean sessionResolved() {
    return outcome != Outcome.PASS_THROUGH;
  }

  public Session session() {
    return resolved != null ? resolved.session() : null;
  }

  /** Re-issued credential to attach to the response, or null. */
  public String rotatedCredential() {
    return resolved != null ? resolved.rotatedCredential() : null;
  }
}
