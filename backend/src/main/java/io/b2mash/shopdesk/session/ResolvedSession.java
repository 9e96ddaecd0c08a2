package io.b2mash.shopdesk.session;

/**
 * A session resolved from a request credential.
 *
 * @param session the live session
 * @param rotatedCredential a re-issued credential to attach to the response, or null if the
 *     presented one is still fresh
 */
public record ResolvedSession(Session session, String rotatedCredential) {

  public boolean rotated() {
    return rotatedCredential != null;
  }
}
