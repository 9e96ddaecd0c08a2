package io.b2mash.shopdesk.session;

import jakarta.servlet.http.HttpServletRequest;
import java.util.Optional;

/**
 * Request attributes through which a resolved session is handed from the filters to controllers.
 * The session travels with the request object; there is no thread-bound or static holder.
 */
public final class SessionAttributes {

  public static final String SESSION = SessionAttributes.class.getName() + ".SESSION";

  /** Marks a request whose credential an earlier filter already resolved, present or not. */
  public static final String RESOLVED = SessionAttributes.class.getName() + ".RESOLVED";

  public static Optional<Session> get(HttpServletRequest request) {
    return request.getAttribute(SESSION) instanceof Session session
        ? Optional.of(session)
        : Optional.empty();
  }

  public static void bind(HttpServletRequest request, Session session) {
    request.setAttribute(RESOLVED, Boolean.TRUE);
    if (session != null) {
      request.setAttribute(SESSION, session);
    }
  }

  public static boolean isResolved(HttpServletRequest request) {
    return Boolean.TRUE.equals(request.getAttribute(RESOLVED));
  }

  private SessionAttributes() {}
}
