package io.b2mash.shopdesk.routing;

/** Classification of an inbound request path, as seen by the edge gate. */
public enum RouteClass {
  /** Requires a live session. */
  PROTECTED,
  /** Login/signup pages: only meaningful without a session. */
  AUTH_ONLY,
  /** Everything else, including static assets. */
  PUBLIC
}
