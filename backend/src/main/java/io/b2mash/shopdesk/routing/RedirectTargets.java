package io.b2mash.shopdesk.routing;

import java.net.URI;

/** Post-action redirect targets supplied by clients. Only same-origin relative paths are kept. */
public final class RedirectTargets {

  public static final String DEFAULT_TARGET = "/dashboard";

  /** Returns {@code target} when it is a relative path on this origin, else the dashboard. */
  public static String safe(String target) {
    if (target == null
        || !target.startsWith("/")
        || target.startsWith("//")
        || target.contains("\\")
        || target.contains("://")) {
      return DEFAULT_TARGET;
    }
    try {
      URI uri = URI.create(target);
      return uri.getHost() == null ? target : DEFAULT_TARGET;
    } catch (IllegalArgumentException e) {
      return DEFAULT_TARGET;
    }
  }

  private RedirectTargets() {}
}
