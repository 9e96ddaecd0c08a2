package io.b2mash.shopdesk.routing;

import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Maps a request path to a {@link RouteClass}. Pure: no I/O and no mutable state, so a single
 * instance is shared by every request thread.
 *
 * <p>Matching is case-sensitive. A protected prefix {@code /dashboard} matches {@code /dashboard}
 * and {@code /dashboard/anything}, but not {@code /dashboards}. Auth-only paths match exactly.
 * Static assets are {@link RouteClass#PUBLIC} regardless of any prefix overlap.
 */
@Component
public class RouteClassifier {

  private final List<String> protectedPrefixes;
  private final List<String> authOnlyPaths;
  private final List<String> staticAssetPrefixes;
  private final List<String> staticAssetSuffixes;

  public RouteClassifier(RouteProperties properties) {
    this.protectedPrefixes = properties.protectedPrefixes();
    this.authOnlyPaths = properties.authOnlyPaths();
    this.staticAssetPrefixes = properties.staticAssetPrefixes();
    this.staticAssetSuffixes =
        properties.staticAssetExtensions().stream()
            .map(ext -> "." + ext.toLowerCase(Locale.ROOT))
            .toList();
  }

  public RouteClass classify(String path) {
    if (path == null || path.isEmpty() || isStaticAsset(path)) {
      return RouteClass.PUBLIC;
    }
    for (String prefix : protectedPrefixes) {
      if (path.equals(prefix) || path.startsWith(prefix + "/")) {
        return RouteClass.PROTECTED;
      }
    }
    if (authOnlyPaths.contains(path)) {
      return RouteClass.AUTH_ONLY;
    }
    return RouteClass.PUBLIC;
  }

  /** Returns true for images, fonts and framework bundles, which bypass the gate entirely. */
  public boolean isStaticAsset(String path) {
    if (path == null) {
      return false;
    }
    for (String prefix : staticAssetPrefixes) {
      if (path.equals(prefix) || path.startsWith(prefix + "/")) {
        return true;
      }
    }
    // Extensions are matched case-insensitively: LOGO.PNG is still an image.
    String lower = path.toLowerCase(Locale.ROOT);
    for (String suffix : staticAssetSuffixes) {
      if (lower.endsWith(suffix)) {
        return true;
      }
    }
    return false;
  }
}
