package io.b2mash.shopdesk.routing;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Route tables consulted by {@link RouteClassifier}.
 *
 * @param protectedPrefixes paths that need a session; matched exactly or as {@code prefix + "/"}
 * @param authOnlyPaths exact paths that an authenticated user must not see (login, signup)
 * @param staticAssetPrefixes path prefixes never classified (framework bundles, favicon)
 * @param staticAssetExtensions file extensions never classified, without the leading dot
 * @param unauthorizedTarget internal rewrite target for protected paths without a session
 * @param authorizedTarget internal rewrite target for auth-only paths with a session
 */
@ConfigurationProperties(prefix = "shopdesk.routes")
public record RouteProperties(
    List<String> protectedPrefixes,
    List<String> authOnlyPaths,
    List<String> staticAssetPrefixes,
    List<String> staticAssetExtensions,
    String unauthorizedTarget,
    String authorizedTarget) {

  public RouteProperties {
    protectedPrefixes = protectedPrefixes != null ? List.copyOf(protectedPrefixes) : List.of();
    authOnlyPaths = authOnlyPaths != null ? List.copyOf(authOnlyPaths) : List.of();
    staticAssetPrefixes =
        staticAssetPrefixes != null ? List.copyOf(staticAssetPrefixes) : List.of();
    staticAssetExtensions =
        staticAssetExtensions != null ? List.copyOf(staticAssetExtensions) : List.of();
    unauthorizedTarget = unauthorizedTarget != null ? unauthorizedTarget : "/unauthorized";
    authorizedTarget = authorizedTarget != null ? authorizedTarget : "/authorized";
  }
}
