package io.b2mash.shopdesk.identity;

/** Profile returned by a federated provider's userinfo endpoint. */
public record FederatedProfile(
    String email,
    boolean emailVerified,
    String fullName,
    String avatarUrl,
    String redirectTarget) {}
