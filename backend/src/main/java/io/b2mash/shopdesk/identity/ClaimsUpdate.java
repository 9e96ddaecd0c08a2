package io.b2mash.shopdesk.identity;

/** Profile claims a signed-in user may change. Null fields are left untouched. */
public record ClaimsUpdate(String fullName, String avatarUrl) {}
