package io.b2mash.shopdesk.session;

/** Claim names carried inside a session credential. */
public final class SessionClaims {

  public static final String FULL_NAME = "full_name";
  public static final String AVATAR_URL = "avatar_url";
  public static final String EMAIL = "email";
  public static final String PHONE = "phone";
  public static final String EMAIL_VERIFIED = "email_verified";
  public static final String PHONE_VERIFIED = "phone_verified";

  private SessionClaims() {}
}
