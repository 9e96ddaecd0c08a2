package io.b2mash.shopdesk.session;

/** Identity channel through which a subject proved control of an identifier. */
public enum Channel {
  EMAIL,
  PHONE;

  /** Claim name flipped to {@code true} once the channel is verified. */
  public String verifiedClaim() {
    return this == EMAIL ? SessionClaims.EMAIL_VERIFIED : SessionClaims.PHONE_VERIFIED;
  }
}
