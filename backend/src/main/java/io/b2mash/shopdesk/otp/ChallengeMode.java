package io.b2mash.shopdesk.otp;

/** Why a challenge was started. */
public enum ChallengeMode {
  /** Sign in to an existing account. */
  LOGIN,
  /** Sign in, creating the account when it does not exist yet. */
  SIGNUP,
  /** Attach and verify a new email address on the signed-in account. */
  ATTACH
}
