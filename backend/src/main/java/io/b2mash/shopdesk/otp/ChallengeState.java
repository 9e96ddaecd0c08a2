package io.b2mash.shopdesk.otp;

public enum ChallengeState {
  IDLE,
  CHALLENGE_SENT,
  VERIFIED
}
