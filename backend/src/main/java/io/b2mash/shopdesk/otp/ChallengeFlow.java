package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.exception.NoActiveChallengeException;
import io.b2mash.shopdesk.session.Channel;
import java.time.Instant;
import java.util.Objects;

/**
 * State of one channel's challenge flow. Email and phone flows are independent values; a flow
 * only ever names its own channel. The raw code is never part of the flow.
 *
 * @param subject the account the code was sent for, null while idle
 * @param target the email address or phone number the code was sent to, null while idle
 */
public record ChallengeFlow(
    Channel channel,
    ChallengeState state,
    ChallengeMode mode,
    String subject,
    String target,
    Instant issuedAt) {

  public ChallengeFlow {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(state, "state");
  }

  public static ChallengeFlow idle(Channel channel) {
    return new ChallengeFlow(channel, ChallengeState.IDLE, null, null, null, null);
  }

  public static ChallengeFlow sent(
      Channel channel, ChallengeMode mode, String subject, String target, Instant issuedAt) {
    return new ChallengeFlow(
        channel,
        ChallengeState.CHALLENGE_SENT,
        Objects.requireNonNull(mode, "mode"),
        Objects.requireNonNull(subject, "subject"),
        Objects.requireNonNull(target, "target"),
        issuedAt);
  }

  /** Same challenge, re-sent at {@code issuedAt}. */
  public ChallengeFlow resent(Instant issuedAt) {
    requireSent();
    return new ChallengeFlow(
        channel, ChallengeState.CHALLENGE_SENT, mode, subject, target, issuedAt);
  }

  public ChallengeFlow verified() {
    requireSent();
    return new ChallengeFlow(channel, ChallengeState.VERIFIED, mode, subject, target, issuedAt);
  }

  public boolean isPending() {
    return state == ChallengeState.CHALLENGE_SENT;
  }

  /** Throws unless a code has been sent and not yet verified or cancelled. */
  public void requireSent() {
    if (!isPending()) {
      throw new NoActiveChallengeException(channel);
    }
  }
}
