package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.Channel;
import java.time.Instant;

public record ChallengeResponse(
    Channel channel, ChallengeState state, ChallengeMode mode, String target, Instant issuedAt) {

  public static ChallengeResponse from(ChallengeFlow flow) {
    return new ChallengeResponse(
        flow.channel(), flow.state(), flow.mode(), flow.target(), flow.issuedAt());
  }
}
