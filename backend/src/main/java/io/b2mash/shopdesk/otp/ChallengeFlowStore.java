package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.Channel;

/** Holds the in-progress challenge flows of one client, one slot per channel. */
public interface ChallengeFlowStore {

  /** Returns the flow for the channel, or an idle flow when none is recorded. */
  ChallengeFlow get(Channel channel);

  void put(ChallengeFlow flow);

  void clear(Channel channel);
}
