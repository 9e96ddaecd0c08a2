package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.session.Channel;
import java.util.EnumMap;
import java.util.Map;

/** Flow store for tests: one slot per channel, no cookies. */
class InMemoryChallengeFlowStore implements ChallengeFlowStore {

  private final Map<Channel, ChallengeFlow> flows = new EnumMap<>(Channel.class);

  @Override
  public ChallengeFlow get(Channel channel) {
    return flows.getOrDefault(channel, ChallengeFlow.idle(channel));
  }

  @Override
  public void put(ChallengeFlow flow) {
    flows.put(flow.channel(), flow);
  }

  @Override
  public void clear(Channel channel) {
    flows.remove(channel);
  }
}
