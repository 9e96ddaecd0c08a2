package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import java.time.Duration;

/** Delivers one-time codes to the user over email or SMS. */
public interface OtpDelivery {

  /**
   * Sends {@code code} to {@code target}.
   *
   * @throws io.b2mash.shopdesk.exception.IdentityLookupException if the code could not be handed
   *     to the delivery channel
   */
  void deliver(Channel channel, String target, String code, Duration validFor);
}
