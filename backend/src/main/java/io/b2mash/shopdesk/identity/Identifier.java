package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;

/**
 * A normalised login identifier.
 *
 * @param channel {@link Channel#EMAIL} for email addresses, {@link Channel#PHONE} for E.164 numbers
 * @param value lower-cased email address or {@code +}-prefixed phone number
 */
public record Identifier(Channel channel, String value) {

  /** Masked form for logs: keeps the first character and the domain or the last two digits. */
  public String masked() {
    if (channel == Channel.EMAIL) {
      int at = value.indexOf('@');
      return value.charAt(0) + "***" + value.substring(at);
    }
    return "***" + value.substring(Math.max(0, value.length() - 2));
  }
}
