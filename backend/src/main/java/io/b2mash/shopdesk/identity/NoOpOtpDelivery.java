package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.stereotype.Component;

/**
 * Fallback used when no mail server is configured. Logs the code instead of sending it, which is
 * what local development relies on to sign in.
 */
@Component
@ConditionalOnMissingBean(SmtpOtpDelivery.class)
public class NoOpOtpDelivery implements OtpDelivery {

  private static final Logger log = LoggerFactory.getLogger(NoOpOtpDelivery.class);

  @Override
  public void deliver(Channel channel, String target, String code, Duration validFor) {
    log.info(
        "NoOp OTP delivery: would send code {} to {} via {} (valid {} min)",
        code,
        target,
        channel,
        validFor.toMinutes());
  }
}
