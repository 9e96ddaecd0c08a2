package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.exception.IdentityLookupException;
import io.b2mash.shopdesk.session.Channel;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Sends email codes through {@link JavaMailSender}. Only active when {@code spring.mail.host} is
 * configured. There is no SMS gateway yet, so phone codes are only logged.
 */
@Component
@Primary
@ConditionalOnProperty(name = "spring.mail.host")
public class SmtpOtpDelivery implements OtpDelivery {

  private static final Logger log = LoggerFactory.getLogger(SmtpOtpDelivery.class);

  private final JavaMailSender mailSender;
  private final String senderAddress;

  public SmtpOtpDelivery(
      JavaMailSender mailSender,
      @Value("${shopdesk.otp.sender-address:no-reply@shopdesk.local}") String senderAddress) {
    this.mailSender = mailSender;
    this.senderAddress = senderAddress;
  }

  @Override
  public void deliver(Channel channel, String target, String code, Duration validFor) {
    if (channel == Channel.PHONE) {
      log.warn("No SMS gateway configured, code for {} was not delivered", target);
      return;
    }
    var message = new SimpleMailMessage();
    message.setFrom(senderAddress);
    message.setTo(target);
    message.setSubject("Your ShopDesk verification code");
    message.setText(
        "Your verification code is "
            + code
            + ". It expires in "
            + validFor.toMinutes()
            + " minutes.\n\nIf you did not request this code you can ignore this email.");
    try {
      mailSender.send(message);
      log.debug("Verification code email sent to {}", target);
    } catch (MailException e) {
      log.error("Failed to send verification code email to {}: {}", target, e.getMessage());
      throw new IdentityLookupException("Could not deliver the verification code", e);
    }
  }
}
