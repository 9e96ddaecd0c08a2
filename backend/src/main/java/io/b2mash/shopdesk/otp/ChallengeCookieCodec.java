package io.b2mash.shopdesk.otp;

import com.nimbusds.jwt.JWTClaimsSet;
import io.b2mash.shopdesk.identity.OtpProperties;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import java.text.ParseException;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Carries a pending {@link ChallengeFlow} between requests as a signed credential of type {@code
 * challenge}. A credential minted for one channel never decodes as the other.
 */
@Component
public class ChallengeCookieCodec {

  private static final Logger log = LoggerFactory.getLogger(ChallengeCookieCodec.class);

  static final String TYPE_CHALLENGE = "challenge";
  private static final String COOKIE_PREFIX = "sd_challenge_";

  private final SessionTokenCodec codec;
  private final OtpProperties properties;

  public ChallengeCookieCodec(SessionTokenCodec codec, OtpProperties properties) {
    this.codec = codec;
    this.properties = properties;
  }

  public static String cookieName(Channel channel) {
    return COOKIE_PREFIX + channel.name().toLowerCase(Locale.ROOT);
  }

  /** Lifetime of a flow credential. Longer than a code so an expired code is reported as such. */
  public Duration lifetime() {
    return properties.flowTtl();
  }

  public String encode(ChallengeFlow flow) {
    flow.requireSent();
    var claims =
        new JWTClaimsSet.Builder()
            .claim("chn", flow.channel().name())
            .claim("mode", flow.mode().name())
            .claim("tgt", flow.target());
    return codec.sign(TYPE_CHALLENGE, flow.subject(), claims, properties.flowTtl());
  }

  /** Decodes a pending flow, or returns empty for a missing, invalid or foreign credential. */
  public Optional<ChallengeFlow> decode(Channel channel, String token) {
    if (token == null) {
      return Optional.empty();
    }
    try {
      JWTClaimsSet claims = codec.verify(token, TYPE_CHALLENGE);
      if (!channel.name().equals(claims.getStringClaim("chn"))) {
        log.info("security.auth_failed reason=challenge_channel_mismatch channel={}", channel);
        return Optional.empty();
      }
      return Optional.of(
          ChallengeFlow.sent(
              channel,
              ChallengeMode.valueOf(claims.getStringClaim("mode")),
              claims.getSubject(),
              claims.getStringClaim("tgt"),
              claims.getIssueTime().toInstant()));
    } catch (ParseException | RuntimeException e) {
      log.debug("Ignoring unusable {} challenge credential: {}", channel, e.getMessage());
      return Optional.empty();
    }
  }
}
