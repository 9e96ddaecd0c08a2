package io.b2mash.shopdesk.session;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Issues and verifies the HS256 credentials used by the engine. Session credentials carry the
 * subject, verified channels and claims; other short-lived credentials (OTP flow state, federated
 * sign-in state) reuse the same signing key under a different {@code type} claim so one can never
 * be replayed as the other.
 */
@Service
public class SessionTokenCodec {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenCodec.class);

  public static final String TYPE_SESSION = "session";
  private static final String TYPE_CLAIM = "type";
  private static final String CHANNELS_CLAIM = "chn";
  private static final String PROFILE_CLAIM = "clm";

  private final byte[] secret;
  private final Duration ttl;
  private final Duration rotateWithin;
  private final Clock clock;

  public SessionTokenCodec(SessionProperties properties, Clock clock) {
    this.secret = properties.secret().getBytes(StandardCharsets.UTF_8);
    this.ttl = properties.ttl();
    this.rotateWithin = properties.rotateWithin();
    this.clock = clock;
  }

  /** Issues a session credential for the given subject, valid for the configured TTL. */
  public String issueSession(
      String subject, Set<Channel> verifiedChannels, Map<String, Object> claims) {
    List<String> channels = new ArrayList<>();
    for (Channel channel : verifiedChannels) {
      channels.add(channel.name());
    }
    var builder =
        new JWTClaimsSet.Builder().claim(CHANNELS_CLAIM, channels).claim(PROFILE_CLAIM, claims);
    String token = sign(TYPE_SESSION, subject, builder, ttl);
    log.debug("Issued session credential for subject {}", subject);
    return token;
  }

  /** Re-issues a credential for an existing session snapshot. */
  public String issueSession(Session session) {
    return issueSession(session.subject(), session.verifiedChannels(), session.claims());
  }

  /**
   * Verifies a session credential and extracts the session.
   *
   * @throws SessionTokenException if the credential is malformed, tampered, expired, or not a
   *     session credential
   */
  public Session decodeSession(String token) {
    JWTClaimsSet claims = verify(token, TYPE_SESSION);
    try {
      Set<Channel> channels = EnumSet.noneOf(Channel.class);
      List<String> rawChannels = claims.getStringListClaim(CHANNELS_CLAIM);
      if (rawChannels != null) {
        for (String raw : rawChannels) {
          channels.add(Channel.valueOf(raw));
        }
      }
      Map<String, Object> profile = claims.getJSONObjectClaim(PROFILE_CLAIM);
      return new Session(
          claims.getSubject(), channels, profile, claims.getExpirationTime().toInstant());
    } catch (ParseException | IllegalArgumentException e) {
      throw new SessionTokenException("Malformed session claims", e);
    }
  }

  /** True when the session is close enough to expiry that the gate should re-issue it. */
  public boolean shouldRotate(Session session) {
    return session.expiresAt() != null
        && session.expiresAt().isBefore(clock.instant().plus(rotateWithin));
  }

  /**
   * Signs an arbitrary short-lived credential.
   *
   * @param type token type, checked again by {@link #verify}
   * @param subject JWT subject, may be null
   * @param builder additional claims
   * @param lifetime time until expiry
   */
  public String sign(String type, String subject, JWTClaimsSet.Builder builder, Duration lifetime) {
    try {
      Instant now = clock.instant();
      var claims =
          builder
              .jwtID(UUID.randomUUID().toString())
              .subject(subject)
              .claim(TYPE_CLAIM, type)
              .issueTime(Date.from(now))
              .expirationTime(Date.from(now.plus(lifetime)))
              .build();

      var signedJwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
      JWSSigner signer = new MACSigner(secret);
      signedJwt.sign(signer);
      return signedJwt.serialize();
    } catch (JOSEException e) {
      throw new IllegalStateException("Failed to sign " + type + " credential", e);
    }
  }

  /**
   * Verifies signature, expiry and type of a credential issued by {@link #sign}.
   *
   * @throws SessionTokenException on any verification failure
   */
  public JWTClaimsSet verify(String token, String expectedType) {
    if (token == null || token.isBlank()) {
      throw new SessionTokenException("Missing credential");
    }
    try {
      var signedJwt = SignedJWT.parse(token);
      JWSVerifier verifier = new MACVerifier(secret);
      if (!signedJwt.verify(verifier)) {
        throw new SessionTokenException("Invalid credential signature");
      }

      var claims = signedJwt.getJWTClaimsSet();
      if (claims.getExpirationTime() == null
          || !claims.getExpirationTime().toInstant().isAfter(clock.instant())) {
        throw new SessionTokenException("Credential has expired");
      }
      if (!expectedType.equals(claims.getStringClaim(TYPE_CLAIM))) {
        throw new SessionTokenException("Unexpected credential type");
      }
      return claims;
    } catch (ParseException | JOSEException e) {
      throw new SessionTokenException("Invalid credential: " + e.getMessage(), e);
    }
  }
}
