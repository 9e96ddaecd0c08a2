package io.b2mash.shopdesk.otp;

import io.b2mash.shopdesk.exception.AccountNotFoundException;
import io.b2mash.shopdesk.exception.ChallengeExpiredException;
import io.b2mash.shopdesk.exception.InvalidCodeException;
import io.b2mash.shopdesk.exception.NoActiveChallengeException;
import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.identity.AccountRef;
import io.b2mash.shopdesk.identity.Identifier;
import io.b2mash.shopdesk.identity.IdentifierParser;
import io.b2mash.shopdesk.identity.IdentityStore;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionClaims;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import java.time.Clock;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * One-time code challenge flows. Each channel moves {@code IDLE -> CHALLENGE_SENT -> VERIFIED}
 * independently; a resend keeps the flow in {@code CHALLENGE_SENT} with a fresh code, a cancel or
 * an expired code returns it to {@code IDLE}. Flow state lives in the caller's {@link
 * ChallengeFlowStore}; codes themselves are issued and checked by the {@link IdentityStore}.
 */
@Service
public class OtpChallengeService {

  private static final Logger log = LoggerFactory.getLogger(OtpChallengeService.class);
  private static final Pattern CODE = Pattern.compile("^\\d{6}$");

  private final IdentityStore identityStore;
  private final IdentifierParser identifierParser;
  private final SessionTokenCodec codec;
  private final Clock clock;

  public OtpChallengeService(
      IdentityStore identityStore,
      IdentifierParser identifierParser,
      SessionTokenCodec codec,
      Clock clock) {
    this.identityStore = identityStore;
    this.identifierParser = identifierParser;
    this.codec = codec;
    this.clock = clock;
  }

  /**
   * Sends a sign-in code to the account behind {@code rawIdentifier}.
   *
   * @param mode {@link ChallengeMode#LOGIN} or {@link ChallengeMode#SIGNUP}
   * @param fullName recorded on an account created by a signup, may be null
   * @throws ValidationException if the identifier is not a valid email or phone number
   * @throws AccountNotFoundException on login when no account exists for the identifier
   * @throws io.b2mash.shopdesk.exception.IdentityLookupException if the store is unreachable
   */
  public ChallengeFlow startChallenge(
      ChallengeFlowStore flows, ChallengeMode mode, String rawIdentifier, String fullName) {
    if (mode == ChallengeMode.ATTACH) {
      throw new IllegalArgumentException("Use startAttach for ATTACH challenges");
    }
    Identifier identifier = identifierParser.parse(rawIdentifier);
    Map<String, Object> claims =
        fullName != null && !fullName.isBlank()
            ? Map.of(SessionClaims.FULL_NAME, fullName.trim())
            : Map.of();

    AccountRef account =
        identityStore
            .createOrLookupAccount(identifier, mode == ChallengeMode.SIGNUP, claims)
            .orElseThrow(
                () -> {
                  log.info(
                      "security.auth_failed reason=account_not_found identifier={}",
                      identifier.masked());
                  return new AccountNotFoundException(identifier.masked());
                });

    return send(flows, mode, account.subject(), identifier);
  }

  /**
   * Sends a code to a new email address for the signed-in subject. Verifying it attaches the
   * address to the account and marks it verified.
   */
  public ChallengeFlow startAttach(ChallengeFlowStore flows, Session session, String rawEmail) {
    Identifier identifier = identifierParser.parseEmail(rawEmail);
    if (identifier.value().equals(session.stringClaim(SessionClaims.EMAIL))
        && session.isVerified(Channel.EMAIL)) {
      throw new ValidationException("Email unchanged", "This email address is already verified");
    }
    return send(flows, ChallengeMode.ATTACH, session.subject(), identifier);
  }

  private ChallengeFlow send(
      ChallengeFlowStore flows, ChallengeMode mode, String subject, Identifier identifier) {
    identityStore.sendOtp(subject, identifier.channel(), identifier.value());
    ChallengeFlow flow =
        ChallengeFlow.sent(
            identifier.channel(), mode, subject, identifier.value(), clock.instant());
    flows.put(flow);
    log.info(
        "Challenge sent: mode={} channel={} subject={} target={}",
        mode,
        identifier.channel(),
        subject,
        identifier.masked());
    return flow;
  }

  /**
   * Verifies a code for the pending challenge on {@code channel}.
   *
   * @param current the caller's session, required for {@link ChallengeMode#ATTACH} flows
   * @return the refreshed session, with {@code channel} verified
   * @throws NoActiveChallengeException if no code is pending on the channel
   * @throws InvalidCodeException on a malformed or wrong code; the challenge stays pending
   * @throws ChallengeExpiredException if the code expired; the flow returns to idle
   */
  public VerifiedSession verifyChallenge(
      ChallengeFlowStore flows, Channel channel, String code, Session current) {
    ChallengeFlow flow = pending(flows, channel, current);
    if (code == null || !CODE.matcher(code.trim()).matches()) {
      throw new InvalidCodeException("The code must be 6 digits");
    }

    Session verified;
    try {
      verified = identityStore.verifyOtp(flow.subject(), channel, code.trim());
    } catch (ChallengeExpiredException | AccountNotFoundException e) {
      flows.clear(channel);
      throw e;
    } catch (InvalidCodeException e) {
      log.info(
          "security.auth_failed reason=invalid_code channel={} subject={}",
          channel,
          flow.subject());
      throw e;
    }

    flows.put(flow.verified());
    String credential = codec.issueSession(verified);
    log.info(
        "Challenge verified: mode={} channel={} subject={}", flow.mode(), channel, flow.subject());
    return new VerifiedSession(codec.decodeSession(credential), credential);
  }

  /** Sends a fresh code for the pending challenge, invalidating the previous one. */
  public ChallengeFlow resend(ChallengeFlowStore flows, Channel channel, Session current) {
    ChallengeFlow flow = pending(flows, channel, current);
    identityStore.sendOtp(flow.subject(), channel, flow.target());
    ChallengeFlow resent = flow.resent(clock.instant());
    flows.put(resent);
    log.info("Challenge resent: channel={} subject={}", channel, flow.subject());
    return resent;
  }

  /** Abandons the challenge on {@code channel}. A no-op when nothing is pending. */
  public ChallengeFlow cancel(ChallengeFlowStore flows, Channel channel) {
    if (flows.get(channel).isPending()) {
      flows.clear(channel);
      log.debug("Challenge cancelled: channel={}", channel);
    }
    return ChallengeFlow.idle(channel);
  }

  private ChallengeFlow pending(ChallengeFlowStore flows, Channel channel, Session current) {
    ChallengeFlow flow = flows.get(channel);
    flow.requireSent();
    if (flow.mode() == ChallengeMode.ATTACH
        && (current == null || !current.subject().equals(flow.subject()))) {
      throw new NoActiveChallengeException(channel);
    }
    return flow;
  }
}
