package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.exception.AccountNotFoundException;
import io.b2mash.shopdesk.exception.ChallengeExpiredException;
import io.b2mash.shopdesk.exception.IdentityLookupException;
import io.b2mash.shopdesk.exception.InvalidCodeException;
import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionClaims;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * JPA-backed identity store. Accounts live in {@code user_accounts}; one-time codes are stored as
 * SHA-256 hashes in {@code otp_challenges}, at most one open challenge per account and channel.
 * Every operation runs in its own transaction, and persistence failures surface as {@link
 * IdentityLookupException}.
 */
@Service
public class LocalIdentityStore implements IdentityStore {

  private static final Logger log = LoggerFactory.getLogger(LocalIdentityStore.class);
  private static final int CODE_BOUND = 1_000_000;

  private final UserAccountRepository accountRepository;
  private final OtpChallengeRepository challengeRepository;
  private final OtpDelivery otpDelivery;
  private final FederatedSignInClient federatedClient;
  private final SessionTokenCodec codec;
  private final OtpProperties otpProperties;
  private final Clock clock;
  private final TransactionTemplate txTemplate;
  private final SecureRandom secureRandom = new SecureRandom();

  public LocalIdentityStore(
      UserAccountRepository accountRepository,
      OtpChallengeRepository challengeRepository,
      OtpDelivery otpDelivery,
      FederatedSignInClient federatedClient,
      SessionTokenCodec codec,
      OtpProperties otpProperties,
      Clock clock,
      PlatformTransactionManager txManager) {
    this.accountRepository = accountRepository;
    this.challengeRepository = challengeRepository;
    this.otpDelivery = otpDelivery;
    this.federatedClient = federatedClient;
    this.codec = codec;
    this.otpProperties = otpProperties;
    this.clock = clock;
    this.txTemplate = new TransactionTemplate(txManager);
  }

  @Override
  public Optional<AccountRef> createOrLookupAccount(
      Identifier identifier, boolean createIfMissing, Map<String, Object> initialClaims) {
    Optional<UserAccount> existing = inTransaction(status -> findByIdentifier(identifier));
    if (existing.isPresent()) {
      return Optional.of(new AccountRef(existing.get().getId().toString(), false));
    }
    if (!createIfMissing) {
      return Optional.empty();
    }

    String fullName =
        initialClaims != null && initialClaims.get(SessionClaims.FULL_NAME) instanceof String name
            ? name
            : null;
    try {
      UserAccount created =
          inTransaction(
              status ->
                  accountRepository.saveAndFlush(
                      new UserAccount(identifier, fullName, clock.instant())));
      log.info("Created account {} for {}", created.getId(), identifier.masked());
      return Optional.of(new AccountRef(created.getId().toString(), true));
    } catch (DataIntegrityViolationException e) {
      // Concurrent signup with the same identifier: the other insert won
      log.debug("Account for {} created concurrently, re-reading", identifier.masked());
      UserAccount winner =
          inTransaction(status -> findByIdentifier(identifier))
              .orElseThrow(
                  () -> new IdentityLookupException("Account creation conflict unresolved", e));
      return Optional.of(new AccountRef(winner.getId().toString(), false));
    }
  }

  @Override
  public void sendOtp(String subject, Channel channel, String target) {
    UUID accountId = accountId(subject);
    inTransaction(
        status -> {
          accountRepository
              .findById(accountId)
              .orElseThrow(() -> new AccountNotFoundException(subject));
          ensureIdentifierAvailable(accountId, channel, target);

          Instant now = clock.instant();
          long recent =
              challengeRepository.countByAccountIdAndChannelAndIssuedAtAfter(
                  accountId, channel, now.minus(otpProperties.rateWindow()));
          if (recent >= otpProperties.maxChallengesPerWindow()) {
            log.info("security.auth_failed reason=otp_rate_limited subject={}", subject);
            throw new ValidationException(
                "Too many requests", "Too many verification requests, try again in a few minutes");
          }

          int invalidated = challengeRepository.invalidateOpen(accountId, channel, now);
          String code = generateCode();
          challengeRepository.save(
              new OtpChallenge(
                  accountId,
                  channel,
                  target,
                  hashCode(accountId, channel, code),
                  now,
                  now.plus(otpProperties.codeTtl())));
          otpDelivery.deliver(channel, target, code, otpProperties.codeTtl());
          log.debug(
              "Issued {} code for subject {} (invalidated {} earlier)",
              channel,
              subject,
              invalidated);
          return null;
        });
  }

  @Override
  public Session verifyOtp(String subject, Channel channel, String code) {
    UUID accountId = accountId(subject);
    Verification result;
    try {
      result = inTransaction(status -> verifyInTransaction(subject, accountId, channel, code));
    } catch (DataIntegrityViolationException e) {
      throw identifierInUse(channel);
    }

    return switch (result.outcome()) {
      case VERIFIED -> {
        log.info("Subject {} verified {}", subject, channel);
        yield result.session();
      }
      case MISMATCH -> throw new InvalidCodeException("The code you entered is incorrect");
      case EXHAUSTED -> {
        log.info("security.auth_failed reason=otp_attempts_exhausted subject={}", subject);
        throw new InvalidCodeException("Too many incorrect attempts, request a new code");
      }
      case EXPIRED ->
          throw new ChallengeExpiredException("The code has expired, request a new one");
    };
  }

  private Verification verifyInTransaction(
      String subject, UUID accountId, Channel channel, String code) {
    UserAccount account =
        accountRepository
            .findById(accountId)
            .orElseThrow(() -> new AccountNotFoundException(subject));
    var open = challengeRepository.findOpenForUpdate(accountId, channel);
    if (open.isEmpty()) {
      return Verification.of(Outcome.EXPIRED);
    }

    Instant now = clock.instant();
    OtpChallenge challenge = open.get(0);
    if (challenge.isExpiredAt(now)) {
      challenge.invalidate(now);
      return Verification.of(Outcome.EXPIRED);
    }
    if (!matches(challenge.getCodeHash(), hashCode(accountId, channel, code))) {
      boolean exhausted = challenge.recordFailedAttempt(otpProperties.maxAttempts(), now);
      return Verification.of(exhausted ? Outcome.EXHAUSTED : Outcome.MISMATCH);
    }

    challenge.markConsumed(now);
    ensureIdentifierAvailable(accountId, channel, challenge.getTarget());
    account.markVerified(channel, challenge.getTarget(), now);
    accountRepository.saveAndFlush(account);
    return new Verification(Outcome.VERIFIED, toSession(account));
  }

  @Override
  public String refreshSession(String credential) {
    Session current = codec.decodeSession(credential);
    UUID accountId = accountId(current.subject());
    UserAccount account =
        inTransaction(
            status ->
                accountRepository
                    .findById(accountId)
                    .orElseThrow(() -> new AccountNotFoundException(current.subject())));
    log.debug("Refreshed session for subject {}", current.subject());
    return codec.issueSession(toSession(account));
  }

  @Override
  public URI signInFederated(String provider, String redirectTarget) {
    return federatedClient.authorizationUri(provider, redirectTarget);
  }

  @Override
  public FederatedSignIn completeFederatedSignIn(String provider, String code, String state) {
    FederatedProfile profile = federatedClient.exchange(provider, code, state);
    if (profile.email() == null) {
      throw new ValidationException("Sign-in failed", "Provider did not share an email address");
    }
    Identifier identifier = new Identifier(Channel.EMAIL, profile.email().toLowerCase(Locale.ROOT));
    UserAccount account;
    try {
      account = inTransaction(status -> upsertFederated(identifier, profile));
    } catch (DataIntegrityViolationException e) {
      // Lost a creation race for this email; the second pass finds the winner's row
      account = inTransaction(status -> upsertFederated(identifier, profile));
    }
    log.info("Subject {} signed in via {}", account.getId(), provider);
    return new FederatedSignIn(toSession(account), profile.redirectTarget());
  }

  private UserAccount upsertFederated(Identifier identifier, FederatedProfile profile) {
    Instant now = clock.instant();
    UserAccount account =
        findByIdentifier(identifier)
            .orElseGet(() -> new UserAccount(identifier, profile.fullName(), now));
    if (account.getFullName() == null) {
      account.updateProfile(profile.fullName(), null);
    }
    if (account.getAvatarUrl() == null) {
      account.updateProfile(null, profile.avatarUrl());
    }
    if (profile.emailVerified()) {
      account.markVerified(Channel.EMAIL, identifier.value(), now);
    } else {
      account.recordSignIn(now);
    }
    return accountRepository.saveAndFlush(account);
  }

  @Override
  public boolean isActive(String subject) {
    UUID accountId;
    try {
      accountId = UUID.fromString(subject);
    } catch (IllegalArgumentException e) {
      return false;
    }
    try {
      return accountRepository.existsById(accountId);
    } catch (DataAccessException e) {
      throw new IdentityLookupException("Identity store unavailable", e);
    }
  }

  @Override
  public Session updateClaims(String subject, ClaimsUpdate update) {
    UUID accountId = accountId(subject);
    UserAccount account =
        inTransaction(
            status -> {
              UserAccount loaded =
                  accountRepository
                      .findById(accountId)
                      .orElseThrow(() -> new AccountNotFoundException(subject));
              loaded.updateProfile(update.fullName(), update.avatarUrl());
              return accountRepository.save(loaded);
            });
    log.debug("Updated profile claims for subject {}", subject);
    return toSession(account);
  }

  /** Builds the session view of an account. Expiry is set when a credential is issued. */
  static Session toSession(UserAccount account) {
    Set<Channel> channels = EnumSet.noneOf(Channel.class);
    Map<String, Object> claims = new LinkedHashMap<>();
    putIfPresent(claims, SessionClaims.FULL_NAME, account.getFullName());
    putIfPresent(claims, SessionClaims.AVATAR_URL, account.getAvatarUrl());
    putIfPresent(claims, SessionClaims.EMAIL, account.getEmail());
    putIfPresent(claims, SessionClaims.PHONE, account.getPhone());
    for (Channel channel : Channel.values()) {
      boolean verified = account.isVerified(channel);
      claims.put(channel.verifiedClaim(), verified);
      if (verified) {
        channels.add(channel);
      }
    }
    return new Session(account.getId().toString(), channels, claims, null);
  }

  private static void putIfPresent(Map<String, Object> claims, String name, String value) {
    if (value != null) {
      claims.put(name, value);
    }
  }

  private Optional<UserAccount> findByIdentifier(Identifier identifier) {
    return identifier.channel() == Channel.EMAIL
        ? accountRepository.findByEmail(identifier.value())
        : accountRepository.findByPhone(identifier.value());
  }

  private void ensureIdentifierAvailable(UUID accountId, Channel channel, String target) {
    findByIdentifier(new Identifier(channel, target))
        .filter(other -> !other.getId().equals(accountId))
        .ifPresent(
            other -> {
              throw identifierInUse(channel);
            });
  }

  private static ValidationException identifierInUse(Channel channel) {
    String what = channel == Channel.EMAIL ? "email address" : "phone number";
    return new ValidationException(
        "Identifier in use", "This " + what + " is already linked to another account");
  }

  private <T> T inTransaction(TransactionCallback<T> action) {
    try {
      return txTemplate.execute(action);
    } catch (DataIntegrityViolationException e) {
      throw e;
    } catch (DataAccessException | TransactionException e) {
      log.warn("Identity store operation failed: {}", e.getMessage());
      throw new IdentityLookupException("Identity store unavailable", e);
    }
  }

  private static UUID accountId(String subject) {
    try {
      return UUID.fromString(subject);
    } catch (IllegalArgumentException | NullPointerException e) {
      throw new AccountNotFoundException(subject);
    }
  }

  private String generateCode() {
    return String.format("%06d", secureRandom.nextInt(CODE_BOUND));
  }

  /** Hashes a code bound to its account and channel, returning the hex-encoded SHA-256. */
  static String hashCode(UUID accountId, Channel channel, String code) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hashBytes =
          digest.digest(
              (accountId + ":" + channel.name() + ":" + code).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hashBytes);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static boolean matches(String expectedHash, String actualHash) {
    return MessageDigest.isEqual(
        expectedHash.getBytes(StandardCharsets.US_ASCII),
        actualHash.getBytes(StandardCharsets.US_ASCII));
  }

  private enum Outcome {
    VERIFIED,
    MISMATCH,
    EXHAUSTED,
    EXPIRED
  }

  private record Verification(Outcome outcome, Session session) {
    static Verification of(Outcome outcome) {
      return new Verification(outcome, null);
    }
  }
}
