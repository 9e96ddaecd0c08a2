package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.Session;
import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Port to the identity store: the trusted service that owns user credentials, issues and verifies
 * one-time codes, and issues session credentials. Implementations throw {@link
 * io.b2mash.shopdesk.exception.IdentityLookupException} when the store cannot be reached.
 */
public interface IdentityStore {

  /**
   * Looks up the account for an identifier, creating it when {@code createIfMissing} is set.
   *
   * @param initialClaims claims recorded on a newly created account (e.g. full name)
   * @return the account, or empty when it does not exist and creation was not requested
   */
  Optional<AccountRef> createOrLookupAccount(
      Identifier identifier, boolean createIfMissing, Map<String, Object> initialClaims);

  /**
   * Issues a fresh one-time code to {@code target} over {@code channel}. Any earlier open
   * challenge for the same subject and channel is invalidated first.
   */
  void sendOtp(String subject, Channel channel, String target);

  /**
   * Verifies a code against the subject's open challenge on {@code channel}.
   *
   * @return the live session, with {@code channel} now verified
   * @throws io.b2mash.shopdesk.exception.InvalidCodeException on mismatch (challenge stays open)
   * @throws io.b2mash.shopdesk.exception.ChallengeExpiredException when no open challenge remains
   */
  Session verifyOtp(String subject, Channel channel, String code);

  /** Re-issues a session credential with claims re-read from the store. */
  String refreshSession(String credential);

  /** Returns the provider URL that starts a federated sign-in. */
  URI signInFederated(String provider, String redirectTarget);

  /** Completes a federated sign-in from the provider callback parameters. */
  FederatedSignIn completeFederatedSignIn(String provider, String code, String state);

  /** True when the subject still exists in the store. */
  boolean isActive(String subject);

  /** Updates mutable profile claims and returns the refreshed session. */
  Session updateClaims(String subject, ClaimsUpdate update);
}
