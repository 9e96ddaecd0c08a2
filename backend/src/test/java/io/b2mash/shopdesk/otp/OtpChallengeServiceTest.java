package io.b2mash.shopdesk.otp;

import static io.b2mash.shopdesk.TestSessions.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.shopdesk.TestSessions;
import io.b2mash.shopdesk.exception.AccountNotFoundException;
import io.b2mash.shopdesk.exception.ChallengeExpiredException;
import io.b2mash.shopdesk.exception.IdentityLookupException;
import io.b2mash.shopdesk.exception.InvalidCodeException;
import io.b2mash.shopdesk.exception.NoActiveChallengeException;
import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.identity.AccountRef;
import io.b2mash.shopdesk.identity.IdentifierParser;
import io.b2mash.shopdesk.identity.Identifier;
import io.b2mash.shopdesk.identity.IdentityStore;
import io.b2mash.shopdesk.identity.OtpProperties;
import io.b2mash.shopdesk.session.Channel;
import io.b2mash.shopdesk.session.Session;
import io.b2mash.shopdesk.session.SessionClaims;
import io.b2mash.shopdesk.session.SessionTokenCodec;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class OtpChallengeServiceTest {

  private static final String SUBJECT = "6d0b8a9e-1111-4000-8000-000000000001";

  @Mock private IdentityStore identityStore;

  private SessionTokenCodec codec;
  private OtpChallengeService service;
  private InMemoryChallengeFlowStore flows;

  @BeforeEach
  void setUp() {
    var clock = TestSessions.clockAt(NOW);
    codec = new SessionTokenCodec(TestSessions.sessionProperties(), clock);
    var parser = new IdentifierParser(new OtpProperties(null, null, 0, 0, null, null));
    service = new OtpChallengeService(identityStore, parser, codec, clock);
    flows = new InMemoryChallengeFlowStore();
  }

  private void existingAccount(Channel channel, String value) {
    when(identityStore.createOrLookupAccount(new Identifier(channel, value), false, Map.of()))
        .thenReturn(Optional.of(new AccountRef(SUBJECT, false)));
  }

  private static Session verifiedSession(Channel... channels) {
    return new Session(
        SUBJECT, Set.of(channels), Map.of(SessionClaims.EMAIL, "owner@example.com"), null);
  }

  @Test
  void login_unknownAccount_accountNotFoundAndFlowStaysIdle() {
    when(identityStore.createOrLookupAccount(any(), eq(false), anyMap()))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.startChallenge(flows, ChallengeMode.LOGIN, "nobody@example.com", null))
        .isInstanceOf(AccountNotFoundException.class);
    assertThat(flows.get(Channel.EMAIL).state()).isEqualTo(ChallengeState.IDLE);
    verify(identityStore, never()).sendOtp(anyString(), any(), anyString());
  }

  @Test
  void signup_createsAccountAndSendsCode() {
    var identifier = new Identifier(Channel.EMAIL, "owner@example.com");
    when(identityStore.createOrLookupAccount(
            identifier, true, Map.of(SessionClaims.FULL_NAME, "Asha Rao")))
        .thenReturn(Optional.of(new AccountRef(SUBJECT, true)));

    var flow =
        service.startChallenge(flows, ChallengeMode.SIGNUP, "Owner@Example.com", " Asha Rao ");

    assertThat(flow.state()).isEqualTo(ChallengeState.CHALLENGE_SENT);
    assertThat(flow.target()).isEqualTo("owner@example.com");
    assertThat(flow.issuedAt()).isEqualTo(NOW);
    assertThat(flows.get(Channel.EMAIL)).isEqualTo(flow);
    verify(identityStore).sendOtp(SUBJECT, Channel.EMAIL, "owner@example.com");
  }

  @Test
  void login_localPhoneNumber_isNormalisedBeforeSending() {
    existingAccount(Channel.PHONE, "+919876543210");

    service.startChallenge(flows, ChallengeMode.LOGIN, "98765 43210", null);

    verify(identityStore).sendOtp(SUBJECT, Channel.PHONE, "+919876543210");
    assertThat(flows.get(Channel.PHONE).isPending()).isTrue();
    assertThat(flows.get(Channel.EMAIL).isPending()).isFalse();
  }

  @Test
  void startChallenge_invalidIdentifier_validationError() {
    assertThatThrownBy(() -> service.startChallenge(flows, ChallengeMode.LOGIN, "a@b", null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void startChallenge_storeUnreachable_propagates() {
    when(identityStore.createOrLookupAccount(any(), eq(false), anyMap()))
        .thenThrow(new IdentityLookupException("Identity store unavailable", null));

    assertThatThrownBy(
            () -> service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null))
        .isInstanceOf(IdentityLookupException.class);
    assertThat(flows.get(Channel.EMAIL).isPending()).isFalse();
  }

  @Test
  void verify_withoutPendingChallenge_noActiveChallenge() {
    assertThatThrownBy(() -> service.verifyChallenge(flows, Channel.EMAIL, "123456", null))
        .isInstanceOf(NoActiveChallengeException.class);
  }

  @Test
  void verify_malformedCode_rejectedWithoutConsultingStore() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);

    assertThatThrownBy(() -> service.verifyChallenge(flows, Channel.EMAIL, "12ab", null))
        .isInstanceOf(InvalidCodeException.class)
        .hasMessageContaining("6 digits");
    verify(identityStore, never()).verifyOtp(anyString(), any(), anyString());
    assertThat(flows.get(Channel.EMAIL).isPending()).isTrue();
  }

  @Test
  void verify_wrongCode_keepsChallengePending() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);
    when(identityStore.verifyOtp(SUBJECT, Channel.EMAIL, "000000"))
        .thenThrow(new InvalidCodeException("The code you entered is incorrect"));

    assertThatThrownBy(() -> service.verifyChallenge(flows, Channel.EMAIL, "000000", null))
        .isInstanceOf(InvalidCodeException.class);
    assertThat(flows.get(Channel.EMAIL).state()).isEqualTo(ChallengeState.CHALLENGE_SENT);
  }

  @Test
  void verify_expiredCode_returnsFlowToIdle() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);
    when(identityStore.verifyOtp(SUBJECT, Channel.EMAIL, "123456"))
        .thenThrow(new ChallengeExpiredException("The code has expired, request a new one"));

    assertThatThrownBy(() -> service.verifyChallenge(flows, Channel.EMAIL, "123456", null))
        .isInstanceOf(ChallengeExpiredException.class);
    assertThat(flows.get(Channel.EMAIL).state()).isEqualTo(ChallengeState.IDLE);
  }

  @Test
  void verify_correctCode_issuesSessionWithVerifiedChannel() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);
    when(identityStore.verifyOtp(SUBJECT, Channel.EMAIL, "123456"))
        .thenReturn(verifiedSession(Channel.EMAIL));

    var result = service.verifyChallenge(flows, Channel.EMAIL, " 123456 ", null);

    assertThat(result.session().subject()).isEqualTo(SUBJECT);
    assertThat(result.session().isVerified(Channel.EMAIL)).isTrue();
    assertThat(codec.decodeSession(result.credential()).subject()).isEqualTo(SUBJECT);
    assertThat(flows.get(Channel.EMAIL).state()).isEqualTo(ChallengeState.VERIFIED);
  }

  @Test
  void emailAndPhoneFlows_areIndependent() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    existingAccount(Channel.PHONE, "+919876543210");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);
    service.startChallenge(flows, ChallengeMode.LOGIN, "+919876543210", null);
    when(identityStore.verifyOtp(SUBJECT, Channel.PHONE, "654321"))
        .thenReturn(verifiedSession(Channel.PHONE));

    service.verifyChallenge(flows, Channel.PHONE, "654321", null);

    assertThat(flows.get(Channel.PHONE).state()).isEqualTo(ChallengeState.VERIFIED);
    assertThat(flows.get(Channel.EMAIL).state()).isEqualTo(ChallengeState.CHALLENGE_SENT);
  }

  @Test
  void resend_sendsFreshCodeAndStaysPending() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);

    var flow = service.resend(flows, Channel.EMAIL, null);

    assertThat(flow.state()).isEqualTo(ChallengeState.CHALLENGE_SENT);
    verify(identityStore, times(2)).sendOtp(SUBJECT, Channel.EMAIL, "owner@example.com");
  }

  @Test
  void resend_withoutPendingChallenge_noActiveChallenge() {
    assertThatThrownBy(() -> service.resend(flows, Channel.PHONE, null))
        .isInstanceOf(NoActiveChallengeException.class);
  }

  @Test
  void cancel_returnsToIdleAndIsIdempotent() {
    existingAccount(Channel.EMAIL, "owner@example.com");
    service.startChallenge(flows, ChallengeMode.LOGIN, "owner@example.com", null);

    assertThat(service.cancel(flows, Channel.EMAIL).state()).isEqualTo(ChallengeState.IDLE);
    assertThat(service.cancel(flows, Channel.EMAIL).state()).isEqualTo(ChallengeState.IDLE);
    assertThat(flows.get(Channel.EMAIL).isPending()).isFalse();
  }

  @Test
  void attach_sendsCodeForSignedInSubject() {
    var session = verifiedSession(Channel.PHONE);

    var flow = service.startAttach(flows, session, "new@example.com");

    assertThat(flow.mode()).isEqualTo(ChallengeMode.ATTACH);
    assertThat(flow.subject()).isEqualTo(SUBJECT);
    verify(identityStore).sendOtp(SUBJECT, Channel.EMAIL, "new@example.com");
  }

  @Test
  void attach_alreadyVerifiedEmail_isRefused() {
    var session = verifiedSession(Channel.EMAIL);

    assertThatThrownBy(() -> service.startAttach(flows, session, "Owner@example.com"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void attach_verifiedByAnotherSession_noActiveChallenge() {
    service.startAttach(flows, verifiedSession(Channel.PHONE), "new@example.com");
    var intruder = new Session("someone-else", Set.of(), Map.of(), null);

    assertThatThrownBy(() -> service.verifyChallenge(flows, Channel.EMAIL, "123456", intruder))
        .isInstanceOf(NoActiveChallengeException.class);
  }
}
