package io.b2mash.shopdesk.session;

import static io.b2mash.shopdesk.TestSessions.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nimbusds.jwt.JWTClaimsSet;
import io.b2mash.shopdesk.TestSessions;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class SessionTokenCodecTest {

  private final SessionTokenCodec codec =
      new SessionTokenCodec(TestSessions.sessionProperties(), TestSessions.clockAt(NOW));

  @Test
  void issuedSession_decodesWithSubjectChannelsAndClaims() {
    String token =
        codec.issueSession(
            "user-1",
            Set.of(Channel.EMAIL),
            Map.of(SessionClaims.FULL_NAME, "Asha Rao", SessionClaims.EMAIL_VERIFIED, true));

    Session session = codec.decodeSession(token);

    assertThat(session.subject()).isEqualTo("user-1");
    assertThat(session.isVerified(Channel.EMAIL)).isTrue();
    assertThat(session.isVerified(Channel.PHONE)).isFalse();
    assertThat(session.stringClaim(SessionClaims.FULL_NAME)).isEqualTo("Asha Rao");
    assertThat(session.claims()).containsEntry(SessionClaims.EMAIL_VERIFIED, true);
    assertThat(session.expiresAt()).isEqualTo(NOW.plus(Duration.ofDays(7)));
  }

  @Test
  void tokenSignedWithOtherSecret_isRejected() {
    var otherProperties =
        new SessionProperties(
            "another-secret-that-is-also-32-bytes-long", null, null, null, false);
    var other = new SessionTokenCodec(otherProperties, TestSessions.clockAt(NOW));
    String forged = other.issueSession("user-1", Set.of(Channel.EMAIL), Map.of());

    assertThatThrownBy(() -> codec.decodeSession(forged))
        .isInstanceOf(SessionTokenException.class)
        .hasMessageContaining("signature");
  }

  @Test
  void expiredToken_isRejected() {
    String token = codec.issueSession("user-1", Set.of(), Map.of());
    var later =
        new SessionTokenCodec(
            TestSessions.sessionProperties(), TestSessions.clockAt(NOW.plus(Duration.ofDays(8))));

    assertThatThrownBy(() -> later.decodeSession(token))
        .isInstanceOf(SessionTokenException.class)
        .hasMessageContaining("expired");
  }

  @Test
  void tokenOfAnotherType_isNotAcceptedAsSession() {
    String challenge =
        codec.sign("challenge", "user-1", new JWTClaimsSet.Builder(), Duration.ofMinutes(5));

    assertThatThrownBy(() -> codec.decodeSession(challenge))
        .isInstanceOf(SessionTokenException.class)
        .hasMessageContaining("type");
  }

  @Test
  void garbageOrMissingToken_isRejected() {
    assertThatThrownBy(() -> codec.decodeSession("not-a-jwt"))
        .isInstanceOf(SessionTokenException.class);
    assertThatThrownBy(() -> codec.decodeSession(" ")).isInstanceOf(SessionTokenException.class);
  }

  @Test
  void shouldRotate_onlyWithinRotationWindow() {
    var fresh = new Session("u", Set.of(), Map.of(), NOW.plus(Duration.ofDays(6)));
    var ageing = new Session("u", Set.of(), Map.of(), NOW.plus(Duration.ofHours(12)));

    assertThat(codec.shouldRotate(fresh)).isFalse();
    assertThat(codec.shouldRotate(ageing)).isTrue();
  }

  @Test
  void shortSecret_isRefusedAtStartup() {
    assertThatThrownBy(() -> new SessionProperties("too-short", null, null, null, false))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
