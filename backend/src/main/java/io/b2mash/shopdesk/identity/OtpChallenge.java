package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A one-time code issued to an account over one channel. Only the SHA-256 hash of the code is
 * stored. A challenge is open until it is consumed, invalidated (by a newer challenge or by too
 * many wrong guesses) or expires.
 */
@Entity
@Table(name = "otp_challenges")
public class OtpChallenge {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "account_id", nullable = false)
  private UUID accountId;

  @Enumerated(EnumType.STRING)
  @Column(name = "channel", nullable = false, length = 10)
  private Channel channel;

  @Column(name = "target", nullable = false, length = 320)
  private String target;

  @Column(name = "code_hash", nullable = false, length = 64)
  private String codeHash;

  @Column(name = "issued_at", nullable = false, updatable = false)
  private Instant issuedAt;

  @Column(name = "expires_at", nullable = false)
  private Instant expiresAt;

  @Column(name = "attempts", nullable = false)
  private int attempts;

  @Column(name = "consumed_at")
  private Instant consumedAt;

  @Column(name = "invalidated_at")
  private Instant invalidatedAt;

  protected OtpChallenge() {}

  public OtpChallenge(
      UUID accountId,
      Channel channel,
      String target,
      String codeHash,
      Instant issuedAt,
      Instant expiresAt) {
    this.accountId = accountId;
    this.channel = channel;
    this.target = target;
    this.codeHash = codeHash;
    this.issuedAt = issuedAt;
    this.expiresAt = expiresAt;
  }

  public boolean isExpiredAt(Instant now) {
    return !expiresAt.isAfter(now);
  }

  /**
   * Counts a wrong guess. Closes the challenge once {@code maxAttempts} is reached.
   *
   * @return true when this guess closed the challenge
   */
  public boolean recordFailedAttempt(int maxAttempts, Instant now) {
    attempts++;
    if (attempts >= maxAttempts) {
      invalidatedAt = now;
      return true;
    }
    return false;
  }

  public void markConsumed(Instant now) {
    this.consumedAt = now;
  }

  public void invalidate(Instant now) {
    this.invalidatedAt = now;
  }

  public UUID getId() {
    return id;
  }

  public UUID getAccountId() {
    return accountId;
  }

  public Channel getChannel() {
    return channel;
  }

  public String getTarget() {
    return target;
  }

  public String getCodeHash() {
    return codeHash;
  }

  public Instant getIssuedAt() {
    return issuedAt;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  public int getAttempts() {
    return attempts;
  }

  public Instant getConsumedAt() {
    return consumedAt;
  }

  public Instant getInvalidatedAt() {
    return invalidatedAt;
  }
}
