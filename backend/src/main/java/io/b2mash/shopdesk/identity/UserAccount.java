package io.b2mash.shopdesk.identity;

import io.b2mash.shopdesk.session.Channel;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * Identity-store account. An account is reachable by email, by phone, or both; each identifier is
 * unique across accounts and carries its own verification timestamp.
 */
@Entity
@Table(name = "user_accounts")
public class UserAccount {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "email", length = 320)
  private String email;

  @Column(name = "phone", length = 16)
  private String phone;

  @Column(name = "full_name", length = 255)
  private String fullName;

  @Column(name = "avatar_url", length = 2048)
  private String avatarUrl;

  @Column(name = "email_verified_at")
  private Instant emailVerifiedAt;

  @Column(name = "phone_verified_at")
  private Instant phoneVerifiedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "last_sign_in_at")
  private Instant lastSignInAt;

  protected UserAccount() {}

  public UserAccount(Identifier identifier, String fullName, Instant createdAt) {
    setIdentifier(identifier.channel(), identifier.value());
    this.fullName = fullName;
    this.createdAt = createdAt;
  }

  /** Returns the identifier stored for the channel, or null. */
  public String identifierFor(Channel channel) {
    return channel == Channel.EMAIL ? email : phone;
  }

  /**
   * Records proof of control over {@code value} on {@code channel}. A changed identifier replaces
   * the old one.
   */
  public void markVerified(Channel channel, String value, Instant at) {
    setIdentifier(channel, value);
    if (channel == Channel.EMAIL) {
      this.emailVerifiedAt = at;
    } else {
      this.phoneVerifiedAt = at;
    }
    this.lastSignInAt = at;
  }

  public boolean isVerified(Channel channel) {
    return channel == Channel.EMAIL ? emailVerifiedAt != null : phoneVerifiedAt != null;
  }

  public void updateProfile(String fullName, String avatarUrl) {
    if (fullName != null) {
      this.fullName = fullName;
    }
    if (avatarUrl != null) {
      this.avatarUrl = avatarUrl;
    }
  }

  public void recordSignIn(Instant at) {
    this.lastSignInAt = at;
  }

  private void setIdentifier(Channel channel, String value) {
    if (channel == Channel.EMAIL) {
      if (value != null && !value.equals(email)) {
        this.emailVerifiedAt = null;
      }
      this.email = value;
    } else {
      if (value != null && !value.equals(phone)) {
        this.phoneVerifiedAt = null;
      }
      this.phone = value;
    }
  }

  public UUID getId() {
    return id;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public String getFullName() {
    return fullName;
  }

  public String getAvatarUrl() {
    return avatarUrl;
  }

  public Instant getEmailVerifiedAt() {
    return emailVerifiedAt;
  }

  public Instant getPhoneVerifiedAt() {
    return phoneVerifiedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getLastSignInAt() {
    return lastSignInAt;
  }
}
