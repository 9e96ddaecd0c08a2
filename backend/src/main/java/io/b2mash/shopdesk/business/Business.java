package io.b2mash.shopdesk.business;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A tenant, owned by exactly one subject. Deletion is soft: the row stays with {@code active =
 * false}. The business created automatically for a subject carries {@code default_key = owner}
 * under a unique constraint, so concurrent auto-provisioning can only ever insert one.
 */
@Entity
@Table(name = "businesses")
public class Business {

  public static final String DEFAULT_CURRENCY = "INR";
  public static final String DEFAULT_FISCAL_YEAR = "april-march";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false, updatable = false, length = 64)
  private String ownerId;

  @Column(name = "name", nullable = false, length = 120)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "email", length = 255)
  private String email;

  @Column(name = "phone", length = 50)
  private String phone;

  @Column(name = "website", length = 255)
  private String website;

  @Column(name = "gst_number", length = 20)
  private String gstNumber;

  @Column(name = "pan_number", length = 20)
  private String panNumber;

  @Column(name = "registration_number", length = 50)
  private String registrationNumber;

  @Column(name = "currency", nullable = false, length = 3)
  private String currency;

  @Column(name = "fiscal_year", nullable = false, length = 20)
  private String fiscalYear;

  @Column(name = "logo_url", length = 2048)
  private String logoUrl;

  @Column(name = "active", nullable = false)
  private boolean active;

  @Column(name = "default_key", length = 64)
  private String defaultKey;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Business() {}

  public Business(String ownerId, BusinessDetails details, Instant now) {
    this.ownerId = ownerId;
    this.currency = DEFAULT_CURRENCY;
    this.fiscalYear = DEFAULT_FISCAL_YEAR;
    this.active = true;
    this.createdAt = now;
    applyPatch(details, now);
  }

  /** The business created for a subject that has none. */
  public static Business provisionDefault(String ownerId, String name, Instant now) {
    var business = new Business(ownerId, BusinessDetails.named(name), now);
    business.defaultKey = ownerId;
    return business;
  }

  /** Copies every non-null field of {@code patch} and bumps {@code updatedAt}. */
  public void applyPatch(BusinessDetails patch, Instant now) {
    if (patch.name() != null) {
      this.name = patch.name().trim();
    }
    if (patch.description() != null) {
      this.description = patch.description();
    }
    if (patch.email() != null) {
      this.email = patch.email();
    }
    if (patch.phone() != null) {
      this.phone = patch.phone();
    }
    if (patch.website() != null) {
      this.website = patch.website();
    }
    if (patch.gstNumber() != null) {
      this.gstNumber = patch.gstNumber();
    }
    if (patch.panNumber() != null) {
      this.panNumber = patch.panNumber();
    }
    if (patch.registrationNumber() != null) {
      this.registrationNumber = patch.registrationNumber();
    }
    if (patch.currency() != null) {
      this.currency = patch.currency();
    }
    if (patch.fiscalYear() != null) {
      this.fiscalYear = patch.fiscalYear();
    }
    if (patch.logoUrl() != null) {
      this.logoUrl = patch.logoUrl();
    }
    this.updatedAt = now;
  }

  /** Soft-deletes the business. Releases the default slot so the owner can be provisioned again. */
  public void deactivate(Instant now) {
    this.active = false;
    this.defaultKey = null;
    this.updatedAt = now;
  }

  public boolean isOwnedBy(String subject) {
    return ownerId.equals(subject);
  }

  public UUID getId() {
    return id;
  }

  public String getOwnerId() {
    return ownerId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public String getEmail() {
    return email;
  }

  public String getPhone() {
    return phone;
  }

  public String getWebsite() {
    return website;
  }

  public String getGstNumber() {
    return gstNumber;
  }

  public String getPanNumber() {
    return panNumber;
  }

  public String getRegistrationNumber() {
    return registrationNumber;
  }

  public String getCurrency() {
    return currency;
  }

  public String getFiscalYear() {
    return fiscalYear;
  }

  public String getLogoUrl() {
    return logoUrl;
  }

  public boolean isActive() {
    return active;
  }

  public String getDefaultKey() {
    return defaultKey;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
