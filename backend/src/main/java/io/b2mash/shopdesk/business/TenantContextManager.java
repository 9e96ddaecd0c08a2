package io.b2mash.shopdesk.business;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.shopdesk.exception.NotOwnerException;
import io.b2mash.shopdesk.exception.ValidationException;
import io.b2mash.shopdesk.session.Session;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Maintains the current-business pointer and owner-scoped business CRUD. Every operation takes
 * the caller's session and, where the pointer is involved, the caller's {@link TenantPointer}.
 *
 * <p>Resolution is idempotent and safe under concurrency: the subject's default business is
 * guarded by a unique key in the store, and a losing insert re-reads the winner's row.
 */
@Service
public class TenantContextManager {

  private static final Logger log = LoggerFactory.getLogger(TenantContextManager.class);
  private static final int MAX_PROVISION_ATTEMPTS = 3;
  private static final int MAX_NAME_LENGTH = 120;

  enum StalePointerReason {
    MISSING,
    DELETED_OR_FOREIGN,
    MALFORMED
  }

  private final TenantStore tenantStore;
  private final TenancyProperties properties;
  private final Clock clock;
  private final Cache<UUID, String> ownerCache;

  public TenantContextManager(TenantStore tenantStore, TenancyProperties properties, Clock clock) {
    this.tenantStore = tenantStore;
    this.properties = properties;
    this.clock = clock;
    this.ownerCache =
        Caffeine.newBuilder()
            .maximumSize(properties.ownershipCacheSize())
            .expireAfterWrite(properties.ownershipCacheTtl())
            .build();
  }

  /**
   * Returns the subject's current business. A missing or stale pointer falls back to the oldest
   * owned business, or to a newly provisioned default, and the pointer is repaired.
   */
  public UUID resolveCurrentBusiness(Session session, TenantPointer pointer) {
    String owner = session.subject();
    Optional<String> raw = pointer.get();
    StalePointerReason reason = StalePointerReason.MISSING;
    if (raw.isPresent()) {
      UUID candidate = parse(raw.get());
      if (candidate == null) {
        reason = StalePointerReason.MALFORMED;
      } else if (ownsActive(owner, candidate)) {
        return candidate;
      } else {
        reason = StalePointerReason.DELETED_OR_FOREIGN;
      }
      log.info("Repairing stale business pointer: subject={} reason={}", owner, reason);
    }

    UUID resolved = firstOrProvision(owner);
    pointer.set(resolved);
    log.debug("Resolved current business {} for subject {} ({})", resolved, owner, reason);
    return resolved;
  }

  /** Points the caller at {@code businessId}, which the subject must own. */
  public Business switchCurrentBusiness(Session session, TenantPointer pointer, UUID businessId) {
    Business business = requireOwned(session, businessId);
    pointer.set(business.getId());
    log.info("Switched current business: subject={} businessId={}", session.subject(), businessId);
    return business;
  }

  /** Returns a business the subject owns. */
  public Business getBusiness(Session session, UUID businessId) {
    return requireOwned(session, businessId);
  }

  public List<Business> listBusinesses(Session session) {
    return tenantStore.findActiveByOwner(session.subject());
  }

  /**
   * Creates a business owned by the subject.
   *
   * @param switchTo also point the caller at the new business
   */
  public Business createBusiness(
      Session session, TenantPointer pointer, BusinessDetails details, boolean switchTo) {
    String name = details.name();
    if (name == null || name.isBlank()) {
      throw new ValidationException("Invalid business", "Business name is required");
    }
    validateName(name);

    Business business =
        tenantStore.save(new Business(session.subject(), details, clock.instant()));
    ownerCache.put(business.getId(), business.getOwnerId());
    if (switchTo) {
      pointer.set(business.getId());
    }
    log.info(
        "Created business {} for subject {} (switched={})",
        business.getId(),
        session.subject(),
        switchTo);
    return business;
  }

  /** Merges the non-null fields of {@code patch} into a business the subject owns. */
  public Business updateBusiness(Session session, UUID businessId, BusinessDetails patch) {
    Business business = requireOwned(session, businessId);
    if (patch.name() != null) {
      if (patch.name().isBlank()) {
        throw new ValidationException("Invalid business", "Business name must not be empty");
      }
      validateName(patch.name());
    }
    business.applyPatch(patch, clock.instant());
    Business saved = tenantStore.save(business);
    log.debug("Updated business {} for subject {}", businessId, session.subject());
    return saved;
  }

  /**
   * Soft-deletes a business the subject owns. Clears the pointer when it referenced the deleted
   * business, so the next resolution picks a valid one.
   */
  public void deleteBusiness(Session session, TenantPointer pointer, UUID businessId) {
    Business business = requireOwned(session, businessId);
    if (properties.keepLastBusiness()
        && tenantStore.findActiveByOwner(session.subject()).size() <= 1) {
      throw new ValidationException(
          "Cannot delete business", "You must have at least one business");
    }

    business.deactivate(clock.instant());
    tenantStore.save(business);
    ownerCache.invalidate(businessId);
    if (pointer.get().map(TenantContextManager::parse).filter(businessId::equals).isPresent()) {
      pointer.clear();
    }
    log.info("Deleted business {} for subject {}", businessId, session.subject());
  }

  private UUID firstOrProvision(String owner) {
    for (int attempt = 1; attempt <= MAX_PROVISION_ATTEMPTS; attempt++) {
      List<Business> owned = tenantStore.findActiveByOwner(owner);
      if (!owned.isEmpty()) {
        Business first = owned.get(0);
        ownerCache.put(first.getId(), first.getOwnerId());
        return first.getId();
      }
      try {
        Business created = tenantStore.createDefault(owner, properties.defaultBusinessName());
        ownerCache.put(created.getId(), created.getOwnerId());
        log.info("Provisioned default business {} for subject {}", created.getId(), owner);
        return created.getId();
      } catch (DataIntegrityViolationException e) {
        // Another request provisioned the default first; the next pass reads it
        log.debug("Default business for {} created concurrently (attempt {})", owner, attempt);
      }
    }
    throw new IllegalStateException("Could not resolve a business for subject " + owner);
  }

  private boolean ownsActive(String owner, UUID businessId) {
    String cached = ownerCache.getIfPresent(businessId);
    if (cached != null) {
      return cached.equals(owner);
    }
    // Caffeine's cache.get(key, loader) rejects a null load, so absent ids are not cached
    Optional<Business> business = tenantStore.findActiveById(businessId);
    business.ifPresent(b -> ownerCache.put(b.getId(), b.getOwnerId()));
    return business.filter(b -> b.isOwnedBy(owner)).isPresent();
  }

  private Business requireOwned(Session session, UUID businessId) {
    return tenantStore
        .findActiveById(businessId)
        .filter(business -> business.isOwnedBy(session.subject()))
        .orElseThrow(
            () -> {
              log.warn(
                  "security.not_owner subject={} businessId={}", session.subject(), businessId);
              return new NotOwnerException(businessId);
            });
  }

  private static void validateName(String name) {
    if (name.trim().length() > MAX_NAME_LENGTH) {
      throw new ValidationException(
          "Invalid business", "Business name must be at most 120 characters");
    }
  }

  private static UUID parse(String raw) {
    try {
      return UUID.fromString(raw);
    } catch (IllegalArgumentException e) {
      return null;
    }
  }
}
