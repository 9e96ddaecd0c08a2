package io.b2mash.shopdesk.business;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/** Persistence of businesses. Only active (not deleted) businesses are ever returned. */
public interface TenantStore {

  /** Active businesses of the owner, oldest first. */
  List<Business> findActiveByOwner(String ownerId);

  Optional<Business> findActiveById(UUID id);

  Business save(Business business);

  /**
   * Inserts the owner's default business and makes it visible to other transactions before
   * returning.
   *
   * @throws org.springframework.dao.DataIntegrityViolationException if the owner already has an
   *     active default business
   */
  Business createDefault(String ownerId, String name);
}
