package io.b2mash.shopdesk.business;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

/** Tenant store for tests. Enforces the one-default-business-per-owner key like the database. */
class InMemoryTenantStore implements TenantStore {

  private final Clock clock;
  private final List<Business> rows = new ArrayList<>();
  private final Map<String, UUID> defaultKeys = new HashMap<>();
  private int defaultInserts;

  InMemoryTenantStore(Clock clock) {
    this.clock = clock;
  }

  @Override
  public synchronized List<Business> findActiveByOwner(String ownerId) {
    return rows.stream()
        .filter(Business::isActive)
        .filter(b -> b.isOwnedBy(ownerId))
        .sorted(Comparator.comparing(Business::getCreatedAt))
        .toList();
  }

  @Override
  public synchronized Optional<Business> findActiveById(UUID id) {
    return rows.stream().filter(Business::isActive).filter(b -> b.getId().equals(id)).findFirst();
  }

  @Override
  public synchronized Business save(Business business) {
    if (business.getId() == null) {
      ReflectionTestUtils.setField(business, "id", UUID.randomUUID());
      rows.add(business);
    }
    if (business.getDefaultKey() == null) {
      defaultKeys.remove(business.getOwnerId(), business.getId());
    }
    return business;
  }

  @Override
  public synchronized Business createDefault(String ownerId, String name) {
    if (defaultKeys.containsKey(ownerId)) {
      throw new DataIntegrityViolationException("uq_businesses_default_key");
    }
    Business business = Business.provisionDefault(ownerId, name, clock.instant());
    save(business);
    defaultKeys.put(ownerId, business.getId());
    defaultInserts++;
    return business;
  }

  synchronized int defaultInserts() {
    return defaultInserts;
  }

  synchronized int rowCount() {
    return rows.size();
  }
}
