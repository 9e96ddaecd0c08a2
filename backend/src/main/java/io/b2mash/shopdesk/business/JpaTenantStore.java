package io.b2mash.shopdesk.business;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link TenantStore} over {@link BusinessRepository}. Default provisioning runs in its own
 * transaction and flushes immediately, so a uniqueness conflict surfaces to the caller's retry
 * loop instead of at some later commit.
 */
@Component
public class JpaTenantStore implements TenantStore {

  private final BusinessRepository businessRepository;
  private final TransactionTemplate requiresNew;
  private final Clock clock;

  public JpaTenantStore(
      BusinessRepository businessRepository, PlatformTransactionManager txManager, Clock clock) {
    this.businessRepository = businessRepository;
    this.requiresNew = new TransactionTemplate(txManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.clock = clock;
  }

  @Override
  public List<Business> findActiveByOwner(String ownerId) {
    return businessRepository.findByOwnerIdAndActiveTrueOrderByCreatedAtAscIdAsc(ownerId);
  }

  @Override
  public Optional<Business> findActiveById(UUID id) {
    return businessRepository.findByIdAndActiveTrue(id);
  }

  @Override
  public Business save(Business business) {
    return businessRepository.save(business);
  }

  @Override
  public Business createDefault(String ownerId, String name) {
    return requiresNew.execute(
        status ->
            businessRepository.saveAndFlush(
                Business.provisionDefault(ownerId, name, clock.instant())));
  }
}
