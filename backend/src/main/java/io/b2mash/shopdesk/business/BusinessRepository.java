package io.b2mash.shopdesk.business;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BusinessRepository extends JpaRepository<Business, UUID> {

  List<Business> findByOwnerIdAndActiveTrueOrderByCreatedAtAscIdAsc(String ownerId);

  Optional<Business> findByIdAndActiveTrue(UUID id);
}
