package com.flamingo.ai.frontdesk.domain.repository;

import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for ServiceOffering entities. */
@Repository
public interface ServiceOfferingRepository extends JpaRepository<ServiceOffering, UUID> {

  /** Finds the active services of a business in display order. */
  List<ServiceOffering> findByBusinessIdAndActiveTrueOrderByDisplayOrderAsc(UUID businessId);

  /** Finds an active service of a business by exact name, ignoring case. */
  Optional<ServiceOffering> findFirstByBusinessIdAndNameIgnoreCaseAndActiveTrue(
      UUID businessId, String name);
}
