package com.flamingo.ai.frontdesk.domain.repository;

import com.flamingo.ai.frontdesk.domain.entity.Business;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Business entities. */
@Repository
public interface BusinessRepository extends JpaRepository<Business, UUID> {

  /** Pages through active businesses for bulk indexing. */
  Page<Business> findByActiveTrue(Pageable pageable);
}
