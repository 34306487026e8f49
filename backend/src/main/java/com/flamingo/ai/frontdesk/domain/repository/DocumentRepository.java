package com.flamingo.ai.frontdesk.domain.repository;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds the active documents of a business. */
  List<Document> findByBusinessIdAndActiveTrueOrderByCreatedAtAsc(UUID businessId);

  /** Finds documents by status. */
  List<Document> findByIndexingStatus(IndexingStatus status);

  /** Finds synthetic documents generated from the given structured fields. */
  List<Document> findByBusinessIdAndSourceFieldIn(UUID businessId, Collection<String> sourceFields);

  /** Finds every synthetic document of a business, active or not. */
  List<Document> findByBusinessIdAndSourceFieldIsNotNull(UUID businessId);

  /** Checks whether a business already has active synthetic knowledge. */
  boolean existsByBusinessIdAndSourceFieldIsNotNullAndActiveTrue(UUID businessId);

  /** Latest indexing time among the active synthetic documents of a business. */
  @Query(
      "SELECT MAX(d.indexedAt) FROM Document d "
          + "WHERE d.businessId = :businessId AND d.sourceField IS NOT NULL AND d.active = true")
  LocalDateTime findLatestSyntheticIndexedAt(@Param("businessId") UUID businessId);
}
