package com.flamingo.ai.frontdesk.domain.repository;

import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for DocumentChunk entities. */
@Repository
public interface DocumentChunkRepository extends JpaRepository<DocumentChunk, UUID> {

  /**
   * Finds the chunks retrieval may read for a business: active chunks of active documents in the
   * given status. With a service id, only chunks of documents unrelated to any service or related
   * to that service are kept. Ordered by document age then position, which is the tie-break order
   * for equal scores.
   */
  @Query(
      "SELECT c FROM DocumentChunk c JOIN FETCH c.document d "
          + "WHERE c.businessId = :businessId "
          + "AND c.active = true AND d.active = true AND d.indexingStatus = :status "
          + "AND (:serviceId IS NULL OR d.relatedServiceId IS NULL "
          + "OR d.relatedServiceId = :serviceId) "
          + "AND (:type IS NULL OR d.type = :type) "
          + "ORDER BY d.createdAt ASC, c.chunkIndex ASC")
  List<DocumentChunk> findSearchableChunks(
      @Param("businessId") UUID businessId,
      @Param("status") IndexingStatus status,
      @Param("serviceId") UUID serviceId,
      @Param("type") DocumentType type);

  /** Finds the chunks of a document in position order. */
  @Query("SELECT c FROM DocumentChunk c WHERE c.document.id = :documentId ORDER BY c.chunkIndex")
  List<DocumentChunk> findByDocumentId(@Param("documentId") UUID documentId);

  /** Counts the active chunks of a document. */
  @Query(
      "SELECT COUNT(c) FROM DocumentChunk c"
          + " WHERE c.document.id = :documentId AND c.active = true")
  long countActiveByDocumentId(@Param("documentId") UUID documentId);

  /** Flips the active flag of every chunk of a document. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE DocumentChunk c SET c.active = :active WHERE c.document.id = :documentId")
  int updateActiveByDocumentId(
      @Param("documentId") UUID documentId, @Param("active") boolean active);

  /** Deletes every chunk of a document. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM DocumentChunk c WHERE c.document.id = :documentId")
  int deleteByDocumentId(@Param("documentId") UUID documentId);

  /** Counts searchable chunks of a business grouped by document type. */
  @Query(
      "SELECT d.type, COUNT(c) FROM DocumentChunk c JOIN c.document d "
          + "WHERE c.businessId = :businessId AND c.active = true "
          + "AND d.active = true AND d.indexingStatus = :status "
          + "GROUP BY d.type")
  List<Object[]> countSearchableByType(
      @Param("businessId") UUID businessId, @Param("status") IndexingStatus status);
}
