package com.flamingo.ai.frontdesk.service.knowledge;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import com.flamingo.ai.frontdesk.domain.repository.DocumentChunkRepository;
import com.flamingo.ai.frontdesk.domain.repository.DocumentRepository;
import com.flamingo.ai.frontdesk.exception.DocumentNotFoundException;
import com.flamingo.ai.frontdesk.exception.DocumentProcessingException;
import com.flamingo.ai.frontdesk.service.rag.model.EmbeddedChunk;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** JPA implementation of the KnowledgeStore. */
@Service
@RequiredArgsConstructor
@Slf4j
public class KnowledgeStoreImpl implements KnowledgeStore {

  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final DocumentChunkRepository chunkRepository;

  @Override
  @Transactional
  public Document createDocument(Document document) {
    Document saved = documentRepository.save(document);
    log.info(
        "Created document {} ({}) for business {}",
        saved.getId(),
        saved.getTitle(),
        saved.getBusinessId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Document> findDocument(UUID documentId) {
    return documentRepository.findById(documentId);
  }

  @Override
  @Transactional
  @Timed(value = "knowledge.createVersion", description = "Time to create a document version")
  public Document createVersion(
      UUID documentId, String newContent, String newTitle, Long fileSize) {
    Document current = getDocument(documentId);
    if (!current.isActive()) {
      throw new DocumentProcessingException(
          documentId,
          "Document " + documentId + " is not the active version",
          "Only the active version of a document can be updated");
    }

    // the bulk update clears the persistence context, so the row is loaded again below
    int deactivated = chunkRepository.updateActiveByDocumentId(documentId, false);
    current = getDocument(documentId);
    current.setActive(false);
    documentRepository.save(current);

    Document next =
        Document.builder()
            .businessId(current.getBusinessId())
            .title(newTitle != null && !newTitle.isBlank() ? newTitle : current.getTitle())
            .type(current.getType())
            .originalContent(newContent != null ? newContent : "")
            .filePath(current.getFilePath())
            .originalFilename(current.getOriginalFilename())
            .fileSize(fileSize != null ? fileSize : current.getFileSize())
            .relatedServiceId(current.getRelatedServiceId())
            .sourceField(current.getSourceField())
            .previousVersionId(current.getId())
            .indexingStatus(IndexingStatus.PENDING)
            .build();
    Document saved = documentRepository.save(next);

    log.info(
        "Created version {} of document {} (deactivated {} chunks)",
        saved.getId(),
        documentId,
        deactivated);
    return saved;
  }

  @Override
  @Transactional
  @Timed(value = "knowledge.revert", description = "Time to revert a document version")
  public Document revert(UUID documentId) {
    Document current = getDocument(documentId);
    UUID previousId = current.getPreviousVersionId();
    if (previousId == null) {
      throw new DocumentNotFoundException(
          documentId, "No previous version exists for document " + documentId);
    }
    if (!current.isActive()) {
      throw new DocumentProcessingException(
          documentId,
          "Document " + documentId + " is not the active version",
          "Only the active version of a document can be reverted");
    }
    if (!documentRepository.existsById(previousId)) {
      throw new DocumentNotFoundException(previousId, "Previous version not found: " + previousId);
    }

    chunkRepository.updateActiveByDocumentId(documentId, false);
    int reactivated = chunkRepository.updateActiveByDocumentId(previousId, true);

    current = getDocument(documentId);
    current.setActive(false);
    documentRepository.save(current);

    Document previous = getDocument(previousId);
    previous.setActive(true);
    Document saved = documentRepository.save(previous);

    log.info(
        "Reverted document {} to previous version {} ({} chunks reactivated)",
        documentId,
        previousId,
        reactivated);
    return saved;
  }

  @Override
  @Transactional
  public void updateContent(UUID documentId, String content, Long fileSize) {
    Document document = getDocument(documentId);
    document.setOriginalContent(content);
    if (fileSize != null) {
      document.setFileSize(fileSize);
    }
    documentRepository.save(document);
  }

  @Override
  @Transactional
  @Timed(value = "knowledge.replaceChunks", description = "Time to replace a chunk set")
  public int replaceChunks(UUID documentId, List<EmbeddedChunk> chunks) {
    int deleted = chunkRepository.deleteByDocumentId(documentId);
    Document document = getDocument(documentId);

    List<DocumentChunk> entities = new ArrayList<>(chunks.size());
    for (EmbeddedChunk embedded : chunks) {
      entities.add(
          DocumentChunk.builder()
              .document(document)
              .businessId(document.getBusinessId())
              .content(embedded.chunk().content())
              .embedding(embedded.embedding())
              .chunkIndex(embedded.chunk().chunkIndex())
              .metadata(new LinkedHashMap<>(embedded.chunk().metadata()))
              .active(document.isActive())
              .build());
    }
    chunkRepository.saveAll(entities);

    document.markComplete(entities.size());
    documentRepository.save(document);

    log.debug(
        "Replaced chunk set of document {}: {} removed, {} stored",
        documentId,
        deleted,
        entities.size());
    return entities.size();
  }

  @Override
  @Transactional
  public int deleteChunks(UUID documentId) {
    int deleted = chunkRepository.deleteByDocumentId(documentId);
    log.info("Deleted {} chunks of document {}", deleted, documentId);
    return deleted;
  }

  @Override
  @Transactional
  public void resetForReindex(UUID documentId) {
    Document document = getDocument(documentId);
    document.resetForReindex();
    documentRepository.save(document);
  }

  /** Updates the indexing status with retry logic for SQLite lock contention. */
  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void updateStatus(UUID documentId, IndexingStatus status, String error) {
    for (int attempt = 1; attempt <= MAX_RETRIES; attempt++) {
      try {
        Document document = getDocument(documentId);
        switch (status) {
          case PENDING -> document.resetForReindex();
          case PROCESSING -> document.startProcessing();
          case FAILED -> document.markFailed(error);
          case COMPLETE -> document.setIndexingStatus(IndexingStatus.COMPLETE);
        }
        documentRepository.saveAndFlush(document);
        return;
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw new DocumentProcessingException(documentId, "Interrupted during retry", ie);
        }
      }
    }
  }

  @Override
  @Transactional(readOnly = true)
  public long countActiveChunks(UUID documentId) {
    return chunkRepository.countActiveByDocumentId(documentId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<DocumentChunk> findSearchableChunks(
      UUID businessId, UUID serviceId, DocumentType type) {
    return chunkRepository.findSearchableChunks(
        businessId, IndexingStatus.COMPLETE, serviceId, type);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> findSyntheticDocuments(UUID businessId, Collection<String> sourceFields) {
    if (sourceFields.isEmpty()) {
      return List.of();
    }
    return documentRepository.findByBusinessIdAndSourceFieldIn(businessId, sourceFields);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Document> findSyntheticDocuments(UUID businessId) {
    return documentRepository.findByBusinessIdAndSourceFieldIsNotNull(businessId);
  }

  @Override
  @Transactional
  public int deleteDocuments(Collection<Document> documents) {
    int deletedChunks = 0;
    List<UUID> ids = documents.stream().map(Document::getId).toList();
    for (UUID id : ids) {
      deletedChunks += chunkRepository.deleteByDocumentId(id);
    }
    documentRepository.deleteAllByIdInBatch(ids);
    log.info("Deleted {} documents with {} chunks", ids.size(), deletedChunks);
    return deletedChunks;
  }

  @Override
  @Transactional(readOnly = true)
  public boolean hasSyntheticKnowledge(UUID businessId) {
    return documentRepository.existsByBusinessIdAndSourceFieldIsNotNullAndActiveTrue(businessId);
  }

  @Override
  @Transactional(readOnly = true)
  public LocalDateTime latestSyntheticIndexedAt(UUID businessId) {
    return documentRepository.findLatestSyntheticIndexedAt(businessId);
  }

  @Override
  @Transactional(readOnly = true)
  public KnowledgeStats getStats(UUID businessId) {
    Map<DocumentType, Long> byType = new EnumMap<>(DocumentType.class);
    long total = 0;
    List<Object[]> rows =
        chunkRepository.countSearchableByType(businessId, IndexingStatus.COMPLETE);
    for (Object[] row : rows) {
      long count = ((Number) row[1]).longValue();
      byType.put((DocumentType) row[0], count);
      total += count;
    }
    int activeDocuments =
        documentRepository.findByBusinessIdAndActiveTrueOrderByCreatedAtAsc(businessId).size();
    return new KnowledgeStats(businessId, total, byType, activeDocuments);
  }
}
