package com.flamingo.ai.frontdesk.service.ingestion;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.repository.ServiceOfferingRepository;
import com.flamingo.ai.frontdesk.service.indexing.DocumentIndexingService;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.validation.Valid;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.validation.annotation.Validated;

/**
 * Entry point for new business knowledge. Stores the document as pending and hands it to the
 * indexing pipeline once the row is committed.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class KnowledgeIngestionService {

  private final KnowledgeStore knowledgeStore;
  private final ServiceOfferingRepository serviceRepository;
  private final DocumentIndexingService documentIndexingService;
  private final MeterRegistry meterRegistry;

  /**
   * Stores a new document and schedules its indexing.
   *
   * @param request the validated ingestion request
   * @return id of the pending document
   * @throws jakarta.validation.ConstraintViolationException if the request is invalid
   * @throws IllegalArgumentException if the related service does not belong to the business
   */
  @Transactional
  @Timed(value = "ingestion.ingest", description = "Time to accept a document for indexing")
  public UUID ingest(@Valid DocumentIngestionRequest request) {
    log.info(
        "Ingesting {} document '{}' for business {}",
        request.getType(),
        request.getTitle(),
        request.getBusinessId());
    validateRelatedService(request);

    Document saved = knowledgeStore.createDocument(request.toDocument());
    meterRegistry.counter("ingestion.documents", "type", request.getType().label()).increment();

    // Trigger async indexing AFTER the transaction commits so the worker can see the row
    final UUID documentId = saved.getId();
    final byte[] fileBytes = request.hasFile() ? request.getFileBytes() : null;
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, scheduling indexing of document {}", documentId);
              documentIndexingService.indexDocumentAsync(documentId, fileBytes);
            }
          });
    } else {
      log.debug("No active transaction, scheduling indexing of document {}", documentId);
      documentIndexingService.indexDocumentAsync(documentId, fileBytes);
    }

    log.info("Document '{}' accepted with ID: {}", request.getTitle(), documentId);
    return documentId;
  }

  private void validateRelatedService(DocumentIngestionRequest request) {
    if (request.getRelatedServiceId() == null) {
      return;
    }
    ServiceOffering service =
        serviceRepository
            .findById(request.getRelatedServiceId())
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Related service not found: " + request.getRelatedServiceId()));
    if (!service.getBusinessId().equals(request.getBusinessId())) {
      throw new IllegalArgumentException(
          "Service " + service.getId() + " does not belong to business " + request.getBusinessId());
    }
  }
}
