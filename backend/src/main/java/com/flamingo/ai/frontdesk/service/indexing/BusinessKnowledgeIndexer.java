package com.flamingo.ai.frontdesk.service.indexing;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.domain.entity.Business;
import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import com.flamingo.ai.frontdesk.domain.enums.KnowledgeField;
import com.flamingo.ai.frontdesk.domain.repository.BusinessRepository;
import com.flamingo.ai.frontdesk.domain.repository.ServiceOfferingRepository;
import com.flamingo.ai.frontdesk.exception.BusinessNotFoundException;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStats;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

/**
 * Keeps the synthetic question/answer knowledge of businesses in step with their structured
 * fields: full indexing, forced reindexing, per-field incremental updates and bulk runs over every
 * active business.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BusinessKnowledgeIndexer {

  private final BusinessRepository businessRepository;
  private final ServiceOfferingRepository serviceRepository;
  private final KnowledgeStore knowledgeStore;
  private final KnowledgeSynthesizer knowledgeSynthesizer;
  private final DocumentIndexingService documentIndexingService;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  /** Indexes every active business that has no synthetic knowledge yet. */
  public BulkIndexingResult indexAllBusinesses() {
    return indexAllBusinesses(ragConfig.getIndexing().getBatchSize(), false);
  }

  /**
   * Indexes every active business, page by page. Businesses of a batch are processed one after
   * the other and a failing business never stops the run.
   *
   * @param batchSize businesses fetched per page
   * @param forceReindex rebuild knowledge that already exists
   * @return per-business report
   */
  @Timed(value = "indexing.allBusinesses", description = "Time to index all businesses")
  public BulkIndexingResult indexAllBusinesses(int batchSize, boolean forceReindex) {
    int size = Math.max(1, batchSize);
    List<BusinessIndexingOutcome> details = new ArrayList<>();
    int successful = 0;
    int failed = 0;

    Pageable page = PageRequest.of(0, size, Sort.by("createdAt", "id"));
    Page<Business> batch;
    do {
      batch = businessRepository.findByActiveTrue(page);
      log.info(
          "Indexing batch {} ({} businesses, force={})",
          batch.getNumber() + 1,
          batch.getNumberOfElements(),
          forceReindex);

      for (Business business : batch.getContent()) {
        BusinessIndexingOutcome outcome = indexOne(business, forceReindex);
        details.add(outcome);
        if (outcome.success()) {
          successful++;
        } else {
          failed++;
        }
      }
      page = batch.nextPageable();
    } while (batch.hasNext());

    log.info(
        "Bulk indexing finished: {} businesses, {} successful, {} failed",
        details.size(),
        successful,
        failed);
    return BulkIndexingResult.builder()
        .totalBusinesses(details.size())
        .successful(successful)
        .failed(failed)
        .details(details)
        .build();
  }

  private BusinessIndexingOutcome indexOne(Business business, boolean forceReindex) {
    try {
      IndexingResult result = indexBusiness(business.getId(), forceReindex);
      return new BusinessIndexingOutcome(
          business.getId(),
          business.getName(),
          result.isSuccess(),
          result.getIndexedCount(),
          result.getMessage());
    } catch (Exception e) {
      log.error("Failed to index business {}: {}", business.getId(), e.getMessage());
      meterRegistry.counter("indexing.business.failure").increment();
      return new BusinessIndexingOutcome(
          business.getId(), business.getName(), false, 0, e.getMessage());
    }
  }

  /**
   * Generates and indexes all synthetic knowledge of a business.
   *
   * @param businessId the business
   * @param forceReindex delete and rebuild existing knowledge; without it a business that already
   *     has synthetic knowledge is left untouched
   * @throws BusinessNotFoundException if the business does not exist
   */
  @Timed(value = "indexing.business", description = "Time to index a business")
  public IndexingResult indexBusiness(UUID businessId, boolean forceReindex) {
    Business business = getBusiness(businessId);
    if (!forceReindex && knowledgeStore.hasSyntheticKnowledge(businessId)) {
      log.info("Business {} already has indexed knowledge, skipping", businessId);
      return IndexingResult.builder().success(true).message("Knowledge already indexed").build();
    }

    int deleted = 0;
    if (forceReindex) {
      deleted = knowledgeStore.deleteDocuments(knowledgeStore.findSyntheticDocuments(businessId));
    }
    List<SyntheticDocument> documents =
        knowledgeSynthesizer.synthesize(business, activeServices(businessId));
    IndexingResult result = indexSynthetic(business, documents);
    result.setDeletedCount(deleted);
    return result;
  }

  /** Deletes and rebuilds all synthetic knowledge of a business. */
  public IndexingResult reindexBusiness(UUID businessId) {
    return indexBusiness(businessId, true);
  }

  /**
   * Rebuilds only the knowledge generated from the given fields. Documents sourced from other
   * fields and uploaded documents are not touched. Without fields the whole business is
   * reindexed.
   *
   * @param businessId the business
   * @param fieldKeys changed field keys such as {@code service_catalog}; unknown keys are ignored
   * @throws BusinessNotFoundException if the business does not exist
   */
  @Timed(value = "indexing.incremental", description = "Time to update business knowledge")
  public IndexingResult updateBusinessKnowledgeIncremental(
      UUID businessId, Collection<String> fieldKeys) {
    if (fieldKeys == null || fieldKeys.isEmpty()) {
      log.info("No fields given for incremental update of business {}, reindexing", businessId);
      return reindexBusiness(businessId);
    }

    Set<KnowledgeField> fields = EnumSet.noneOf(KnowledgeField.class);
    for (String key : fieldKeys) {
      Optional<KnowledgeField> field = KnowledgeField.fromKey(key);
      if (field.isPresent()) {
        fields.add(field.get());
      } else {
        log.warn("Ignoring unknown knowledge field '{}' for business {}", key, businessId);
      }
    }
    if (fields.isEmpty()) {
      return IndexingResult.failure(null, "No known fields to update: " + fieldKeys);
    }

    Business business = getBusiness(businessId);
    Set<String> keys = fields.stream().map(KnowledgeField::getKey).collect(Collectors.toSet());
    int deleted =
        knowledgeStore.deleteDocuments(knowledgeStore.findSyntheticDocuments(businessId, keys));
    log.info(
        "Incremental update of business {} for {}: deleted {} chunks", businessId, keys, deleted);

    List<ServiceOffering> services = activeServices(businessId);
    List<SyntheticDocument> documents = new ArrayList<>();
    for (KnowledgeField field : fields) {
      documents.addAll(knowledgeSynthesizer.synthesize(business, services, field));
    }
    if (documents.isEmpty()) {
      return IndexingResult.builder()
          .success(true)
          .message("No new documents to index from updated fields")
          .deletedCount(deleted)
          .build();
    }

    IndexingResult result = indexSynthetic(business, documents);
    result.setDeletedCount(deleted);
    return result;
  }

  /**
   * Deletes all synthetic knowledge of a business. Uploaded documents are kept.
   *
   * @return the result with the number of chunks deleted
   */
  public IndexingResult deleteBusinessKnowledge(UUID businessId) {
    List<Document> documents = knowledgeStore.findSyntheticDocuments(businessId);
    int deleted = knowledgeStore.deleteDocuments(documents);
    log.info("Deleted {} knowledge chunks for business {}", deleted, businessId);
    return IndexingResult.builder()
        .success(true)
        .message("Deleted " + deleted + " knowledge chunks")
        .deletedCount(deleted)
        .documentIds(documents.stream().map(Document::getId).collect(Collectors.toList()))
        .build();
  }

  /**
   * Reindexes a business whose structured fields changed after its knowledge was last indexed.
   *
   * @return true if the knowledge was stale and has been rebuilt
   */
  public boolean refreshIfStale(UUID businessId) {
    try {
      LocalDateTime indexedAt = knowledgeStore.latestSyntheticIndexedAt(businessId);
      if (indexedAt == null) {
        log.info("No knowledge exists for business {}", businessId);
        return false;
      }
      Business business = getBusiness(businessId);
      if (business.getUpdatedAt() == null || !business.getUpdatedAt().isAfter(indexedAt)) {
        return false;
      }

      log.info(
          "Business {} knowledge is stale (business: {}, knowledge: {})",
          businessId,
          business.getUpdatedAt(),
          indexedAt);
      IndexingResult result = reindexBusiness(businessId);
      if (!result.isSuccess()) {
        log.error("Failed to refresh business {}: {}", businessId, result.getMessage());
      }
      return result.isSuccess();
    } catch (Exception e) {
      log.error(
          "Error checking knowledge staleness of business {}: {}", businessId, e.getMessage());
      return false;
    }
  }

  public KnowledgeStats getKnowledgeStats(UUID businessId) {
    return knowledgeStore.getStats(businessId);
  }

  private IndexingResult indexSynthetic(Business business, List<SyntheticDocument> documents) {
    if (documents.isEmpty()) {
      log.info("Business {} has no knowledge to index", business.getId());
      return IndexingResult.builder().success(true).message("No knowledge to index").build();
    }

    int indexedCount = 0;
    int failures = 0;
    List<UUID> documentIds = new ArrayList<>();
    for (SyntheticDocument synthetic : documents) {
      Document document =
          Document.builder()
              .businessId(business.getId())
              .title(synthetic.title())
              .type(synthetic.field().getDocumentType())
              .originalContent(knowledgeSynthesizer.render(synthetic.entries()))
              .relatedServiceId(synthetic.relatedServiceId())
              .sourceField(synthetic.field().getKey())
              .indexingStatus(IndexingStatus.PENDING)
              .build();
      IndexingResult result = documentIndexingService.createAndIndex(document, null);
      if (result.getDocumentId() != null) {
        documentIds.add(result.getDocumentId());
      }
      if (result.isSuccess()) {
        indexedCount += result.getIndexedCount();
      } else {
        failures++;
      }
    }

    String message =
        failures == 0
            ? "Indexed " + indexedCount + " chunks from " + documents.size() + " documents"
            : "Indexed "
                + indexedCount
                + " chunks, "
                + failures
                + " of "
                + documents.size()
                + " documents failed";
    log.info("Business {}: {}", business.getId(), message);
    return IndexingResult.builder()
        .success(failures == 0)
        .message(message)
        .indexedCount(indexedCount)
        .documentIds(documentIds)
        .build();
  }

  private List<ServiceOffering> activeServices(UUID businessId) {
    return serviceRepository.findByBusinessIdAndActiveTrueOrderByDisplayOrderAsc(businessId);
  }

  private Business getBusiness(UUID businessId) {
    return businessRepository
        .findById(businessId)
        .orElseThrow(() -> new BusinessNotFoundException(businessId));
  }
}
