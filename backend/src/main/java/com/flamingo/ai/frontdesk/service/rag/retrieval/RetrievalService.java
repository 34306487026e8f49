package com.flamingo.ai.frontdesk.service.rag.retrieval;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.repository.ServiceOfferingRepository;
import com.flamingo.ai.frontdesk.exception.RetrievalException;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import com.flamingo.ai.frontdesk.service.rag.embedding.EmbeddingService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Hybrid retrieval of business knowledge for a conversation turn.
 *
 * <p>Steps: detect the service the query is about, embed the query, rank the business's searchable
 * chunks by cosine similarity, fall back to keyword matching when nothing scores above the
 * threshold, and format the result with provenance.
 *
 * <p>Retrieval never throws. Failures and budget overruns are logged and produce an empty context,
 * which callers treat as "no relevant knowledge".
 */
@Service
@Slf4j
public class RetrievalService {

  private final KnowledgeStore knowledgeStore;
  private final ServiceOfferingRepository serviceRepository;
  private final EmbeddingService embeddingService;
  private final ServiceIntentDetector serviceIntentDetector;
  private final KeywordExtractor keywordExtractor;
  private final ContextFormatter contextFormatter;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;
  private final Executor retrievalExecutor;

  public RetrievalService(
      KnowledgeStore knowledgeStore,
      ServiceOfferingRepository serviceRepository,
      EmbeddingService embeddingService,
      ServiceIntentDetector serviceIntentDetector,
      KeywordExtractor keywordExtractor,
      ContextFormatter contextFormatter,
      RagConfig ragConfig,
      MeterRegistry meterRegistry,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor) {
    this.knowledgeStore = knowledgeStore;
    this.serviceRepository = serviceRepository;
    this.embeddingService = embeddingService;
    this.serviceIntentDetector = serviceIntentDetector;
    this.keywordExtractor = keywordExtractor;
    this.contextFormatter = contextFormatter;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    this.retrievalExecutor = retrievalExecutor;
  }

  /** Retrieves context for a query with the configured limit and no filters. */
  public String retrieveContext(String query, UUID businessId) {
    return retrieveContext(query, businessId, null, null, null);
  }

  /**
   * Retrieves formatted context for a query.
   *
   * @param query the customer's message
   * @param businessId the business whose knowledge is searched
   * @param serviceFilter service name to scope to; overrides service detection when it names an
   *     active service
   * @param documentTypeFilter only search documents of this type, or null
   * @param limit maximum chunks, or null for {@code rag.retrieval.limit}
   * @return the context, or an empty string when nothing relevant was found or retrieval failed
   */
  public String retrieveContext(
      String query,
      UUID businessId,
      String serviceFilter,
      DocumentType documentTypeFilter,
      Integer limit) {
    return retrieveWithDebug(query, businessId, serviceFilter, documentTypeFilter, limit).context();
  }

  /**
   * Same as {@link #retrieveContext(String, UUID, String, DocumentType, Integer)}, with
   * diagnostics.
   */
  public RetrievalResult retrieveWithDebug(
      String query,
      UUID businessId,
      String serviceFilter,
      DocumentType documentTypeFilter,
      Integer limit) {
    Instant startedAt = Instant.now();
    Duration budget = ragConfig.getRetrieval().getTimeout();
    meterRegistry.counter("rag.retrieval.requests").increment();
    Timer.Sample sample = Timer.start(meterRegistry);

    CompletableFuture<RetrievalResult> call = null;
    try {
      call =
          CompletableFuture.supplyAsync(
              () -> search(query, businessId, serviceFilter, documentTypeFilter, limit, startedAt),
              retrievalExecutor);
      return call.get(budget.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      call.cancel(true);
      meterRegistry.counter("rag.retrieval.timeout").increment();
      log.warn("Retrieval for business {} exceeded {} ms budget", businessId, budget.toMillis());
      return emptyResult(query, businessId, startedAt, "Retrieval timed out");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      meterRegistry.counter("rag.retrieval.failure").increment();
      log.error(
          "Error retrieving context for business {}: {}", businessId, cause.getMessage(), cause);
      return emptyResult(query, businessId, startedAt, cause.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel(true);
      meterRegistry.counter("rag.retrieval.failure").increment();
      log.warn("Retrieval for business {} interrupted", businessId);
      return emptyResult(query, businessId, startedAt, "Retrieval interrupted");
    } catch (RuntimeException e) {
      // the executor rejected the task
      meterRegistry.counter("rag.retrieval.failure").increment();
      log.error("Could not start retrieval for business {}: {}", businessId, e.getMessage());
      return emptyResult(query, businessId, startedAt, e.getMessage());
    } finally {
      sample.stop(meterRegistry.timer("rag.retrieval.duration"));
    }
  }

  RetrievalResult search(
      String query,
      UUID businessId,
      String serviceFilter,
      DocumentType documentTypeFilter,
      Integer limit,
      Instant startedAt) {
    double threshold = ragConfig.getRetrieval().getSimilarityThreshold();
    if (query == null || query.isBlank() || businessId == null) {
      return new RetrievalResult(
          "",
          new RetrievalDebugInfo(
              query, businessId, startedAt, null, false, List.of(), threshold, List.of(), null));
    }
    int max = limit != null && limit > 0 ? limit : ragConfig.getRetrieval().getLimit();
    if (ragConfig.getRetrieval().isLogQueries()) {
      log.info("Retrieving context for business {}: '{}'", businessId, query);
    } else {
      log.info("Retrieving context for business {}", businessId);
    }

    try {
      List<ServiceOffering> services =
          serviceRepository.findByBusinessIdAndActiveTrueOrderByDisplayOrderAsc(businessId);
      ServiceOffering service = resolveService(query, serviceFilter, services).orElse(null);
      if (service != null) {
        log.debug("Query scoped to service '{}'", service.getName());
      }

      List<Float> queryEmbedding = embeddingService.embed(query);
      List<DocumentChunk> candidates =
          knowledgeStore.findSearchableChunks(
              businessId, service != null ? service.getId() : null, documentTypeFilter);
      Map<UUID, String> serviceNames =
          services.stream()
              .collect(
                  Collectors.toMap(ServiceOffering::getId, ServiceOffering::getName, (a, b) -> a));

      List<RetrievedChunk> results =
          vectorSearch(queryEmbedding, candidates, threshold, max, serviceNames);
      boolean usedFallback = false;
      List<String> keywords = List.of();
      if (results.isEmpty()) {
        keywords = keywordExtractor.extract(query);
        log.info("No vector results, trying keyword fallback with {}", keywords);
        results = keywordSearch(keywords, candidates, max, serviceNames);
        usedFallback = !results.isEmpty();
      }

      if (results.isEmpty()) {
        meterRegistry.counter("rag.retrieval.empty").increment();
      } else {
        meterRegistry
            .counter("rag.retrieval.hits", "type", usedFallback ? "keyword" : "vector")
            .increment();
      }
      log.info(
          "Retrieved {} chunks for business {} (fallback: {}, service: {})",
          results.size(),
          businessId,
          usedFallback,
          service != null ? service.getName() : "none");

      String context = contextFormatter.format(service, results);
      return new RetrievalResult(
          context,
          new RetrievalDebugInfo(
              query,
              businessId,
              startedAt,
              service != null ? service.getName() : null,
              usedFallback,
              keywords,
              threshold,
              List.copyOf(results),
              null));
    } catch (Exception e) {
      throw new RetrievalException("Retrieval failed: " + e.getMessage(), e);
    }
  }

  private Optional<ServiceOffering> resolveService(
      String query, String serviceFilter, List<ServiceOffering> services) {
    if (serviceFilter != null && !serviceFilter.isBlank()) {
      Optional<ServiceOffering> named =
          services.stream()
              .filter(s -> s.getName() != null)
              .filter(s -> s.getName().strip().equalsIgnoreCase(serviceFilter.strip()))
              .findFirst();
      if (named.isPresent()) {
        return named;
      }
      log.warn(
          "Service filter '{}' matches no active service, detecting from query", serviceFilter);
    }
    return serviceIntentDetector.detect(query, services);
  }

  private List<RetrievedChunk> vectorSearch(
      List<Float> queryEmbedding,
      List<DocumentChunk> candidates,
      double threshold,
      int limit,
      Map<UUID, String> serviceNames) {
    List<Scored> scored = new ArrayList<>();
    int mismatched = 0;
    for (DocumentChunk chunk : candidates) {
      List<Float> embedding = chunk.getEmbedding();
      if (embedding == null || embedding.size() != queryEmbedding.size()) {
        mismatched++;
        continue;
      }
      double similarity = VectorMath.cosine(queryEmbedding, embedding);
      if (similarity > threshold) {
        scored.add(new Scored(chunk, similarity));
      }
    }
    if (mismatched > 0) {
      log.warn("Skipped {} chunks with missing or mismatched embeddings", mismatched);
    }

    // List.sort is stable, so equal scores keep retrieval order
    scored.sort(Comparator.comparingDouble(Scored::similarity).reversed());
    return scored.stream()
        .limit(limit)
        .map(s -> toRetrieved(s.chunk(), MatchScore.vector(s.similarity()), serviceNames))
        .toList();
  }

  private List<RetrievedChunk> keywordSearch(
      List<String> keywords,
      List<DocumentChunk> candidates,
      int limit,
      Map<UUID, String> serviceNames) {
    if (keywords.isEmpty()) {
      return List.of();
    }
    return candidates.stream()
        .filter(chunk -> keywordExtractor.matchesAny(chunk.getContent(), keywords))
        .limit(limit)
        .map(chunk -> toRetrieved(chunk, MatchScore.keyword(), serviceNames))
        .toList();
  }

  private static RetrievedChunk toRetrieved(
      DocumentChunk chunk, MatchScore score, Map<UUID, String> serviceNames) {
    Document document = chunk.getDocument();
    String serviceName =
        Optional.ofNullable(document.getRelatedServiceId()).map(serviceNames::get).orElse(null);
    return new RetrievedChunk(
        chunk.getContent(),
        document.getTitle(),
        document.getType(),
        serviceName,
        score,
        chunk.getMetadata() != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(chunk.getMetadata()))
            : Map.of());
  }

  private RetrievalResult emptyResult(
      String query, UUID businessId, Instant startedAt, String error) {
    return new RetrievalResult("", RetrievalDebugInfo.failed(query, businessId, startedAt, error));
  }

  private record Scored(DocumentChunk chunk, double similarity) {}
}
