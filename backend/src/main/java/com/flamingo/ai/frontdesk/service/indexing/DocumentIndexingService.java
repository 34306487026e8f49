package com.flamingo.ai.frontdesk.service.indexing;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import com.flamingo.ai.frontdesk.exception.DocumentNotFoundException;
import com.flamingo.ai.frontdesk.exception.DocumentProcessingException;
import com.flamingo.ai.frontdesk.exception.ExtractionException;
import com.flamingo.ai.frontdesk.service.ingestion.DocumentIngestionRequest;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import com.flamingo.ai.frontdesk.service.rag.chunking.TextChunker;
import com.flamingo.ai.frontdesk.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.frontdesk.service.rag.model.EmbeddedChunk;
import com.flamingo.ai.frontdesk.service.rag.model.ExtractedText;
import com.flamingo.ai.frontdesk.service.rag.model.PageText;
import com.flamingo.ai.frontdesk.service.rag.model.TextChunk;
import com.flamingo.ai.frontdesk.service.rag.parsing.TextExtractor;
import com.flamingo.ai.frontdesk.service.rag.parsing.TextExtractorRouter;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Semaphore;
import java.util.concurrent.locks.Lock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Drives documents through the indexing state machine: extract, chunk, embed, store.
 *
 * <p>Status moves {@code PENDING -> PROCESSING -> COMPLETE | FAILED}; any exception on the way
 * ends in {@code FAILED} with the message recorded on the document, so no document is left in
 * {@code PROCESSING}. A chunk whose embedding fails is logged and skipped.
 *
 * <p>Passes over the same document are serialized by a striped per-document lock. Embedding calls
 * issued by all passes share one bounded permit pool.
 */
@Service
@Slf4j
public class DocumentIndexingService {

  static final String NO_TEXT_MESSAGE = "No text content found";
  static final String NO_EMBEDDINGS_MESSAGE = "No chunks could be embedded";

  private final KnowledgeStore knowledgeStore;
  private final TextExtractorRouter extractorRouter;
  private final TextChunker textChunker;
  private final EmbeddingService embeddingService;
  private final KnowledgeSynthesizer knowledgeSynthesizer;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  private final Striped<Lock> documentLocks;
  private final Semaphore embeddingPermits;

  public DocumentIndexingService(
      KnowledgeStore knowledgeStore,
      TextExtractorRouter extractorRouter,
      TextChunker textChunker,
      EmbeddingService embeddingService,
      KnowledgeSynthesizer knowledgeSynthesizer,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.knowledgeStore = knowledgeStore;
    this.extractorRouter = extractorRouter;
    this.textChunker = textChunker;
    this.embeddingService = embeddingService;
    this.knowledgeSynthesizer = knowledgeSynthesizer;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
    RagConfig.Indexing indexing = ragConfig.getIndexing();
    this.documentLocks = Striped.lazyWeakLock(Math.max(1, indexing.getLockStripes()));
    this.embeddingPermits = new Semaphore(Math.max(1, indexing.getMaxConcurrentEmbeddings()), true);
  }

  /** Indexes a document from its stored content. */
  public IndexingResult indexDocument(UUID documentId) {
    return indexDocument(documentId, null);
  }

  /**
   * Indexes a document.
   *
   * @param documentId the document to index
   * @param fileBytes uploaded file to extract text from, or null to use the stored content
   * @return the result; never throws
   */
  @Timed(value = "indexing.document", description = "Time to index a document")
  public IndexingResult indexDocument(UUID documentId, byte[] fileBytes) {
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      return runIndexingPass(documentId, fileBytes);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indexes a document on the {@code documentProcessingExecutor}. Callers should only invoke it
   * once the document row is committed.
   */
  @Async("documentProcessingExecutor")
  public void indexDocumentAsync(UUID documentId, byte[] fileBytes) {
    IndexingResult result = indexDocument(documentId, fileBytes);
    log.debug("Async indexing of document {} finished: {}", documentId, result.getMessage());
  }

  /**
   * Deletes a document's chunks, resets it to pending and indexes it again.
   *
   * @param documentId the document to reindex
   * @param fileBytes replacement upload, or null to use the stored content
   * @return the result, with the number of chunks removed
   */
  @Timed(value = "indexing.reindex", description = "Time to reindex a document")
  public IndexingResult reindexDocument(UUID documentId, byte[] fileBytes) {
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      if (knowledgeStore.findDocument(documentId).isEmpty()) {
        return IndexingResult.failure(documentId, "Document not found");
      }
      log.info("Reindexing document {}", documentId);
      int deleted = knowledgeStore.deleteChunks(documentId);
      knowledgeStore.resetForReindex(documentId);

      IndexingResult result = runIndexingPass(documentId, fileBytes);
      result.setDeletedCount(deleted);
      return result;
    } catch (Exception e) {
      log.error("Failed to reindex document {}: {}", documentId, e.getMessage());
      recordFailure(documentId, e.getMessage());
      return IndexingResult.failure(documentId, "Failed to reindex document: " + e.getMessage());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Creates a pending document from a request and indexes it.
   *
   * @return the result carrying the new document id; the document exists even if indexing failed
   */
  public IndexingResult createAndIndex(DocumentIngestionRequest request) {
    return createAndIndex(request.toDocument(), request.getFileBytes());
  }

  /** Saves a new pending document and indexes it. */
  public IndexingResult createAndIndex(Document document, byte[] fileBytes) {
    Document saved;
    try {
      saved = knowledgeStore.createDocument(document);
    } catch (Exception e) {
      log.error("Failed to create document {}: {}", document.getTitle(), e.getMessage());
      return IndexingResult.failure(null, "Failed to create document: " + e.getMessage());
    }
    IndexingResult result = indexDocument(saved.getId(), fileBytes);
    result.setDocumentId(saved.getId());
    return result;
  }

  /**
   * Replaces a document with a new version and indexes the new version.
   *
   * @param documentId the active document
   * @param newContent content of the new version; ignored for extraction when file bytes are given
   * @param fileBytes new upload, or null
   * @param newTitle new title, or null to keep the current one
   * @return the result; {@code documentId} is the new version, {@code previousDocumentId} the
   *     superseded one
   */
  @Timed(value = "indexing.updateVersion", description = "Time to update a document version")
  public IndexingResult updateDocumentVersion(
      UUID documentId, String newContent, byte[] fileBytes, String newTitle) {
    Document next;
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      Long fileSize = fileBytes != null && fileBytes.length > 0 ? (long) fileBytes.length : null;
      next = knowledgeStore.createVersion(documentId, newContent, newTitle, fileSize);
    } catch (DocumentNotFoundException | DocumentProcessingException e) {
      log.warn("Cannot create new version of document {}: {}", documentId, e.getMessage());
      return IndexingResult.failure(documentId, e.getMessage());
    } finally {
      lock.unlock();
    }

    IndexingResult result = indexDocument(next.getId(), fileBytes);
    return result.toBuilder()
        .message("Created new version: " + result.getMessage())
        .documentId(next.getId())
        .previousDocumentId(documentId)
        .build();
  }

  /**
   * Switches a document back to its previous version. The previous version's chunks are
   * reactivated as they were, without re-embedding.
   *
   * @return the result; {@code documentId} is the reactivated version, {@code previousDocumentId}
   *     the deactivated one
   */
  @Timed(value = "indexing.revertVersion", description = "Time to revert a document version")
  public IndexingResult revertDocumentVersion(UUID documentId) {
    Lock lock = documentLocks.get(documentId);
    lock.lock();
    try {
      Document reverted = knowledgeStore.revert(documentId);
      int active = (int) knowledgeStore.countActiveChunks(reverted.getId());
      return IndexingResult.builder()
          .success(true)
          .message("Reverted to previous version")
          .indexedCount(active)
          .documentId(reverted.getId())
          .previousDocumentId(documentId)
          .build();
    } catch (DocumentNotFoundException | DocumentProcessingException e) {
      log.warn("Cannot revert document {}: {}", documentId, e.getMessage());
      return IndexingResult.failure(documentId, e.getMessage());
    } finally {
      lock.unlock();
    }
  }

  private IndexingResult runIndexingPass(UUID documentId, byte[] fileBytes) {
    Document document;
    try {
      document = knowledgeStore.findDocument(documentId).orElse(null);
    } catch (Exception e) {
      log.error("Failed to load document {}: {}", documentId, e.getMessage());
      return IndexingResult.failure(documentId, "Failed to load document: " + e.getMessage());
    }
    if (document == null) {
      return IndexingResult.failure(documentId, "Document not found");
    }

    try {
      knowledgeStore.updateStatus(documentId, IndexingStatus.PROCESSING, null);
      log.info("Starting indexing for document {} ({})", documentId, document.getTitle());

      List<TextChunk> chunks = chunk(document, fileBytes);
      List<EmbeddedChunk> embedded = embedChunks(documentId, chunks);
      if (embedded.isEmpty() && ragConfig.getIndexing().isFailOnEmptyEmbeddings()) {
        throw new DocumentProcessingException(documentId, NO_EMBEDDINGS_MESSAGE);
      }

      int stored = knowledgeStore.replaceChunks(documentId, embedded);
      int skipped = chunks.size() - stored;
      meterRegistry.counter("indexing.document.success").increment();
      meterRegistry.counter("indexing.chunks.indexed").increment(stored);
      log.info("Indexed document {}: {} chunks stored, {} skipped", documentId, stored, skipped);
      return IndexingResult.indexed(documentId, stored, "Indexed " + stored + " chunks");

    } catch (Exception e) {
      log.error("Failed to index document {}: {}", documentId, e.getMessage());
      meterRegistry.counter("indexing.document.failure").increment();
      recordFailure(documentId, e.getMessage());
      return IndexingResult.failure(documentId, "Failed to index document: " + e.getMessage());
    }
  }

  private List<TextChunk> chunk(Document document, byte[] fileBytes) {
    if (document.isSynthetic() && (fileBytes == null || fileBytes.length == 0)) {
      List<TextChunk> questions = knowledgeSynthesizer.toChunks(document.getOriginalContent());
      if (questions.isEmpty()) {
        throw new ExtractionException(document.getId(), NO_TEXT_MESSAGE);
      }
      return questions;
    }

    String text = document.getOriginalContent();
    List<PageText> pages = List.of();
    if (fileBytes != null && fileBytes.length > 0) {
      TextExtractor extractor =
          extractorRouter.route(document.getType(), document.getOriginalFilename());
      ExtractedText extracted = extractor.extract(fileBytes, document.getOriginalFilename());
      log.info(
          "Extracted {} chars from {} ({} pages)",
          extracted.fullText().length(),
          document.getOriginalFilename(),
          extracted.pageCount());
      if (extracted.isBlank()) {
        throw new ExtractionException(document.getId(), NO_TEXT_MESSAGE);
      }
      text = extracted.fullText();
      pages = extracted.pages();
      knowledgeStore.updateContent(document.getId(), text, (long) fileBytes.length);
    }

    if (text == null || text.isBlank()) {
      throw new ExtractionException(document.getId(), NO_TEXT_MESSAGE);
    }
    List<TextChunk> chunks = textChunker.chunk(text, pages);
    if (chunks.isEmpty()) {
      throw new ExtractionException(document.getId(), "No chunks created from text");
    }
    return chunks;
  }

  @VisibleForTesting
  List<EmbeddedChunk> embedChunks(UUID documentId, List<TextChunk> chunks) {
    List<EmbeddedChunk> embedded = new ArrayList<>(chunks.size());
    for (TextChunk chunk : chunks) {
      try {
        embeddingPermits.acquire();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new DocumentProcessingException(documentId, "Interrupted while embedding chunks", e);
      }
      try {
        embedded.add(new EmbeddedChunk(chunk, embeddingService.embed(chunk.content())));
        log.debug(
            "Embedded chunk {}/{} of document {}",
            chunk.chunkIndex() + 1,
            chunks.size(),
            documentId);
      } catch (RuntimeException e) {
        meterRegistry.counter("indexing.chunks.skipped").increment();
        log.warn(
            "Skipping chunk {} of document {}: {}", chunk.chunkIndex(), documentId, e.getMessage());
      } finally {
        embeddingPermits.release();
      }
    }
    return embedded;
  }

  private void recordFailure(UUID documentId, String message) {
    try {
      knowledgeStore.updateStatus(documentId, IndexingStatus.FAILED, message);
    } catch (Exception retryEx) {
      log.error("Failed to update document status after retries: {}", retryEx.getMessage());
    }
  }
}
