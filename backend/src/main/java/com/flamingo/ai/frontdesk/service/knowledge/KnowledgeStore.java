package com.flamingo.ai.frontdesk.service.knowledge;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import com.flamingo.ai.frontdesk.service.rag.model.EmbeddedChunk;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Versioned persistence for documents and their chunks.
 *
 * <p>Each method runs in its own transaction. Readers only ever see chunks that are active and
 * belong to an active document in {@link IndexingStatus#COMPLETE}.
 */
public interface KnowledgeStore {

  /**
   * Persists a new document.
   *
   * @param document the document to save, status pending
   * @return the saved document with its id
   */
  Document createDocument(Document document);

  /**
   * Gets a document by id.
   *
   * @throws com.flamingo.ai.frontdesk.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  Optional<Document> findDocument(UUID documentId);

  /**
   * Supersedes a document with a new version. The current document and its chunks are deactivated
   * and a new pending row pointing back at it is created, carrying over business, type, file
   * metadata and related service.
   *
   * @param documentId the active document to supersede
   * @param newContent content of the new version
   * @param newTitle new title, or null to keep the current one
   * @param fileSize byte size of a new upload, or null to keep the current one
   * @return the new, pending version
   * @throws com.flamingo.ai.frontdesk.exception.DocumentNotFoundException if not found
   * @throws com.flamingo.ai.frontdesk.exception.DocumentProcessingException if the document is not
   *     the active head of its version chain
   */
  Document createVersion(UUID documentId, String newContent, String newTitle, Long fileSize);

  /**
   * Swaps a document back to its previous version. The current document and its chunks are
   * deactivated, the previous document and its chunks reactivated.
   *
   * @param documentId the current version
   * @return the reactivated previous version
   * @throws com.flamingo.ai.frontdesk.exception.DocumentNotFoundException if the document, its
   *     previous version link, or the previous row is missing
   */
  Document revert(UUID documentId);

  /** Replaces the stored text of a document, e.g. with text extracted from its upload. */
  void updateContent(UUID documentId, String content, Long fileSize);

  /**
   * Atomically replaces the chunk set of a document and marks it complete.
   *
   * @param documentId the document
   * @param chunks embedded chunks from the latest indexing pass
   * @return number of chunks stored
   */
  int replaceChunks(UUID documentId, List<EmbeddedChunk> chunks);

  /**
   * Deletes every chunk of a document, leaving the document row in place.
   *
   * @return number of chunks deleted
   */
  int deleteChunks(UUID documentId);

  /** Puts a document back to pending so it can be indexed again. */
  void resetForReindex(UUID documentId);

  /**
   * Records an indexing status in a separate transaction, retrying on lock contention.
   *
   * @param documentId the document
   * @param status the new status
   * @param error error text for {@link IndexingStatus#FAILED}, otherwise null
   */
  void updateStatus(UUID documentId, IndexingStatus status, String error);

  long countActiveChunks(UUID documentId);

  /**
   * Loads the chunks retrieval may read for a business.
   *
   * @param businessId the business
   * @param serviceId when set, drop chunks of documents related to another service
   * @param type when set, only chunks of documents of this type
   * @return chunks with their documents loaded, in document then position order
   */
  List<DocumentChunk> findSearchableChunks(UUID businessId, UUID serviceId, DocumentType type);

  /** Finds synthetic documents of a business generated from the given fields. */
  List<Document> findSyntheticDocuments(UUID businessId, Collection<String> sourceFields);

  /** Finds every synthetic document of a business. */
  List<Document> findSyntheticDocuments(UUID businessId);

  /**
   * Physically deletes documents and their chunks.
   *
   * @return number of chunks deleted
   */
  int deleteDocuments(Collection<Document> documents);

  boolean hasSyntheticKnowledge(UUID businessId);

  /** Most recent {@code indexedAt} among active synthetic documents, or null if none. */
  LocalDateTime latestSyntheticIndexedAt(UUID businessId);

  KnowledgeStats getStats(UUID businessId);
}
