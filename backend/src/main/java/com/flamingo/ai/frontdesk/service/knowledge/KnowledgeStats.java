package com.flamingo.ai.frontdesk.service.knowledge;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of what retrieval can currently see for a business.
 *
 * @param businessId the business
 * @param totalChunks searchable chunks across all document types
 * @param chunksByType searchable chunks per document type
 * @param activeDocuments active documents, whatever their indexing status
 */
public record KnowledgeStats(
    UUID businessId, long totalChunks, Map<DocumentType, Long> chunksByType, int activeDocuments) {}
