package com.flamingo.ai.frontdesk.service.rag.retrieval;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Diagnostics of one retrieval call.
 *
 * @param query the query as received
 * @param businessId the business searched
 * @param timestamp when the call started
 * @param detectedService name of the service the query was scoped to, or null
 * @param usedKeywordFallback whether results came from keyword matching
 * @param keywords keywords extracted for the fallback; empty when it did not run
 * @param threshold similarity threshold in effect
 * @param results chunks in the order they were rendered
 * @param error message of the failure that emptied the context, or null
 */
public record RetrievalDebugInfo(
    String query,
    UUID businessId,
    Instant timestamp,
    String detectedService,
    boolean usedKeywordFallback,
    List<String> keywords,
    double threshold,
    List<RetrievedChunk> results,
    String error) {

  static RetrievalDebugInfo failed(String query, UUID businessId, Instant timestamp, String error) {
    return new RetrievalDebugInfo(
        query, businessId, timestamp, null, false, List.of(), 0.0, List.of(), error);
  }
}
