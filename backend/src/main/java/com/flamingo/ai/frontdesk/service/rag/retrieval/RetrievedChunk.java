package com.flamingo.ai.frontdesk.service.rag.retrieval;

import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import java.util.Map;
import java.util.Optional;

/**
 * A chunk returned by retrieval, with its provenance. Vector and keyword results share this shape
 * and differ only in {@link #score()}.
 *
 * @param content indexed chunk text; the question for synthesized chunks
 * @param documentTitle title of the source document
 * @param documentType type of the source document
 * @param serviceName name of the service the source document relates to, or null
 * @param score how the chunk matched
 * @param metadata chunk metadata
 */
public record RetrievedChunk(
    String content,
    String documentTitle,
    DocumentType documentType,
    String serviceName,
    MatchScore score,
    Map<String, Object> metadata) {

  /** The surfaced answer of a synthesized question chunk. */
  public Optional<String> answer() {
    Object answer = metadata == null ? null : metadata.get(DocumentChunk.ANSWER_KEY);
    if (answer == null || answer.toString().isBlank()) {
      return Optional.empty();
    }
    return Optional.of(answer.toString());
  }

  /** The source page of a PDF chunk. */
  public Optional<Integer> pageNumber() {
    Object page = metadata == null ? null : metadata.get(DocumentChunk.PAGE_NUMBER_KEY);
    if (page instanceof Number number) {
      return Optional.of(number.intValue());
    }
    return Optional.empty();
  }
}
