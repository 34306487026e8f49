package com.flamingo.ai.frontdesk.service.rag.parsing;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Routes a document to the highest-priority {@link TextExtractor} that supports it.
 *
 * <p>Extractors are injected by Spring in {@code @Order} order (ascending);
 * {@link TikaTextExtractor} is the catch-all.
 */
@Component
@RequiredArgsConstructor
public class TextExtractorRouter {

  private final List<TextExtractor> extractors;

  /**
   * Returns the extractor for the given document.
   *
   * @throws IllegalStateException if no extractor supports the document (should not happen)
   */
  public TextExtractor route(DocumentType type, String fileName) {
    return extractors.stream()
        .filter(e -> e.supports(type, fileName))
        .findFirst()
        .orElseThrow(
            () ->
                new IllegalStateException(
                    "No TextExtractor found for type " + type + " and file " + fileName));
  }
}
