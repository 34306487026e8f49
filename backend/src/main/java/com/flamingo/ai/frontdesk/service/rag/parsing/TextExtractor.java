package com.flamingo.ai.frontdesk.service.rag.parsing;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.service.rag.model.ExtractedText;

/**
 * Recovers plain text from the bytes of an uploaded file.
 *
 * <p>Implementations must be stateless and safe for concurrent use. They never chunk or embed.
 */
public interface TextExtractor {

  /**
   * Extracts text from the given file bytes.
   *
   * @param fileBytes raw file content
   * @param fileName original file name, may be null
   * @return the extracted text, possibly blank
   * @throws com.flamingo.ai.frontdesk.exception.ExtractionException if the file cannot be read
   */
  ExtractedText extract(byte[] fileBytes, String fileName);

  /**
   * Returns {@code true} if this extractor handles the given document.
   *
   * @param type declared document type
   * @param fileName original file name, may be null
   * @return {@code true} if supported
   */
  boolean supports(DocumentType type, String fileName);
}
