package com.flamingo.ai.frontdesk.exception;

import java.util.UUID;

/** Exception thrown when no usable text can be recovered from a document's source content. */
public class ExtractionException extends DocumentProcessingException {

  public ExtractionException(UUID documentId, String message) {
    super(documentId, message, "No readable text was found in the document");
  }

  public ExtractionException(UUID documentId, String message, Throwable cause) {
    super(documentId, message, cause);
  }
}
