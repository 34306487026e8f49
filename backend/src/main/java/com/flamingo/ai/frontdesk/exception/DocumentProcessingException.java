package com.flamingo.ai.frontdesk.exception;

import java.util.UUID;
import lombok.Getter;

/**
 * Exception thrown when a knowledge document cannot be indexed or switched between versions. The
 * message ends up in the document's {@code indexing_error}; {@link #getUserMessage()} is safe to
 * show to the business owner.
 */
@Getter
public class DocumentProcessingException extends RuntimeException {

  static final String DEFAULT_USER_MESSAGE =
      "This document could not be added to your assistant's knowledge";

  private final UUID documentId;
  private final String userMessage;

  public DocumentProcessingException(UUID documentId, String message) {
    this(documentId, message, DEFAULT_USER_MESSAGE);
  }

  public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = DEFAULT_USER_MESSAGE;
  }

  public DocumentProcessingException(UUID documentId, String message, String userMessage) {
    super(message);
    this.documentId = documentId;
    this.userMessage = userMessage;
  }
}
