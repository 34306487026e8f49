package com.flamingo.ai.frontdesk.exception;

import java.util.UUID;

/** Exception thrown when a document, or the version it should revert to, is not found. */
public class DocumentNotFoundException extends RuntimeException {

  private final UUID documentId;

  public DocumentNotFoundException(UUID documentId) {
    super("Document not found: " + documentId);
    this.documentId = documentId;
  }

  public DocumentNotFoundException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
  }

  public UUID getDocumentId() {
    return documentId;
  }
}
