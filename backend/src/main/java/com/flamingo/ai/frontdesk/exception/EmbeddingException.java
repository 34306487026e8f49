package com.flamingo.ai.frontdesk.exception;

/** Exception thrown when an embedding cannot be generated for a piece of text. */
public class EmbeddingException extends RuntimeException {

  public EmbeddingException(String message) {
    super(message);
  }

  public EmbeddingException(String message, Throwable cause) {
    super(message, cause);
  }
}
