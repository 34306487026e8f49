package com.flamingo.ai.frontdesk.exception;

/**
 * Exception thrown when text cannot be sent to the embedding model at all. Never retried and not
 * counted against the model's circuit breaker.
 */
public class InvalidEmbeddingInputException extends EmbeddingException {

  public InvalidEmbeddingInputException(String message) {
    super(message);
  }
}
