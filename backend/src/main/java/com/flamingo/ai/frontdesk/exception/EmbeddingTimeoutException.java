package com.flamingo.ai.frontdesk.exception;

import java.time.Duration;

/** Exception thrown when the embedding model does not answer within the deadline. */
public class EmbeddingTimeoutException extends EmbeddingException {

  private final Duration timeout;

  public EmbeddingTimeoutException(Duration timeout, Throwable cause) {
    super("Embedding request timed out after " + timeout.toMillis() + " ms", cause);
    this.timeout = timeout;
  }

  public Duration getTimeout() {
    return timeout;
  }
}
