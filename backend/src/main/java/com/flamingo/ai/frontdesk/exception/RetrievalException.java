package com.flamingo.ai.frontdesk.exception;

/**
 * Exception raised inside query-time retrieval. Never leaves the retrieval service: it is turned
 * into an empty context.
 */
public class RetrievalException extends RuntimeException {

  private final String userMessage;

  public RetrievalException(String message) {
    super(message);
    this.userMessage = "Knowledge lookup is temporarily unavailable.";
  }

  public RetrievalException(String message, Throwable cause) {
    super(message, cause);
    this.userMessage = "Knowledge lookup is temporarily unavailable.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
