package com.flamingo.ai.frontdesk.exception;

import java.util.UUID;

/** Exception thrown when a business is not found. */
public class BusinessNotFoundException extends RuntimeException {

  private final UUID businessId;

  public BusinessNotFoundException(UUID businessId) {
    super("Business not found: " + businessId);
    this.businessId = businessId;
  }

  public UUID getBusinessId() {
    return businessId;
  }
}
