package com.flamingo.ai.frontdesk.service.indexing;

import java.util.UUID;

/**
 * Per-business line of a bulk indexing run.
 *
 * @param businessId the business
 * @param businessName display name, for operators reading the report
 * @param success whether the business indexed without error
 * @param indexedCount chunks indexed for the business
 * @param message result or error message
 */
public record BusinessIndexingOutcome(
    UUID businessId, String businessName, boolean success, int indexedCount, String message) {}
