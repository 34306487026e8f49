package com.flamingo.ai.frontdesk.service.indexing;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of an indexing operation. Failures are reported here rather than thrown; the error is
 * also recorded on the document row.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class IndexingResult {

  private boolean success;
  private String message;
  private int indexedCount;
  private int deletedCount;

  /** The document that is active after the operation. */
  private UUID documentId;

  /** The document that was superseded by a version change, if any. */
  private UUID previousDocumentId;

  /** Every document touched by a multi-document operation. */
  @Builder.Default private List<UUID> documentIds = new ArrayList<>();

  public static IndexingResult indexed(UUID documentId, int indexedCount, String message) {
    return IndexingResult.builder()
        .success(true)
        .message(message)
        .indexedCount(indexedCount)
        .documentId(documentId)
        .build();
  }

  public static IndexingResult failure(UUID documentId, String message) {
    return IndexingResult.builder().success(false).message(message).documentId(documentId).build();
  }
}
