package com.flamingo.ai.frontdesk.domain.enums;

/** Defines the indexing status of a knowledge document. */
public enum IndexingStatus {
  /** Document has been created or reset for reindexing but not yet processed. */
  PENDING,

  /** Document is being extracted, chunked and embedded. */
  PROCESSING,

  /** Document has been indexed and its chunks are visible to retrieval. */
  COMPLETE,

  /** Document indexing failed; the error is stored on the document. */
  FAILED
}
