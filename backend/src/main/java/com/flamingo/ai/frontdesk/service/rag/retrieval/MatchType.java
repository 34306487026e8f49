package com.flamingo.ai.frontdesk.service.rag.retrieval;

/** How a chunk was found. */
public enum MatchType {
  /** Cosine similarity against the query embedding. */
  VECTOR,
  /** Substring match of a query keyword, used when vector search finds nothing. */
  KEYWORD
}
