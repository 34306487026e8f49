package com.flamingo.ai.frontdesk.service.rag.retrieval;

/**
 * Score of a retrieved chunk.
 *
 * @param type how the chunk was found
 * @param similarity cosine similarity for {@link MatchType#VECTOR}, 0 for keyword matches
 */
public record MatchScore(MatchType type, double similarity) {

  public static MatchScore vector(double similarity) {
    return new MatchScore(MatchType.VECTOR, similarity);
  }

  public static MatchScore keyword() {
    return new MatchScore(MatchType.KEYWORD, 0.0);
  }

  /** Label used in provenance headers, e.g. {@code Relevance: 87%} or {@code keyword match}. */
  public String label() {
    if (type == MatchType.KEYWORD) {
      return "keyword match";
    }
    return "Relevance: " + Math.round(similarity * 100) + "%";
  }
}
