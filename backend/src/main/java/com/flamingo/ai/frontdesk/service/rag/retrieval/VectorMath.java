package com.flamingo.ai.frontdesk.service.rag.retrieval;

import java.util.List;

/** Vector similarity helpers for in-process semantic search. */
public final class VectorMath {

  /**
   * Cosine similarity of two vectors.
   *
   * @return a value in [-1, 1]; 0 when either vector has zero length
   * @throws IllegalArgumentException if the dimensions differ
   */
  public static double cosine(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vector dimensions must match: " + a.size() + " != " + b.size());
    }

    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }

    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }

  private VectorMath() {}
}
