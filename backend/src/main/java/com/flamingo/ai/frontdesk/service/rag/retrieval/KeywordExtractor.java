package com.flamingo.ai.frontdesk.service.rag.retrieval;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.stereotype.Component;

/** Extracts the keywords used by the fallback search when vector search finds nothing. */
@Component
public class KeywordExtractor {

  static final Set<String> STOP_WORDS =
      Set.of(
          "what", "is", "your", "the", "about", "do", "you", "have", "a", "an", "my", "can", "how",
          "where", "when", "who", "does", "are", "will", "would", "could", "should");

  /**
   * Lower-cases the query, drops {@code ?} and {@code !}, splits on whitespace and keeps tokens
   * longer than two characters that are not stop words.
   *
   * @return distinct keywords in query order; empty when nothing meaningful remains
   */
  public List<String> extract(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    String cleaned = query.toLowerCase(Locale.ROOT).replace("?", "").replace("!", "");
    return Arrays.stream(cleaned.split("\\s+"))
        .filter(word -> word.length() > 2)
        .filter(word -> !STOP_WORDS.contains(word))
        .distinct()
        .toList();
  }

  /** True when the content contains any of the keywords, ignoring case. */
  public boolean matchesAny(String content, List<String> keywords) {
    if (content == null || keywords.isEmpty()) {
      return false;
    }
    String normalized = content.toLowerCase(Locale.ROOT);
    return keywords.stream().anyMatch(normalized::contains);
  }
}
