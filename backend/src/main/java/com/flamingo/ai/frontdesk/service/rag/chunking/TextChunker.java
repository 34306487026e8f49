package com.flamingo.ai.frontdesk.service.rag.chunking;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.domain.entity.DocumentChunk;
import com.flamingo.ai.frontdesk.service.rag.model.PageText;
import com.flamingo.ai.frontdesk.service.rag.model.TextChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits document text into overlapping, sentence-aware chunks.
 *
 * <p>Plain text is cut at the configured character budget with a fixed overlap between
 * consecutive chunks. Before cutting, the chunker scans back from the budget edge through the
 * lookback window for a sentence terminator ({@code . ! ?} or newline) and breaks right after it;
 * when none is found it falls back to a hard cut.
 *
 * <p>Page-structured input keeps each page that fits the budget as one chunk tagged with its page
 * number; larger pages are split with the same rule and every piece keeps the page number.
 *
 * <p>Stateless and safe for concurrent use.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TextChunker {

  private final RagConfig ragConfig;

  /**
   * Chunks unstructured text.
   *
   * @param text the text to chunk
   * @return ordered chunks; empty for blank input
   */
  public List<TextChunk> chunk(String text) {
    return chunk(text, List.of());
  }

  /**
   * Chunks text, following the page structure when one is given.
   *
   * @param text the full text, used when {@code pages} is empty
   * @param pages extracted pages, may be empty
   * @return ordered chunks with indexes starting at 0; empty for blank input
   */
  public List<TextChunk> chunk(String text, List<PageText> pages) {
    RagConfig.Chunking config = ragConfig.getChunking();
    validate(config);

    List<TextChunk> chunks = new ArrayList<>();
    if (pages != null && !pages.isEmpty()) {
      int chunkIndex = 0;
      for (PageText page : pages) {
        if (page.text() == null || page.text().isBlank()) {
          continue;
        }
        Map<String, Object> metadata = Map.of(DocumentChunk.PAGE_NUMBER_KEY, page.pageNumber());
        for (String piece : split(page.text(), config)) {
          chunks.add(new TextChunk(piece, chunkIndex++, metadata));
        }
      }
    } else if (text != null && !text.isBlank()) {
      List<String> pieces = split(text, config);
      for (int i = 0; i < pieces.size(); i++) {
        chunks.add(new TextChunk(pieces.get(i), i, Map.of()));
      }
    }

    log.debug("Created {} chunks (pages: {})", chunks.size(), pages == null ? 0 : pages.size());
    return chunks;
  }

  List<String> split(String text, RagConfig.Chunking config) {
    int size = config.getSize();
    int overlap = config.getOverlap();
    int lookback = config.getLookback();

    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    if (trimmed.length() <= size) {
      return List.of(trimmed);
    }

    List<String> pieces = new ArrayList<>();
    int length = text.length();
    int start = 0;
    while (start < length) {
      int end = Math.min(start + size, length);
      if (end < length) {
        int floor = Math.max(start + size - lookback, start);
        for (int i = end - 1; i > floor; i--) {
          if (isSentenceBoundary(text.charAt(i))) {
            end = i + 1;
            break;
          }
        }
      }

      String piece = text.substring(start, end).strip();
      if (!piece.isEmpty()) {
        pieces.add(piece);
      }
      if (end >= length) {
        break;
      }

      int next = end - overlap;
      // a boundary found early in a short lookback can land the overlap behind the current start
      start = next > start ? next : end;
    }
    return pieces;
  }

  private static boolean isSentenceBoundary(char c) {
    return c == '.' || c == '!' || c == '?' || c == '\n';
  }

  private static void validate(RagConfig.Chunking config) {
    if (config.getSize() <= 0) {
      throw new IllegalStateException("Chunk size must be positive: " + config.getSize());
    }
    if (config.getOverlap() < 0 || config.getOverlap() >= config.getSize()) {
      throw new IllegalStateException(
          "Chunk overlap must be in [0, size): overlap="
              + config.getOverlap()
              + ", size="
              + config.getSize());
    }
  }
}
