package com.flamingo.ai.frontdesk.service.rag.model;

import java.util.List;

/**
 * Text recovered from an uploaded file.
 *
 * @param fullText concatenated text of the non-blank pages, separated by blank lines
 * @param pages non-blank pages in order; empty for formats without page structure
 * @param pageCount total number of pages in the file, blank ones included
 */
public record ExtractedText(String fullText, List<PageText> pages, int pageCount) {

  public boolean isBlank() {
    return fullText == null || fullText.isBlank();
  }

  public boolean hasPages() {
    return pages != null && !pages.isEmpty();
  }
}
