package com.flamingo.ai.frontdesk.service.rag.parsing;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.exception.ExtractionException;
import com.flamingo.ai.frontdesk.service.rag.model.ExtractedText;
import com.flamingo.ai.frontdesk.service.rag.model.PageText;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * {@link TextExtractor} for PDF files.
 *
 * <p>Uses Apache PDFBox 3.x to extract text page by page so chunks can keep their page number.
 * Blank pages are skipped in the page list but still counted in the page count.
 */
@Component
@Order(1)
@Slf4j
public class PdfBoxTextExtractor implements TextExtractor {

  @Override
  public ExtractedText extract(byte[] fileBytes, String fileName) {
    try (PDDocument pdfDoc = Loader.loadPDF(fileBytes)) {
      int pageCount = pdfDoc.getNumberOfPages();
      PDFTextStripper stripper = new PDFTextStripper();
      List<PageText> pages = new ArrayList<>();

      for (int pageNumber = 1; pageNumber <= pageCount; pageNumber++) {
        stripper.setStartPage(pageNumber);
        stripper.setEndPage(pageNumber);
        String text = stripper.getText(pdfDoc);
        if (text != null && !text.isBlank()) {
          pages.add(new PageText(pageNumber, text));
        }
      }

      String fullText = pages.stream().map(PageText::text).collect(Collectors.joining("\n\n"));
      log.debug("Extracted {} non-blank pages of {} from {}", pages.size(), pageCount, fileName);
      return new ExtractedText(fullText, pages, pageCount);
    } catch (IOException e) {
      log.error("PDFBox extraction failed for {}: {}", fileName, e.getMessage());
      throw new ExtractionException(null, "Failed to extract text from PDF: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(DocumentType type, String fileName) {
    return type == DocumentType.PDF
        || (fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf"));
  }
}
