package com.flamingo.ai.frontdesk.service.rag.parsing;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.exception.ExtractionException;
import com.flamingo.ai.frontdesk.service.rag.model.ExtractedText;
import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Catch-all {@link TextExtractor} for uploaded notes and guides in any format Apache Tika can read
 * (DOCX, ODT, RTF, HTML, plain text, ...). Produces text without page structure.
 */
@Component
@Order(10)
@Slf4j
public class TikaTextExtractor implements TextExtractor {

  @Override
  public ExtractedText extract(byte[] fileBytes, String fileName) {
    AutoDetectParser parser = new AutoDetectParser();
    BodyContentHandler handler = new BodyContentHandler(-1);
    Metadata metadata = new Metadata();
    if (fileName != null) {
      metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, fileName);
    }

    try (InputStream in = new ByteArrayInputStream(fileBytes)) {
      parser.parse(in, handler, metadata, new ParseContext());
    } catch (Exception e) {
      log.error("Tika extraction failed for {}: {}", fileName, e.getMessage());
      throw new ExtractionException(null, "Failed to extract text: " + e.getMessage(), e);
    }

    String text = handler.toString();
    log.debug("Extracted {} chars from {}", text.length(), fileName);
    return new ExtractedText(text, List.of(), 0);
  }

  @Override
  public boolean supports(DocumentType type, String fileName) {
    return true;
  }
}
