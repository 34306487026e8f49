package com.flamingo.ai.frontdesk.service.ingestion;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request to add a piece of knowledge to a business: raw text or an uploaded file. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentIngestionRequest {

  @NotNull(message = "Business id is required")
  private UUID businessId;

  @NotBlank(message = "Title is required")
  @Size(max = 500, message = "Title must not exceed 500 characters")
  private String title;

  @NotNull(message = "Document type is required")
  private DocumentType type;

  /** Text content. Ignored for extraction when {@link #fileBytes} are given. */
  private String content;

  private byte[] fileBytes;

  private UUID relatedServiceId;

  private String originalFilename;

  private String filePath;

  @AssertTrue(message = "Either content or file bytes are required")
  public boolean isContentPresent() {
    return (content != null && !content.isBlank()) || hasFile();
  }

  public boolean hasFile() {
    return fileBytes != null && fileBytes.length > 0;
  }

  /** Builds the pending document this request describes. */
  public Document toDocument() {
    return Document.builder()
        .businessId(businessId)
        .title(title.strip())
        .type(type)
        .originalContent(content != null ? content : "")
        .filePath(filePath)
        .originalFilename(originalFilename)
        .fileSize(hasFile() ? (long) fileBytes.length : null)
        .relatedServiceId(relatedServiceId)
        .indexingStatus(IndexingStatus.PENDING)
        .build();
  }
}
