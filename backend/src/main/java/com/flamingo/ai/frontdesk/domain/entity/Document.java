package com.flamingo.ai.frontdesk.domain.entity;

import com.flamingo.ai.frontdesk.domain.enums.DocumentType;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A unit of business knowledge: an uploaded PDF or note, a policy, an FAQ set, or a synthesized
 * record of a structured business field.
 *
 * <p>Content is never edited in place once indexed. A new version is a new row whose {@code
 * previousVersionId} points at the row it replaced; only the head of that chain is active.
 */
@Entity
@Table(
    name = "documents",
    indexes = {
      @Index(name = "idx_documents_business_active", columnList = "business_id, is_active"),
      @Index(name = "idx_documents_source_field", columnList = "business_id, source_field")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "business_id", nullable = false)
  private UUID businessId;

  @Column(nullable = false, length = 500)
  private String title;

  @Enumerated(EnumType.STRING)
  @Column(name = "document_type", nullable = false)
  private DocumentType type;

  /** Raw text, or the text extracted from the uploaded file. */
  @Column(nullable = false, columnDefinition = "TEXT")
  private String originalContent;

  @Column(length = 1000)
  private String filePath;

  @Column(length = 500)
  private String originalFilename;

  private Long fileSize;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false)
  @Builder.Default
  private IndexingStatus indexingStatus = IndexingStatus.PENDING;

  /** Error message if indexing failed. */
  @Column(columnDefinition = "TEXT")
  private String indexingError;

  private LocalDateTime indexedAt;

  /** Number of chunks produced by the latest successful indexing pass. */
  private Integer chunkCount;

  @Column(name = "related_service_id")
  private UUID relatedServiceId;

  @Column(name = "previous_version_id")
  private UUID previousVersionId;

  /** Structured business field this document was generated from; null for uploaded content. */
  @Column(name = "source_field", length = 50)
  private String sourceField;

  @Column(name = "is_active", nullable = false)
  @Builder.Default
  private boolean active = true;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    checkVersionLink();
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    checkVersionLink();
    updatedAt = LocalDateTime.now();
  }

  private void checkVersionLink() {
    if (id != null && id.equals(previousVersionId)) {
      throw new IllegalStateException("Document " + id + " cannot be its own previous version");
    }
  }

  /** Marks the document as processing. */
  public void startProcessing() {
    this.indexingStatus = IndexingStatus.PROCESSING;
  }

  /** Marks the document as indexed with the given number of chunks. */
  public void markComplete(int chunkCount) {
    this.indexingStatus = IndexingStatus.COMPLETE;
    this.chunkCount = chunkCount;
    this.indexedAt = LocalDateTime.now();
    this.indexingError = null;
  }

  /** Marks the document as failed with an error message. */
  public void markFailed(String errorMessage) {
    this.indexingStatus = IndexingStatus.FAILED;
    this.indexingError = errorMessage;
  }

  /** Puts the document back at the start of the indexing state machine. */
  public void resetForReindex() {
    this.indexingStatus = IndexingStatus.PENDING;
    this.chunkCount = null;
  }

  /** True when this document was generated from a structured business field. */
  public boolean isSynthetic() {
    return sourceField != null;
  }

  /** True when retrieval may read this document's chunks. */
  public boolean isSearchable() {
    return active && indexingStatus == IndexingStatus.COMPLETE;
  }
}
