package com.flamingo.ai.frontdesk.domain.entity;

import com.flamingo.ai.frontdesk.domain.converter.FloatListConverter;
import com.flamingo.ai.frontdesk.domain.converter.JsonMapConverter;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One embeddable slice of a document's content.
 *
 * <p>The owning business id is copied from the document so active-chunk scans stay on the {@code
 * (business_id, is_active)} index.
 */
@Entity
@Table(
    name = "document_chunks",
    indexes = {
      @Index(name = "idx_chunks_business_active", columnList = "business_id, is_active"),
      @Index(name = "idx_chunks_document", columnList = "document_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DocumentChunk {

  /** Metadata key carrying the surfaced answer of a synthesized question chunk. */
  public static final String ANSWER_KEY = "answer";

  /** Metadata key carrying the source page of a PDF chunk. */
  public static final String PAGE_NUMBER_KEY = "page_number";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @ManyToOne(fetch = FetchType.LAZY)
  @JoinColumn(name = "document_id", nullable = false)
  private Document document;

  @Column(name = "business_id", nullable = false)
  private UUID businessId;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  @Convert(converter = FloatListConverter.class)
  @Column(nullable = false, columnDefinition = "TEXT")
  @Builder.Default
  private List<Float> embedding = List.of();

  @Column(nullable = false)
  private int chunkIndex;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  @Column(name = "is_active", nullable = false)
  @Builder.Default
  private boolean active = true;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
