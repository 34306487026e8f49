package com.flamingo.ai.frontdesk.domain.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Document Tests")
class DocumentTest {

  @Test
  @DisplayName("Should start pending and active")
  void shouldStartPending() {
    Document document = Document.builder().title("Hours").build();

    assertThat(document.getIndexingStatus()).isEqualTo(IndexingStatus.PENDING);
    assertThat(document.isActive()).isTrue();
    assertThat(document.isSearchable()).isFalse();
    assertThat(document.isSynthetic()).isFalse();
  }

  @Test
  @DisplayName("Should move through the indexing states")
  void shouldMoveThroughStates() {
    Document document = Document.builder().title("Hours").build();

    document.startProcessing();
    assertThat(document.getIndexingStatus()).isEqualTo(IndexingStatus.PROCESSING);

    document.markFailed("No text content found");
    assertThat(document.getIndexingStatus()).isEqualTo(IndexingStatus.FAILED);
    assertThat(document.getIndexingError()).isEqualTo("No text content found");

    document.markComplete(3);
    assertThat(document.isSearchable()).isTrue();
    assertThat(document.getChunkCount()).isEqualTo(3);
    assertThat(document.getIndexedAt()).isNotNull();
    assertThat(document.getIndexingError()).isNull();

    document.resetForReindex();
    assertThat(document.getIndexingStatus()).isEqualTo(IndexingStatus.PENDING);
    assertThat(document.getChunkCount()).isNull();
  }

  @Test
  @DisplayName("Should hide complete documents that are no longer active")
  void shouldHideInactiveDocuments() {
    Document document = Document.builder().active(false).build();
    document.markComplete(1);

    assertThat(document.isSearchable()).isFalse();
  }

  @Test
  @DisplayName("Should refuse to be its own previous version")
  void shouldRefuseSelfReference() {
    UUID id = UUID.randomUUID();
    Document document = Document.builder().id(id).previousVersionId(id).build();

    assertThatThrownBy(document::onUpdate)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("cannot be its own previous version");
  }

  @Test
  @DisplayName("Should treat documents with a source field as synthetic")
  void shouldDetectSynthetic() {
    assertThat(Document.builder().sourceField("quick_responses").build().isSynthetic()).isTrue();
  }
}
