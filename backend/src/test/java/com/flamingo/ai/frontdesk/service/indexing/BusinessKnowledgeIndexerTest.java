package com.flamingo.ai.frontdesk.service.indexing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.domain.entity.Business;
import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.entity.ServiceOffering;
import com.flamingo.ai.frontdesk.domain.repository.BusinessRepository;
import com.flamingo.ai.frontdesk.domain.repository.ServiceOfferingRepository;
import com.flamingo.ai.frontdesk.exception.BusinessNotFoundException;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

@ExtendWith(MockitoExtension.class)
@DisplayName("BusinessKnowledgeIndexer Tests")
class BusinessKnowledgeIndexerTest {

  @Mock private BusinessRepository businessRepository;
  @Mock private ServiceOfferingRepository serviceRepository;
  @Mock private KnowledgeStore knowledgeStore;
  @Mock private DocumentIndexingService documentIndexingService;

  private MeterRegistry meterRegistry;
  private BusinessKnowledgeIndexer indexer;
  private Business business;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    indexer =
        new BusinessKnowledgeIndexer(
            businessRepository,
            serviceRepository,
            knowledgeStore,
            new KnowledgeSynthesizer(),
            documentIndexingService,
            new RagConfig(),
            meterRegistry);
    business = business("Main Street Barber");

    lenient()
        .when(documentIndexingService.createAndIndex(any(Document.class), isNull()))
        .thenAnswer(
            invocation -> {
              UUID id = UUID.randomUUID();
              return IndexingResult.indexed(id, 2, "Indexed 2 chunks");
            });
    lenient()
        .when(serviceRepository.findByBusinessIdAndActiveTrueOrderByDisplayOrderAsc(any()))
        .thenReturn(List.of());
  }

  private static Business business(String name) {
    Map<String, Object> quickResponses = new LinkedHashMap<>();
    quickResponses.put("What are your hours?", "9-5 Mon-Fri.");
    quickResponses.put("Do you take cards?", "Yes.");
    return Business.builder()
        .id(UUID.randomUUID())
        .name(name)
        .quickResponses(quickResponses)
        .createdAt(LocalDateTime.now().minusDays(2))
        .updatedAt(LocalDateTime.now().minusDays(1))
        .build();
  }

  private void stubBusiness(Business business) {
    when(businessRepository.findById(business.getId())).thenReturn(Optional.of(business));
  }

  @Nested
  @DisplayName("indexBusiness")
  class IndexBusinessTests {

    @Test
    @DisplayName("Should index one document per generated entry group")
    void shouldIndexBusiness() {
      stubBusiness(business);

      IndexingResult result = indexer.indexBusiness(business.getId(), false);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getIndexedCount()).isEqualTo(4);
      assertThat(result.getDocumentIds()).hasSize(2);
      ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
      verify(documentIndexingService, times(2)).createAndIndex(captor.capture(), isNull());
      Document first = captor.getAllValues().get(0);
      assertThat(first.getSourceField()).isEqualTo("quick_responses");
      assertThat(first.getBusinessId()).isEqualTo(business.getId());
      assertThat(first.getOriginalContent()).isEqualTo("Q: What are your hours?\nA: 9-5 Mon-Fri.");
    }

    @Test
    @DisplayName("Should link service documents to their service")
    void shouldLinkServiceDocuments() {
      stubBusiness(business);
      ServiceOffering haircut =
          ServiceOffering.builder()
              .id(UUID.randomUUID())
              .businessId(business.getId())
              .name("Haircut")
              .price(new BigDecimal("30"))
              .build();
      when(serviceRepository.findByBusinessIdAndActiveTrueOrderByDisplayOrderAsc(business.getId()))
          .thenReturn(List.of(haircut));

      indexer.indexBusiness(business.getId(), false);

      ArgumentCaptor<Document> captor = ArgumentCaptor.forClass(Document.class);
      verify(documentIndexingService, times(3)).createAndIndex(captor.capture(), isNull());
      assertThat(captor.getAllValues())
          .filteredOn(document -> "Service: Haircut".equals(document.getTitle()))
          .singleElement()
          .extracting(Document::getRelatedServiceId)
          .isEqualTo(haircut.getId());
    }

    @Test
    @DisplayName("Should leave existing knowledge alone without force")
    void shouldSkipExistingKnowledge() {
      stubBusiness(business);
      when(knowledgeStore.hasSyntheticKnowledge(business.getId())).thenReturn(true);

      IndexingResult result = indexer.indexBusiness(business.getId(), false);

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getMessage()).isEqualTo("Knowledge already indexed");
      verify(documentIndexingService, never()).createAndIndex(any(Document.class), any());
    }

    @Test
    @DisplayName("Should delete existing knowledge before a forced reindex")
    void shouldDeleteBeforeReindex() {
      stubBusiness(business);
      List<Document> existing = List.of(Document.builder().id(UUID.randomUUID()).build());
      when(knowledgeStore.findSyntheticDocuments(business.getId())).thenReturn(existing);
      when(knowledgeStore.deleteDocuments(existing)).thenReturn(5);

      IndexingResult result = indexer.reindexBusiness(business.getId());

      assertThat(result.getDeletedCount()).isEqualTo(5);
      InOrder order = inOrder(knowledgeStore, documentIndexingService);
      order.verify(knowledgeStore).deleteDocuments(existing);
      order.verify(documentIndexingService).createAndIndex(any(Document.class), isNull());
    }

    @Test
    @DisplayName("Should report partial failures")
    void shouldReportPartialFailure() {
      stubBusiness(business);
      when(documentIndexingService.createAndIndex(any(Document.class), isNull()))
          .thenReturn(IndexingResult.indexed(UUID.randomUUID(), 2, "Indexed 2 chunks"))
          .thenReturn(IndexingResult.failure(UUID.randomUUID(), "Failed to index document: down"));

      IndexingResult result = indexer.indexBusiness(business.getId(), true);

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getIndexedCount()).isEqualTo(2);
      assertThat(result.getMessage()).contains("1 of 2 documents failed");
    }

    @Test
    @DisplayName("Should throw for an unknown business")
    void shouldThrowForUnknownBusiness() {
      UUID missing = UUID.randomUUID();
      when(businessRepository.findById(missing)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> indexer.indexBusiness(missing, false))
          .isInstanceOf(BusinessNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("updateBusinessKnowledgeIncremental")
  class IncrementalTests {

    @Test
    @DisplayName("Should only rebuild documents of the changed fields")
    void shouldRebuildChangedFields() {
      stubBusiness(business);
      List<Document> faqs = List.of(Document.builder().id(UUID.randomUUID()).build());
      when(knowledgeStore.findSyntheticDocuments(business.getId(), Set.of("quick_responses")))
          .thenReturn(faqs);
      when(knowledgeStore.deleteDocuments(faqs)).thenReturn(2);

      IndexingResult result =
          indexer.updateBusinessKnowledgeIncremental(
              business.getId(), List.of("quick_responses", "favourite_colour"));

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getDeletedCount()).isEqualTo(2);
      verify(documentIndexingService, times(2)).createAndIndex(any(Document.class), isNull());
      verify(knowledgeStore, never()).findSyntheticDocuments(business.getId());
    }

    @Test
    @DisplayName("Should fail when no known field is given")
    void shouldFailForUnknownFields() {
      IndexingResult result =
          indexer.updateBusinessKnowledgeIncremental(business.getId(), List.of("nonsense"));

      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getMessage()).startsWith("No known fields to update");
      verify(knowledgeStore, never()).deleteDocuments(anyCollection());
    }

    @Test
    @DisplayName("Should report when the changed fields produce no documents")
    void shouldReportNothingToIndex() {
      stubBusiness(business);
      when(knowledgeStore.findSyntheticDocuments(business.getId(), Set.of("contact_info")))
          .thenReturn(List.of());

      IndexingResult result =
          indexer.updateBusinessKnowledgeIncremental(business.getId(), List.of("contact_info"));

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getMessage()).isEqualTo("No new documents to index from updated fields");
    }

    @Test
    @DisplayName("Should reindex everything when no fields are given")
    void shouldReindexWithoutFields() {
      stubBusiness(business);
      when(knowledgeStore.findSyntheticDocuments(business.getId())).thenReturn(List.of());

      IndexingResult result = indexer.updateBusinessKnowledgeIncremental(business.getId(), null);

      assertThat(result.isSuccess()).isTrue();
      verify(knowledgeStore).findSyntheticDocuments(business.getId());
    }
  }

  @Nested
  @DisplayName("maintenance")
  class MaintenanceTests {

    @Test
    @DisplayName("Should delete synthetic knowledge and report the chunk count")
    void shouldDeleteKnowledge() {
      Document document = Document.builder().id(UUID.randomUUID()).build();
      when(knowledgeStore.findSyntheticDocuments(business.getId())).thenReturn(List.of(document));
      when(knowledgeStore.deleteDocuments(List.of(document))).thenReturn(7);

      IndexingResult result = indexer.deleteBusinessKnowledge(business.getId());

      assertThat(result.isSuccess()).isTrue();
      assertThat(result.getDeletedCount()).isEqualTo(7);
      assertThat(result.getMessage()).isEqualTo("Deleted 7 knowledge chunks");
      assertThat(result.getDocumentIds()).containsExactly(document.getId());
    }

    @Test
    @DisplayName("Should not refresh a business without knowledge")
    void shouldNotRefreshWithoutKnowledge() {
      when(knowledgeStore.latestSyntheticIndexedAt(business.getId())).thenReturn(null);

      assertThat(indexer.refreshIfStale(business.getId())).isFalse();
      verify(businessRepository, never()).findById(any());
    }

    @Test
    @DisplayName("Should not refresh knowledge indexed after the last business change")
    void shouldNotRefreshFreshKnowledge() {
      stubBusiness(business);
      when(knowledgeStore.latestSyntheticIndexedAt(business.getId()))
          .thenReturn(LocalDateTime.now());

      assertThat(indexer.refreshIfStale(business.getId())).isFalse();
    }

    @Test
    @DisplayName("Should reindex stale knowledge")
    void shouldRefreshStaleKnowledge() {
      stubBusiness(business);
      when(knowledgeStore.latestSyntheticIndexedAt(business.getId()))
          .thenReturn(LocalDateTime.now().minusDays(3));
      when(knowledgeStore.findSyntheticDocuments(business.getId())).thenReturn(List.of());

      assertThat(indexer.refreshIfStale(business.getId())).isTrue();
      verify(documentIndexingService, times(2)).createAndIndex(any(Document.class), isNull());
    }

    @Test
    @DisplayName("Should swallow errors while checking staleness")
    void shouldSwallowStalenessErrors() {
      when(knowledgeStore.latestSyntheticIndexedAt(business.getId()))
          .thenThrow(new IllegalStateException("database is locked"));

      assertThat(indexer.refreshIfStale(business.getId())).isFalse();
    }
  }

  @Nested
  @DisplayName("indexAllBusinesses")
  class BulkTests {

    @Test
    @DisplayName("Should page through businesses and keep going after a failure")
    void shouldIndexAllPages() {
      Business broken = business("Broken Salon");
      Sort sort = Sort.by("createdAt", "id");
      when(businessRepository.findByActiveTrue(any(Pageable.class)))
          .thenReturn(new PageImpl<>(List.of(business), PageRequest.of(0, 1, sort), 2))
          .thenReturn(new PageImpl<>(List.of(broken), PageRequest.of(1, 1, sort), 2));
      stubBusiness(business);
      when(businessRepository.findById(broken.getId()))
          .thenThrow(new IllegalStateException("database is locked"));

      BulkIndexingResult result = indexer.indexAllBusinesses(1, false);

      assertThat(result.getTotalBusinesses()).isEqualTo(2);
      assertThat(result.getSuccessful()).isEqualTo(1);
      assertThat(result.getFailed()).isEqualTo(1);
      assertThat(result.isSuccess()).isFalse();
      assertThat(result.getDetails())
          .extracting(BusinessIndexingOutcome::businessName)
          .containsExactly("Main Street Barber", "Broken Salon");
      assertThat(result.getDetails().get(1).message()).isEqualTo("database is locked");
      assertThat(meterRegistry.counter("indexing.business.failure").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should report an empty run")
    void shouldHandleNoBusinesses() {
      when(businessRepository.findByActiveTrue(any(Pageable.class)))
          .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0));

      BulkIndexingResult result = indexer.indexAllBusinesses();

      assertThat(result.getTotalBusinesses()).isZero();
      assertThat(result.isSuccess()).isTrue();
    }
  }
}
