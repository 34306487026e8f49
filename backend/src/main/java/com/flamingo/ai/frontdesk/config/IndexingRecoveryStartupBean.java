package com.flamingo.ai.frontdesk.config;

import com.flamingo.ai.frontdesk.domain.entity.Document;
import com.flamingo.ai.frontdesk.domain.enums.IndexingStatus;
import com.flamingo.ai.frontdesk.domain.repository.DocumentRepository;
import com.flamingo.ai.frontdesk.service.knowledge.KnowledgeStore;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup bean that fails documents left in {@code PROCESSING} by a previous run.
 *
 * <p>An indexing pass runs in memory; if the process stops mid-pass nothing else would ever move
 * the document out of {@code PROCESSING}. Operators can reindex the failed documents afterwards.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexingRecoveryStartupBean implements CommandLineRunner {

  static final String INTERRUPTED_MESSAGE = "Indexing interrupted by application restart";

  private final DocumentRepository documentRepository;
  private final KnowledgeStore knowledgeStore;

  @Override
  public void run(String... args) {
    try {
      List<Document> stuck = documentRepository.findByIndexingStatus(IndexingStatus.PROCESSING);
      if (stuck.isEmpty()) {
        log.debug("No interrupted indexing passes found");
        return;
      }

      log.warn("Found {} documents left in PROCESSING, marking them failed", stuck.size());
      for (Document document : stuck) {
        knowledgeStore.updateStatus(document.getId(), IndexingStatus.FAILED, INTERRUPTED_MESSAGE);
      }
    } catch (Exception e) {
      log.error("Indexing recovery failed: {}", e.getMessage(), e);
      // Don't fail application startup if recovery fails
    }
  }
}
