package com.flamingo.ai.frontdesk.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

  private SimpleMeterRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    registry.config().meterFilter(new MetricsConfig().knowledgeLatencyPercentiles());
  }

  @Test
  @DisplayName("Should publish percentiles for indexing and retrieval timers")
  void shouldPublishPercentilesForKnowledgeTimers() {
    Timer retrieval = registry.timer("rag.retrieval.duration");
    Timer indexing = registry.timer("indexing.document");
    retrieval.record(Duration.ofMillis(40));
    indexing.record(Duration.ofMillis(900));

    assertThat(retrieval.takeSnapshot().percentileValues()).hasSize(3);
    assertThat(indexing.takeSnapshot().percentileValues()).hasSize(3);
  }

  @Test
  @DisplayName("Should leave unrelated timers untouched")
  void shouldIgnoreOtherTimers() {
    Timer jvm = registry.timer("jvm.gc.pause");
    jvm.record(Duration.ofMillis(5));

    assertThat(jvm.takeSnapshot().percentileValues()).isEmpty();
  }

  @Test
  @DisplayName("Should only match the engine's timer names")
  void shouldMatchKnowledgeTimerNames() {
    Counter skipped = registry.counter("indexing.chunks.skipped");
    skipped.increment();

    assertThat(MetricsConfig.isKnowledgeTimer("embedding.duration")).isTrue();
    assertThat(MetricsConfig.isKnowledgeTimer("knowledge.createVersion")).isTrue();
    assertThat(MetricsConfig.isKnowledgeTimer("http.server.requests")).isFalse();
    assertThat(skipped.count()).isEqualTo(1.0);
  }
}
