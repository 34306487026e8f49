package com.flamingo.ai.frontdesk.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for indexing and retrieval metrics. */
@Configuration
public class MetricsConfig {

  private static final List<String> KNOWLEDGE_TIMER_PREFIXES =
      List.of("indexing.", "ingestion.", "knowledge.", "embedding.", "rag.retrieval");

  /**
   * Enables the @Timed annotation on indexing and retrieval operations.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Publishes p50/p95/p99 for the engine's own timers. Retrieval sits on the reply path of a live
   * call, so its tail latency matters more than the mean.
   */
  @Bean
  public MeterFilter knowledgeLatencyPercentiles() {
    return new MeterFilter() {
      @Override
      public DistributionStatisticConfig configure(
          Meter.Id id, DistributionStatisticConfig config) {
        if (id.getType() != Meter.Type.TIMER || !isKnowledgeTimer(id.getName())) {
          return config;
        }
        return DistributionStatisticConfig.builder()
            .percentiles(0.5, 0.95, 0.99)
            .build()
            .merge(config);
      }
    };
  }

  static boolean isKnowledgeTimer(String name) {
    return KNOWLEDGE_TIMER_PREFIXES.stream().anyMatch(name::startsWith);
  }
}
