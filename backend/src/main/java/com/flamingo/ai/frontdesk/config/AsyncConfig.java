package com.flamingo.ai.frontdesk.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for async ingestion and bounded external calls. */
@Configuration
@EnableAsync
public class AsyncConfig {

  @Bean(name = "documentProcessingExecutor")
  public Executor documentProcessingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("doc-index-");
    executor.initialize();
    return executor;
  }

  /** Runs embedding round-trips so callers can wait on them with a deadline. */
  @Bean(name = "embeddingCallExecutor")
  public Executor embeddingCallExecutor(RagConfig ragConfig) {
    int permits = Math.max(1, ragConfig.getIndexing().getMaxConcurrentEmbeddings());
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    // room for indexing permits plus concurrent conversation-time query embeddings
    executor.setCorePoolSize(permits + 4);
    executor.setMaxPoolSize(permits + 16);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("embed-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(5);
    executor.setMaxPoolSize(20);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("retrieve-");
    executor.initialize();
    return executor;
  }
}
