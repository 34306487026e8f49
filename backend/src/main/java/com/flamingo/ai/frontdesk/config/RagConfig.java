package com.flamingo.ai.frontdesk.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the indexing and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Indexing indexing = new Indexing();

  @Getter
  @Setter
  public static class Chunking {
    /** Target characters per chunk. */
    private int size = 1000;

    /** Characters shared by consecutive chunks. Must stay below {@link #size}. */
    private int overlap = 200;

    /** How far back from the budget edge to look for a sentence boundary. */
    private int lookback = 200;
  }

  @Getter
  @Setter
  public static class Embedding {
    /** Deadline for a single embedding round-trip. */
    private Duration timeout = Duration.ofSeconds(30);

    private int dimensions = 1536;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int limit = 5;

    /**
     * Minimum cosine similarity a chunk needs to be returned. The default of 0 keeps every chunk
     * with a positive similarity.
     */
    private double similarityThreshold = 0.0;

    /** End-to-end budget for one retrieval call made during a conversation turn. */
    private Duration timeout = Duration.ofSeconds(10);

    private boolean logQueries = true;
  }

  @Getter
  @Setter
  public static class Indexing {
    /** Businesses fetched per page during bulk indexing. */
    private int batchSize = 10;

    /** Upper bound on embedding calls in flight across all indexing jobs. */
    private int maxConcurrentEmbeddings = 4;

    /**
     * When every chunk of a document fails to embed, mark the document failed instead of
     * complete with zero chunks.
     */
    private boolean failOnEmptyEmbeddings = true;

    /** Lock stripes used to serialize indexing passes per document. */
    private int lockStripes = 64;
  }
}
