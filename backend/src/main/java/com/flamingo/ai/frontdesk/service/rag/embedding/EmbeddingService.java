package com.flamingo.ai.frontdesk.service.rag.embedding;

import com.flamingo.ai.frontdesk.config.RagConfig;
import com.flamingo.ai.frontdesk.exception.EmbeddingException;
import com.flamingo.ai.frontdesk.exception.EmbeddingTimeoutException;
import com.flamingo.ai.frontdesk.exception.InvalidEmbeddingInputException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Generates text embeddings with the configured {@link EmbeddingModel}.
 *
 * <p>Every call is a single round-trip bounded by {@code rag.embedding.timeout}. Newlines are
 * collapsed to spaces and the text trimmed before it is sent. The service holds no state; callers
 * that need to cap concurrency do so themselves.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final Executor embeddingCallExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      @Qualifier("embeddingCallExecutor") Executor embeddingCallExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.embeddingModel = embeddingModel;
    this.embeddingCallExecutor = embeddingCallExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Embeds a piece of text.
   *
   * @param text the text to embed
   * @return the embedding vector
   * @throws InvalidEmbeddingInputException if the text is blank
   * @throws EmbeddingException if the model call fails
   * @throws EmbeddingTimeoutException if the model does not answer within the deadline
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  @Retry(name = "openai")
  public List<Float> embed(String text) {
    String normalized = normalize(text);
    if (normalized.isEmpty()) {
      throw new InvalidEmbeddingInputException("Cannot generate embedding for empty text");
    }

    Duration timeout = ragConfig.getEmbedding().getTimeout();
    Timer.Sample sample = Timer.start(meterRegistry);
    CompletableFuture<Response<Embedding>> call =
        CompletableFuture.supplyAsync(
            () -> embeddingModel.embed(normalized), embeddingCallExecutor);
    try {
      log.debug("Calling embedding model, input length: {} chars", normalized.length());
      Response<Embedding> response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      float[] vector = response.content().vector();
      meterRegistry.counter("embedding.requests.success").increment();
      log.debug("Embedding generated, dimension: {}", vector.length);
      return toFloatList(vector);
    } catch (TimeoutException e) {
      call.cancel(true);
      log.error("Embedding timed out after {} ms", timeout.toMillis());
      throw new EmbeddingTimeoutException(timeout, e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new EmbeddingException("Embedding request failed: " + cause.getMessage(), cause);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      call.cancel(true);
      throw new EmbeddingException("Interrupted while waiting for embedding", e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    return text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ').strip();
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    if (t instanceof InvalidEmbeddingInputException invalidInput) {
      throw invalidInput;
    }
    meterRegistry.counter("embedding.requests.failure").increment();
    if (t instanceof EmbeddingException embeddingException) {
      log.warn("Embedding failed: {}", t.getMessage());
      throw embeddingException;
    }
    log.error("Embedding failed, circuit breaker open or call rejected: {}", t.getMessage());
    throw new EmbeddingException("Embedding unavailable: " + t.getMessage(), t);
  }
}
