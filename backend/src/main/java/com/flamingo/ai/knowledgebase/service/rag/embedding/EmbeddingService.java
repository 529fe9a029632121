package com.flamingo.ai.knowledgebase.service.rag.embedding;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Dense embeddings through the configured OpenAI-compatible embedding model. */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds one passage or query. Transient failures are retried with backoff.
   *
   * @param text text to embed; must not be blank
   * @return embedding vector
   */
  @Timed(value = "embedding.embed", description = "Time to embed one text")
  @Retry(name = "embedding")
  public List<Float> embed(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("Cannot embed blank text");
    }
    Response<Embedding> response = embeddingModel.embed(text);
    meterRegistry.counter("embedding.requests.success").increment();
    return toFloatList(response.content().vector());
  }

  /**
   * Embeds several texts in one model call, preserving order.
   *
   * @param texts non-blank texts
   * @return one vector per input
   */
  @Timed(value = "embedding.embed_all", description = "Time to embed a batch of texts")
  @Retry(name = "embedding")
  public List<List<Float>> embedAll(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    meterRegistry.counter("embedding.requests.success").increment();
    return response.content().stream().map(e -> toFloatList(e.vector())).toList();
  }

  /** Converts float array to Float list. */
  static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  /**
   * Cosine similarity of two vectors of equal length.
   *
   * @return similarity in [-1, 1]; 0 when either vector is empty or zero
   */
  public static double cosine(List<Float> a, List<Float> b) {
    if (a == null || b == null || a.isEmpty() || a.size() != b.size()) {
      return 0.0;
    }
    double dot = 0;
    double normA = 0;
    double normB = 0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
