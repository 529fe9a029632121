package com.flamingo.ai.knowledgebase.service.rag.rerank;

import com.flamingo.ai.knowledgebase.service.rag.embedding.EmbeddingService;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Cross-encoder reranker backed by a Jina-compatible API.
 *
 * <p>Cross-encoder scores are absolute relevance in [0, 1]. When no key is configured or the call
 * fails, candidates are scored by cosine similarity between query and passage embeddings instead,
 * which lives on a different scale and therefore uses its own pass mark.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CrossEncoderReranker implements Reranker {

  private final JinaRerankerClient rerankerClient;
  private final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "rag.rerank", description = "Time for cross-encoder reranking")
  @CircuitBreaker(name = "reranker", fallbackMethod = "rerankFallback")
  public List<ScoredIndex> rerank(String query, List<String> documents, RerankOptions options) {
    if (documents.isEmpty()) {
      return List.of();
    }
    if (!rerankerClient.isConfigured()) {
      log.debug("No reranker key configured, using embedding similarity");
      return cosineRerank(query, documents, options);
    }

    List<JinaRerankerClient.RerankResult> results = rerankerClient.rerank(query, documents);
    List<ScoredIndex> scored =
        results.stream()
            .filter(r -> r.index() >= 0 && r.index() < documents.size())
            .filter(r -> r.relevanceScore() >= options.threshold())
            .map(r -> new ScoredIndex(r.index(), r.relevanceScore()))
            .sorted(Comparator.comparingDouble(ScoredIndex::score).reversed())
            .limit(options.topN())
            .toList();
    log.debug(
        "Cross-encoder kept {}/{} candidates (threshold {})",
        scored.size(),
        documents.size(),
        options.threshold());
    return scored;
  }

  /** Fallback when the cross-encoder is unavailable: cosine similarity of embeddings. */
  @SuppressWarnings("unused")
  List<ScoredIndex> rerankFallback(
      String query, List<String> documents, RerankOptions options, Throwable t) {
    log.warn("Reranker unavailable, using embedding similarity: {}", t.getMessage());
    meterRegistry.counter("rerank.fallback").increment();
    return cosineRerank(query, documents, options);
  }

  List<ScoredIndex> cosineRerank(String query, List<String> documents, RerankOptions options) {
    List<Float> queryVector = embeddingService.embed(query);

    List<Integer> positions = new ArrayList<>();
    List<String> texts = new ArrayList<>();
    for (int i = 0; i < documents.size(); i++) {
      if (documents.get(i) != null && !documents.get(i).isBlank()) {
        positions.add(i);
        texts.add(documents.get(i));
      }
    }
    List<List<Float>> vectors = embeddingService.embedAll(texts);

    List<ScoredIndex> scored = new ArrayList<>();
    for (int i = 0; i < vectors.size(); i++) {
      double score = EmbeddingService.cosine(queryVector, vectors.get(i));
      if (score >= options.fallbackThreshold()) {
        scored.add(new ScoredIndex(positions.get(i), score));
      }
    }
    return scored.stream()
        .sorted(Comparator.comparingDouble(ScoredIndex::score).reversed())
        .limit(options.topN())
        .toList();
  }
}
