package com.flamingo.ai.knowledgebase.service.rag.embedding;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Term-id to weight map used for lexical recall. Keys are decimal term ids, stored in the vector
 * index as {@code rank_features}.
 *
 * @param weights positive weights by term id
 */
public record SparseVector(Map<String, Float> weights) {

  static final String EMPTY_TERM = "__empty__";
  static final float EMPTY_WEIGHT = 0.01f;

  public SparseVector {
    weights = Map.copyOf(weights);
  }

  /** Placeholder vector for text without any term. */
  public static SparseVector empty() {
    return new SparseVector(Map.of(SparseEmbeddingService.termId(EMPTY_TERM), EMPTY_WEIGHT));
  }

  /** Keeps the {@code maxTerms} heaviest terms; falls back to {@link #empty()} when none remain. */
  static SparseVector topTerms(Map<String, Float> weights, int maxTerms) {
    Map<String, Float> kept = new LinkedHashMap<>();
    weights.entrySet().stream()
        .filter(e -> e.getValue() != null && e.getValue() > 0)
        .sorted(Map.Entry.<String, Float>comparingByValue(Comparator.reverseOrder()))
        .limit(maxTerms)
        .forEach(e -> kept.put(e.getKey(), e.getValue()));
    return kept.isEmpty() ? empty() : new SparseVector(kept);
  }
}
