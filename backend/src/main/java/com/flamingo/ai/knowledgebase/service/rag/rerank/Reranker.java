package com.flamingo.ai.knowledgebase.service.rag.rerank;

import java.util.List;

/** Scores candidate passages against a query after fusion. */
public interface Reranker {

  /**
   * Scores {@code documents} against {@code query}, drops those below the pass mark and returns
   * the rest ordered by score.
   *
   * @param query the search query
   * @param documents candidate passages in fused order
   * @param options pass marks and result cap
   * @return passing candidates by original index, best first
   */
  List<ScoredIndex> rerank(String query, List<String> documents, RerankOptions options);

  /** A candidate position paired with its rerank score. */
  record ScoredIndex(int index, double score) {}

  /**
   * Per-call settings.
   *
   * @param topN maximum number of results
   * @param threshold pass mark for cross-encoder scores
   * @param fallbackThreshold pass mark for cosine scores when the cross-encoder is unavailable
   */
  record RerankOptions(int topN, double threshold, double fallbackThreshold) {}
}
