package com.flamingo.ai.knowledgebase.service.rag.search;

import java.util.List;
import java.util.Map;

/** Hits plus per-stage candidate counts. */
public record SearchResult(
    String query, List<SearchHit> hits, int total, Map<String, Integer> pathStats) {

  static SearchResult empty(String query, Map<String, Integer> pathStats) {
    return new SearchResult(query, List.of(), 0, pathStats);
  }
}
