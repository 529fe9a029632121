package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.service.rag.search.SearchHit;
import com.flamingo.ai.knowledgebase.service.rag.search.SearchResult;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Search results with per-stage candidate counts. */
public record SearchResponse(
    String query, List<HitResponse> hits, int total, Map<String, Integer> pathStats) {

  /** One search hit. */
  public record HitResponse(
      UUID chunkId,
      UUID documentId,
      String content,
      ChunkType chunkType,
      List<Integer> pageNumbers,
      double score,
      double rrfScore,
      Double rerankScore,
      List<String> sources,
      String parentContent) {

    static HitResponse from(SearchHit hit) {
      return new HitResponse(
          hit.chunkId(),
          hit.documentId(),
          hit.content(),
          hit.chunkType(),
          hit.pageNumbers(),
          hit.score(),
          hit.rrfScore(),
          hit.rerankScore(),
          hit.sources(),
          hit.parentContent());
    }
  }

  public static SearchResponse from(SearchResult result) {
    return new SearchResponse(
        result.query(),
        result.hits().stream().map(HitResponse::from).toList(),
        result.total(),
        result.pathStats());
  }
}
