package com.flamingo.ai.knowledgebase.elasticsearch;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Vector-store view of an embeddable chunk. The relational chunk row stays the source of truth
 * for content; the index only keeps a preview.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkDocument implements AbstractElasticsearchIndexService.ScoredDocument {

  /** Same as the chunk id. */
  private String id;

  private UUID documentId;
  private String collectionId;
  private UUID parentChunkId;
  private int chunkIndex;
  private String chunkType;
  @Builder.Default private List<Integer> pageNumbers = List.of();
  private String contentPreview;

  /** Absent when the chunk has no embeddable text. */
  private List<Float> embedding;

  @Builder.Default private Map<String, Float> sparse = Map.of();

  // Relevance score from search results (set by search methods)
  @Builder.Default private Double relevanceScore = 0.0;

  public boolean hasParent() {
    return parentChunkId != null;
  }
}
