package com.flamingo.ai.knowledgebase.service.rag.search;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.Builder;

/**
 * A retrieval request scoped to one collection.
 *
 * <p>{@code documentIds == null} searches the whole collection; an empty list searches nothing.
 * Nullable toggles and thresholds fall back to the configured defaults.
 */
@Builder
public record SearchQuery(
    String collectionId,
    String query,
    List<UUID> documentIds,
    Integer topK,
    Boolean enableRerank,
    Set<ChunkType> chunkTypes,
    Boolean enableExact,
    Boolean enableSparse,
    Boolean enableDense,
    Double rerankThreshold,
    Double fallbackThreshold) {

  /** True when the caller explicitly selected no documents. */
  public boolean selectsNothing() {
    return documentIds != null && documentIds.isEmpty();
  }

  boolean exactEnabled() {
    return enableExact == null || enableExact;
  }

  boolean sparseEnabled() {
    return enableSparse == null || enableSparse;
  }

  boolean denseEnabled() {
    return enableDense == null || enableDense;
  }
}
