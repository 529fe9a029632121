package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import java.util.List;
import java.util.UUID;

/** Response DTO for a stored chunk. */
public record ChunkResponse(
    UUID id,
    UUID parentChunkId,
    int chunkIndex,
    ChunkType chunkType,
    String content,
    int tokenCount,
    List<Integer> pageNumbers,
    boolean parent,
    boolean active) {

  public static ChunkResponse fromEntity(Chunk chunk) {
    return new ChunkResponse(
        chunk.getId(),
        chunk.getParentChunkId(),
        chunk.getChunkIndex(),
        chunk.getChunkType(),
        chunk.getContent(),
        chunk.getTokenCount(),
        chunk.getPageNumbers(),
        chunk.isParent(),
        chunk.isActive());
  }
}
