package com.flamingo.ai.knowledgebase.service.rag.search;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import java.util.List;
import java.util.UUID;

/**
 * One retrieved chunk.
 *
 * @param score rerank score when reranked, RRF score otherwise
 * @param rerankScore null when the hit was not reranked
 * @param sources recall paths that returned the chunk
 * @param parentContent content of the enclosing parent, if any
 */
public record SearchHit(
    UUID chunkId,
    UUID documentId,
    String content,
    ChunkType chunkType,
    List<Integer> pageNumbers,
    double score,
    double rrfScore,
    Double rerankScore,
    List<String> sources,
    String parentContent) {}
