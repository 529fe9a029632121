package com.flamingo.ai.knowledgebase.service.rag.chunking;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import java.util.List;
import java.util.UUID;

/**
 * A chunk produced by the chunker, before it is persisted and embedded.
 *
 * @param id chunk id, reused as the vector-store key
 * @param parentId id of the enclosing parent draft, null for parents and standalone children
 * @param chunkIndex position within the document, dense from 0
 * @param type content kind
 * @param content Markdown content
 * @param tokenCount estimated tokens of {@code content}
 * @param pageNumbers sorted zero-based page indexes
 * @param parent true for context parents, which are stored but never embedded
 */
public record ChunkDraft(
    UUID id,
    UUID parentId,
    int chunkIndex,
    ChunkType type,
    String content,
    int tokenCount,
    List<Integer> pageNumbers,
    boolean parent) {

  public boolean isEmbeddable() {
    return !parent;
  }
}
