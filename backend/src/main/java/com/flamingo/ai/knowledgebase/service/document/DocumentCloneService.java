package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.exception.DocumentProcessingException;
import com.flamingo.ai.knowledgebase.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.knowledgebase.service.rag.indexing.ChunkIndexer;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fast path for content that is already processed in another collection: the source's active
 * chunks are copied under new ids and the copies are embedded for the target collection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentCloneService {

  private final ChunkRepository chunkRepository;
  private final DocumentRepository documentRepository;
  private final DocumentStatusService statusService;
  private final ChunkIndexer chunkIndexer;

  /**
   * Clones {@code source} into {@code target} and marks the target READY.
   *
   * @param source a READY document with the same content hash
   * @param target a freshly registered UPLOADED document
   * @return number of cloned chunks
   * @throws DocumentProcessingException if the source has no chunks or indexing fails
   */
  @Timed(value = "document.clone", description = "Time to clone a processed document")
  public int cloneInto(Document source, Document target) {
    List<Chunk> sourceChunks =
        chunkRepository.findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(source.getId());
    if (sourceChunks.isEmpty()) {
      throw new DocumentProcessingException(
          target.getId(), "Source document " + source.getId() + " has no active chunks");
    }

    List<ChunkDraft> drafts = remap(sourceChunks);
    chunkIndexer.index(target, drafts);

    statusService.recordParser(target.getId(), source.getParserEngine(), source.getParserVersion());
    if (source.getSummary() != null && !source.getSummary().isBlank()) {
      documentRepository.updateSummary(target.getId(), source.getSummary());
    }
    if (!statusService.markReady(target.getId(), drafts.size())) {
      throw new DocumentProcessingException(target.getId(), "Cloned document cannot enter READY");
    }
    log.info(
        "Cloned {} chunks from document {} into {}", drafts.size(), source.getId(), target.getId());
    return drafts.size();
  }

  /** Copies chunks under fresh ids, pointing children at the copies of their parents. */
  static List<ChunkDraft> remap(List<Chunk> sourceChunks) {
    Map<UUID, UUID> idMapping = new HashMap<>();
    for (Chunk chunk : sourceChunks) {
      idMapping.put(chunk.getId(), UUID.randomUUID());
    }
    List<ChunkDraft> drafts = new ArrayList<>(sourceChunks.size());
    for (Chunk chunk : sourceChunks) {
      UUID parentId =
          chunk.getParentChunkId() == null ? null : idMapping.get(chunk.getParentChunkId());
      drafts.add(
          new ChunkDraft(
              idMapping.get(chunk.getId()),
              parentId,
              chunk.getChunkIndex(),
              chunk.getChunkType(),
              chunk.getContent(),
              chunk.getTokenCount(),
              List.copyOf(chunk.getPageNumbers()),
              chunk.isParent()));
    }
    return drafts;
  }
}
