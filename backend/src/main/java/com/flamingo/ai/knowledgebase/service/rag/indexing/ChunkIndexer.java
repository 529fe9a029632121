package com.flamingo.ai.knowledgebase.service.rag.indexing;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkDocument;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkVectorIndexService;
import com.flamingo.ai.knowledgebase.exception.DocumentProcessingException;
import com.flamingo.ai.knowledgebase.service.document.DocumentStatusService;
import com.flamingo.ai.knowledgebase.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.knowledgebase.service.rag.embedding.EmbeddingContent;
import com.flamingo.ai.knowledgebase.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgebase.service.rag.embedding.SparseEmbeddingService;
import com.flamingo.ai.knowledgebase.service.rag.embedding.SparseVector;
import com.google.common.collect.Lists;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Persists a document's chunk set and writes one vector-store entry per embeddable chunk.
 *
 * <p>The previous active set is retired and the new set inserted in one transaction. Vectors are
 * then computed and upserted; if any chunk fails, vectors already written for the document are
 * removed and a {@link DocumentProcessingException} naming the chunk is thrown.
 */
@Service
@Slf4j
public class ChunkIndexer {

  static final int BULK_SIZE = 200;

  private final ChunkRepository chunkRepository;
  private final DocumentStatusService statusService;
  private final EmbeddingService embeddingService;
  private final SparseEmbeddingService sparseEmbeddingService;
  private final ChunkVectorIndexService chunkVectorIndexService;
  private final Executor embeddingExecutor;
  private final RagConfig ragConfig;
  private final TransactionTemplate transactionTemplate;

  public ChunkIndexer(
      ChunkRepository chunkRepository,
      DocumentStatusService statusService,
      EmbeddingService embeddingService,
      SparseEmbeddingService sparseEmbeddingService,
      ChunkVectorIndexService chunkVectorIndexService,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      RagConfig ragConfig,
      PlatformTransactionManager transactionManager) {
    this.chunkRepository = chunkRepository;
    this.statusService = statusService;
    this.embeddingService = embeddingService;
    this.sparseEmbeddingService = sparseEmbeddingService;
    this.chunkVectorIndexService = chunkVectorIndexService;
    this.embeddingExecutor = embeddingExecutor;
    this.ragConfig = ragConfig;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  /**
   * Replaces the document's active chunks with {@code drafts}, moves it to EMBEDDING and indexes
   * every embeddable chunk. The caller marks the document READY.
   *
   * @param document the document being indexed
   * @param drafts chunk drafts in index order
   * @return the persisted chunks
   * @throws DocumentProcessingException if the status guard rejects EMBEDDING or any chunk fails
   */
  @Timed(value = "rag.index", description = "Time to persist, embed and index a chunk set")
  public List<Chunk> index(Document document, List<ChunkDraft> drafts) {
    UUID documentId = document.getId();
    List<Chunk> chunks = drafts.stream().map(d -> toEntity(document, d)).toList();
    replaceChunks(documentId, chunks);
    log.info("Document {}: persisted {} chunks", documentId, chunks.size());

    if (!statusService.transition(documentId, DocumentStatus.EMBEDDING)) {
      throw new DocumentProcessingException(documentId, "Document cannot enter EMBEDDING");
    }

    try {
      indexVectors(document, chunks);
    } catch (DocumentProcessingException e) {
      removePartialVectors(documentId);
      throw e;
    }
    return chunks;
  }

  /** Retires the active set and inserts the new one atomically. */
  void replaceChunks(UUID documentId, List<Chunk> chunks) {
    transactionTemplate.executeWithoutResult(
        status -> {
          int retired = chunkRepository.deactivateByDocumentId(documentId);
          if (retired > 0) {
            log.debug("Document {}: deactivated {} previous chunks", documentId, retired);
          }
          chunkRepository.saveAll(chunks);
        });
  }

  private void indexVectors(Document document, List<Chunk> chunks) {
    UUID documentId = document.getId();
    List<Chunk> embeddable = chunks.stream().filter(Chunk::isEmbeddable).toList();
    if (embeddable.isEmpty()) {
      return;
    }
    int maxTokens = ragConfig.getEmbedding().getMaxEmbeddingTokens();
    List<String> texts =
        embeddable.stream()
            .map(c -> EmbeddingContent.select(c.getChunkType(), c.getContent(), maxTokens))
            .toList();

    List<SparseVector> sparse;
    try {
      sparse = sparseEmbeddingService.encode(texts);
    } catch (RuntimeException e) {
      throw new DocumentProcessingException(
          documentId, "Sparse encoding failed for chunk batch: " + e.getMessage(), e);
    }

    List<CompletableFuture<List<Float>>> dense = new ArrayList<>(embeddable.size());
    for (int i = 0; i < embeddable.size(); i++) {
      String text = texts.get(i);
      if (text.isEmpty()) {
        dense.add(CompletableFuture.completedFuture(null));
      } else {
        try {
          dense.add(
              CompletableFuture.supplyAsync(() -> embeddingService.embed(text), embeddingExecutor));
        } catch (RejectedExecutionException e) {
          // Cancelled futures skip their supplier once a worker dequeues them.
          dense.forEach(f -> f.cancel(true));
          throw new DocumentProcessingException(
              documentId,
              "Dense embedding rejected for chunk " + embeddable.get(i).getId() + ": "
                  + e.getMessage(),
              e);
        }
      }
    }

    List<ChunkDocument> documents = new ArrayList<>(embeddable.size());
    for (int i = 0; i < embeddable.size(); i++) {
      Chunk chunk = embeddable.get(i);
      List<Float> vector;
      try {
        vector = dense.get(i).join();
      } catch (CompletionException e) {
        dense.forEach(f -> f.cancel(true));
        Throwable cause = e.getCause() != null ? e.getCause() : e;
        throw new DocumentProcessingException(
            documentId,
            "Dense embedding failed for chunk " + chunk.getId() + ": " + cause.getMessage(),
            cause);
      }
      documents.add(toDocument(chunk, vector, sparse.get(i)));
    }

    for (List<ChunkDocument> batch : Lists.partition(documents, BULK_SIZE)) {
      try {
        chunkVectorIndexService.indexDocuments(batch);
      } catch (RuntimeException e) {
        throw new DocumentProcessingException(
            documentId,
            "Vector upsert failed for chunk " + batch.get(0).getId() + ": " + e.getMessage(),
            e);
      }
    }
    log.info(
        "Document {}: indexed {} vectors ({} without dense embedding)",
        documentId,
        documents.size(),
        documents.stream().filter(d -> d.getEmbedding() == null).count());
  }

  private void removePartialVectors(UUID documentId) {
    try {
      chunkVectorIndexService.deleteByDocumentId(documentId);
    } catch (RuntimeException e) {
      log.warn("Could not remove partial vectors of document {}: {}", documentId, e.getMessage());
    }
  }

  private static Chunk toEntity(Document document, ChunkDraft draft) {
    return Chunk.builder()
        .id(draft.id())
        .documentId(document.getId())
        .collectionId(document.getCollectionId())
        .parentChunkId(draft.parentId())
        .chunkIndex(draft.chunkIndex())
        .pageNumbers(new ArrayList<>(draft.pageNumbers()))
        .chunkType(draft.type())
        .content(draft.content())
        .tokenCount(draft.tokenCount())
        .parent(draft.parent())
        .active(true)
        .build();
  }

  static ChunkDocument toDocument(Chunk chunk, List<Float> embedding, SparseVector sparse) {
    return ChunkDocument.builder()
        .id(chunk.getId().toString())
        .documentId(chunk.getDocumentId())
        .collectionId(chunk.getCollectionId())
        .parentChunkId(chunk.getParentChunkId())
        .chunkIndex(chunk.getChunkIndex())
        .chunkType(chunk.getChunkType().name())
        .pageNumbers(chunk.getPageNumbers())
        .contentPreview(chunk.getContent())
        .embedding(embedding)
        .sparse(sparse.weights())
        .build();
  }
}
