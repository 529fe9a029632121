package com.flamingo.ai.knowledgebase.service.rag;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.exception.DocumentProcessingException;
import com.flamingo.ai.knowledgebase.service.document.DocumentCloneService;
import com.flamingo.ai.knowledgebase.service.document.DocumentStatusService;
import com.flamingo.ai.knowledgebase.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.knowledgebase.service.rag.chunking.LayoutAwareChunker;
import com.flamingo.ai.knowledgebase.service.rag.image.ImagePreprocessor;
import com.flamingo.ai.knowledgebase.service.rag.indexing.ChunkIndexer;
import com.flamingo.ai.knowledgebase.service.rag.parsing.Block;
import com.flamingo.ai.knowledgebase.service.rag.parsing.DocumentParserChain;
import com.flamingo.ai.knowledgebase.service.rag.parsing.ParseResult;
import com.flamingo.ai.knowledgebase.service.rag.parsing.ParsingContext;
import com.flamingo.ai.knowledgebase.service.storage.BlobStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs the ingestion pipeline for one document: parse, preprocess images, chunk, index.
 *
 * <p>The document is claimed with a guarded UPLOADED|FAILED to PARSING update, so a document is
 * processed by at most one worker. Any failure marks the document FAILED with the error message;
 * nothing is thrown to the caller.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentProcessingService {

  private static final Set<DocumentStatus> CLAIMABLE =
      EnumSet.of(DocumentStatus.UPLOADED, DocumentStatus.FAILED);

  /** States in which a pipeline worker owns the document. */
  private static final Set<DocumentStatus> CLAIMED =
      EnumSet.of(DocumentStatus.PARSING, DocumentStatus.PARSED, DocumentStatus.READY);

  private final DocumentRepository documentRepository;
  private final DocumentStatusService statusService;
  private final BlobStore blobStore;
  private final DocumentParserChain parserChain;
  private final ImagePreprocessor imagePreprocessor;
  private final LayoutAwareChunker chunker;
  private final ChunkIndexer chunkIndexer;
  private final DocumentCloneService cloneService;
  private final MeterRegistry meterRegistry;

  /**
   * Processes a document in the background.
   *
   * @param documentId the document to process
   * @param recaption describe images again even if the parser already captioned them
   */
  @Async("documentProcessingExecutor")
  @Timed(value = "document.process", description = "Time to process document")
  public void processDocumentAsync(UUID documentId, boolean recaption) {
    if (!statusService.transition(documentId, DocumentStatus.PARSING, CLAIMABLE)) {
      log.info("Document {} is not claimable, skipping", documentId);
      return;
    }
    try {
      int chunkCount = runPipeline(documentId, recaption);
      meterRegistry.counter("document.processing.success").increment();
      log.info("Successfully processed document {} into {} chunks", documentId, chunkCount);
    } catch (Exception e) {
      log.error("Failed to process document {}", documentId, e);
      meterRegistry.counter("document.processing.failure").increment();
      try {
        statusService.markFailed(documentId, describe(e));
      } catch (Exception statusError) {
        log.error(
            "Failed to mark document {} as failed: {}", documentId, statusError.getMessage());
      }
    }
  }

  /**
   * Copies the chunks of an already processed document with the same content, falling back to
   * the full pipeline when the copy fails.
   *
   * @param sourceId a READY document with the same content hash
   * @param targetId the freshly registered document
   */
  @Async("documentProcessingExecutor")
  @Timed(value = "document.fast_path", description = "Time to clone or process a duplicate")
  public void cloneDocumentAsync(UUID sourceId, UUID targetId) {
    String error;
    try {
      Document source = load(sourceId);
      Document target = load(targetId);
      cloneService.cloneInto(source, target);
      meterRegistry.counter("documents.fast_path").increment();
      return;
    } catch (Exception e) {
      error = describe(e);
      log.warn(
          "Fast path from {} failed for document {}, parsing instead: {}",
          sourceId,
          targetId,
          error);
      meterRegistry.counter("documents.fast_path.failure").increment();
    }

    DocumentStatus current =
        documentRepository.findById(targetId).map(Document::getStatus).orElse(null);
    if (current == null || CLAIMED.contains(current)) {
      log.info("Document {} is {}, leaving it to its current owner", targetId, current);
      return;
    }
    try {
      statusService.markFailed(targetId, "Fast path failed: " + error);
    } catch (Exception statusError) {
      log.error("Failed to mark document {} as failed: {}", targetId, statusError.getMessage());
    }
    processDocumentAsync(targetId, false);
  }

  private Document load(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentProcessingException(documentId, "Document not found"));
  }

  int runPipeline(UUID documentId, boolean recaption) {
    Document document = load(documentId);

    byte[] bytes = blobStore.get(document.getStoragePath());
    ParseResult result =
        parserChain.parse(
            new ParsingContext(
                documentId, document.getFileName(), document.getStoragePath(), bytes));
    statusService.recordParser(documentId, result.engine(), result.engineVersion());
    requireTransition(documentId, DocumentStatus.PARSED);

    List<Block> blocks =
        imagePreprocessor.preprocess(new ArrayList<>(result.blocks()), document, recaption);
    List<ChunkDraft> drafts = chunker.chunk(blocks, result.markdown());
    if (drafts.isEmpty()) {
      throw new DocumentProcessingException(documentId, "No content extracted from document");
    }
    log.info("Document {} split into {} chunks", documentId, drafts.size());

    List<Chunk> chunks = chunkIndexer.index(document, drafts);
    if (!statusService.markReady(documentId, chunks.size())) {
      throw new DocumentProcessingException(documentId, "Document cannot enter READY");
    }
    return chunks.size();
  }

  private void requireTransition(UUID documentId, DocumentStatus target) {
    if (!statusService.transition(documentId, target)) {
      throw new DocumentProcessingException(documentId, "Document cannot enter " + target);
    }
  }

  private static String describe(Exception e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }
}
