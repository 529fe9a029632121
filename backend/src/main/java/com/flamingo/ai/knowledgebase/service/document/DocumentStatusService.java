package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Single writer of document status. Every change is one guarded row update committed in its own
 * transaction, so a status is visible to other threads as soon as this returns. SQLite lock
 * contention is retried.
 */
@Service
@Slf4j
public class DocumentStatusService {

  static final int MAX_ERROR_LOG_CHARS = 4000;
  private static final int MAX_RETRIES = 3;
  private static final long RETRY_DELAY_MS = 100;

  private final DocumentRepository documentRepository;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate requiresNew;

  public DocumentStatusService(
      DocumentRepository documentRepository,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.documentRepository = documentRepository;
    this.meterRegistry = meterRegistry;
    this.requiresNew = new TransactionTemplate(transactionManager);
    this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
  }

  /**
   * Moves a document to {@code target} from any status the transition table allows.
   *
   * @return true if the row was updated; false if the current status does not allow it
   */
  public boolean transition(UUID documentId, DocumentStatus target) {
    return transition(documentId, target, DocumentStatus.predecessorsOf(target));
  }

  /**
   * Moves a document to {@code target} only from one of {@code allowedFrom}.
   *
   * @return true if the row was updated
   */
  public boolean transition(
      UUID documentId, DocumentStatus target, Collection<DocumentStatus> allowedFrom) {
    boolean updated =
        withRetry(
            documentId,
            () -> documentRepository.updateStatusIfIn(documentId, target, allowedFrom) == 1);
    if (updated) {
      log.info("Document {} -> {}", documentId, target);
    } else {
      log.warn(
          "Rejected transition of document {} to {} (current: {})",
          documentId,
          target,
          currentStatus(documentId));
    }
    return updated;
  }

  /** Moves an EMBEDDING document to READY and records its chunk count. */
  public boolean markReady(UUID documentId, int chunkCount) {
    boolean updated =
        withRetry(
            documentId,
            () ->
                documentRepository.completeIfIn(
                        documentId,
                        DocumentStatus.READY,
                        chunkCount,
                        Set.of(DocumentStatus.EMBEDDING))
                    == 1);
    if (updated) {
      log.info("Document {} -> READY ({} chunks)", documentId, chunkCount);
    } else {
      log.warn(
          "Document {} could not be marked READY (current: {})",
          documentId,
          currentStatus(documentId));
    }
    return updated;
  }

  /** Marks a document FAILED with a truncated error log. A READY document is left alone. */
  public void markFailed(UUID documentId, String error) {
    String errorLog = truncate(error == null ? "Unknown error" : error);
    boolean updated =
        withRetry(documentId, () -> documentRepository.markFailed(documentId, errorLog) == 1);
    if (updated) {
      meterRegistry.counter("documents.failed").increment();
      log.error("Document {} -> FAILED: {}", documentId, errorLog);
    }
  }

  /** Records which parser backend produced the blocks. */
  public void recordParser(UUID documentId, String engine, String version) {
    withRetry(
        documentId,
        () -> {
          Document document = documentRepository.findById(documentId).orElse(null);
          if (document == null) {
            return false;
          }
          document.setParserEngine(engine);
          document.setParserVersion(version);
          documentRepository.save(document);
          return true;
        });
  }

  private DocumentStatus currentStatus(UUID documentId) {
    return documentRepository.findById(documentId).map(Document::getStatus).orElse(null);
  }

  static String truncate(String error) {
    return error.length() <= MAX_ERROR_LOG_CHARS ? error : error.substring(0, MAX_ERROR_LOG_CHARS);
  }

  private boolean withRetry(UUID documentId, Supplier<Boolean> update) {
    for (int attempt = 1; ; attempt++) {
      try {
        return Boolean.TRUE.equals(requiresNew.execute(status -> update.get()));
      } catch (CannotAcquireLockException e) {
        if (attempt == MAX_RETRIES) {
          log.error("Failed to update document {} after {} retries", documentId, MAX_RETRIES);
          throw e;
        }
        log.warn(
            "SQLite lock contention on document {}, retry {}/{}", documentId, attempt, MAX_RETRIES);
        try {
          Thread.sleep(RETRY_DELAY_MS * attempt);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          throw e;
        }
      }
    }
  }
}
