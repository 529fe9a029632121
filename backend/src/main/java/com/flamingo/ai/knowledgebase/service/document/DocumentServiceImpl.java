package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkVectorIndexService;
import com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledgebase.exception.DocumentProcessingException;
import com.flamingo.ai.knowledgebase.exception.InvalidDocumentStateException;
import com.flamingo.ai.knowledgebase.exception.StorageException;
import com.flamingo.ai.knowledgebase.exception.UnsupportedFileTypeException;
import com.flamingo.ai.knowledgebase.service.rag.DocumentProcessingService;
import com.flamingo.ai.knowledgebase.service.rag.image.ImagePreprocessor;
import com.flamingo.ai.knowledgebase.service.rag.parsing.SupportedFileTypes;
import com.flamingo.ai.knowledgebase.service.storage.BlobStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

/**
 * Implementation of the DocumentService.
 *
 * <p>Methods here do not open a surrounding transaction: status changes commit on their own through
 * {@link DocumentStatusService}, and SQLite allows a single connection.
 */
@Service
@Slf4j
public class DocumentServiceImpl implements DocumentService {

  static final String BLOB_PREFIX = "rag";

  private final DocumentRepository documentRepository;
  private final ChunkRepository chunkRepository;
  private final DocumentStatusService statusService;
  private final DocumentProcessingService documentProcessingService;
  private final ChunkVectorIndexService chunkVectorIndexService;
  private final BlobStore blobStore;
  private final MeterRegistry meterRegistry;
  private final TransactionTemplate transactionTemplate;

  public DocumentServiceImpl(
      DocumentRepository documentRepository,
      ChunkRepository chunkRepository,
      DocumentStatusService statusService,
      DocumentProcessingService documentProcessingService,
      ChunkVectorIndexService chunkVectorIndexService,
      BlobStore blobStore,
      MeterRegistry meterRegistry,
      PlatformTransactionManager transactionManager) {
    this.documentRepository = documentRepository;
    this.chunkRepository = chunkRepository;
    this.statusService = statusService;
    this.documentProcessingService = documentProcessingService;
    this.chunkVectorIndexService = chunkVectorIndexService;
    this.blobStore = blobStore;
    this.meterRegistry = meterRegistry;
    this.transactionTemplate = new TransactionTemplate(transactionManager);
  }

  @Override
  @Timed(value = "document.upload", description = "Time to register a document")
  public Registration register(String collectionId, MultipartFile file) {
    String fileName = validateFile(file);
    byte[] bytes = readBytes(file);
    String contentHash = DigestUtils.sha256Hex(bytes);
    log.info("Registering document {} in collection {}", fileName, collectionId);

    Optional<Document> existing =
        documentRepository.findByCollectionIdAndContentHash(collectionId, contentHash);
    if (existing.isPresent()) {
      return deduplicated(existing.get());
    }

    Document saved;
    try {
      saved =
          documentRepository.save(
              Document.builder()
                  .collectionId(collectionId)
                  .fileName(fileName)
                  .contentHash(contentHash)
                  .byteSize((long) bytes.length)
                  .mimeType(SupportedFileTypes.mimeTypeOf(fileName))
                  .build());
    } catch (DataIntegrityViolationException e) {
      // Concurrent upload of the same content won the unique constraint.
      return documentRepository
          .findByCollectionIdAndContentHash(collectionId, contentHash)
          .map(this::deduplicated)
          .orElseThrow(() -> e);
    }

    saved.setStoragePath(blobPrefix(saved) + fileName);
    try {
      blobStore.put(saved.getStoragePath(), bytes, saved.getMimeType());
    } catch (StorageException e) {
      documentRepository.delete(saved);
      throw e;
    }
    saved = documentRepository.save(saved);
    meterRegistry
        .counter("documents.uploaded", "type", SupportedFileTypes.extensionOf(fileName))
        .increment();
    log.info("Document {} registered with ID: {}", fileName, saved.getId());

    UUID documentId = saved.getId();
    Optional<Document> source =
        documentRepository.findFirstByContentHashAndStatusOrderByCreatedAtAsc(
            contentHash, DocumentStatus.READY);
    if (source.isPresent()) {
      UUID sourceId = source.get().getId();
      log.info("Content of document {} already processed as {}", documentId, sourceId);
      afterCommit(() -> documentProcessingService.cloneDocumentAsync(sourceId, documentId));
    } else {
      enqueue(documentId, false);
    }
    return new Registration(saved, false);
  }

  private Registration deduplicated(Document document) {
    log.info("Document {} already registered in collection", document.getId());
    meterRegistry.counter("documents.deduplicated").increment();
    return new Registration(document, true);
  }

  @Override
  @Timed(value = "document.process", description = "Time to request document processing")
  public Document process(UUID documentId) {
    Document document = getDocument(documentId);
    DocumentStatus status = document.getStatus();
    if (status == DocumentStatus.UPLOADED || status == DocumentStatus.FAILED) {
      enqueue(documentId, false);
    } else {
      log.debug("Document {} is {}, nothing to process", documentId, status);
    }
    return document;
  }

  @Override
  @Timed(value = "document.reparse", description = "Time to request a reparse")
  public Document reparse(UUID documentId) {
    Document document = getDocument(documentId);
    if (document.getStatus().isRunning()) {
      throw new InvalidDocumentStateException(documentId, document.getStatus(), "reparse");
    }

    chunkVectorIndexService.deleteByDocumentId(documentId);
    Integer retired =
        transactionTemplate.execute(status -> chunkRepository.deactivateByDocumentId(documentId));
    if (!statusService.transition(
        documentId,
        DocumentStatus.UPLOADED,
        EnumSet.of(DocumentStatus.UPLOADED, DocumentStatus.READY, DocumentStatus.FAILED))) {
      DocumentStatus current = getDocument(documentId).getStatus();
      throw new InvalidDocumentStateException(documentId, current, "reparse");
    }
    log.info("Document {} reset for reparse ({} chunks retired)", documentId, retired);

    enqueue(documentId, true);
    return getDocument(documentId);
  }

  @Override
  public Document getDocument(UUID documentId) {
    return documentRepository
        .findById(documentId)
        .orElseThrow(() -> new DocumentNotFoundException(documentId));
  }

  @Override
  public List<Document> getDocumentsByCollection(String collectionId) {
    return documentRepository.findByCollectionIdOrderByCreatedAtDesc(collectionId);
  }

  @Override
  public List<Chunk> getChunks(UUID documentId, boolean activeOnly) {
    getDocument(documentId);
    return activeOnly
        ? chunkRepository.findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(documentId)
        : chunkRepository.findByDocumentIdOrderByChunkIndexAsc(documentId);
  }

  @Override
  @Timed(value = "document.delete", description = "Time to delete a document")
  public void deleteDocument(UUID documentId) {
    Document document = getDocument(documentId);

    chunkVectorIndexService.deleteByDocumentId(documentId);
    transactionTemplate.executeWithoutResult(
        status -> {
          chunkRepository.deleteByDocumentId(documentId);
          documentRepository.deleteById(documentId);
        });
    deleteBlobs(blobPrefix(document));
    deleteBlobs(ImagePreprocessor.imagePrefix(document));

    meterRegistry.counter("documents.deleted").increment();
    log.info("Deleted document: {}", documentId);
  }

  private void deleteBlobs(String prefix) {
    try {
      int deleted = blobStore.deletePrefix(prefix);
      log.debug("Deleted {} objects under {}", deleted, prefix);
    } catch (StorageException e) {
      log.warn("Could not delete objects under {}: {}", prefix, e.getMessage());
    }
  }

  private void enqueue(UUID documentId, boolean recaption) {
    afterCommit(() -> documentProcessingService.processDocumentAsync(documentId, recaption));
  }

  /** Runs {@code task} once the caller's transaction, if any, has committed. */
  private void afterCommit(Runnable task) {
    if (TransactionSynchronizationManager.isSynchronizationActive()) {
      TransactionSynchronizationManager.registerSynchronization(
          new TransactionSynchronization() {
            @Override
            public void afterCommit() {
              log.debug("Transaction committed, handing off background work");
              task.run();
            }
          });
    } else {
      task.run();
    }
  }

  static String blobPrefix(Document document) {
    return String.format("%s/%s/%s/", BLOB_PREFIX, document.getCollectionId(), document.getId());
  }

  private String validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }
    String original = file.getOriginalFilename();
    String fileName =
        original == null ? null : StringUtils.getFilename(StringUtils.cleanPath(original));
    if (fileName == null || fileName.isBlank()) {
      throw new IllegalArgumentException("File name is missing");
    }
    if (!SupportedFileTypes.isSupported(fileName)) {
      throw new UnsupportedFileTypeException(
          fileName, "Unsupported file type: " + SupportedFileTypes.extensionOf(fileName));
    }
    return fileName;
  }

  private static byte[] readBytes(MultipartFile file) {
    try {
      return file.getBytes();
    } catch (IOException e) {
      throw new DocumentProcessingException(null, "Failed to read file content", e);
    }
  }
}
