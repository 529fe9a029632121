package com.flamingo.ai.knowledgebase.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkVectorIndexService;
import com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledgebase.exception.InvalidDocumentStateException;
import com.flamingo.ai.knowledgebase.exception.StorageException;
import com.flamingo.ai.knowledgebase.exception.UnsupportedFileTypeException;
import com.flamingo.ai.knowledgebase.service.rag.DocumentProcessingService;
import com.flamingo.ai.knowledgebase.service.storage.BlobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.transaction.PlatformTransactionManager;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentServiceImpl Tests")
class DocumentServiceImplTest {

  private static final String COLLECTION = "col-1";
  private static final byte[] CONTENT = "quarterly report".getBytes(StandardCharsets.UTF_8);
  private static final String HASH = DigestUtils.sha256Hex(CONTENT);

  @Mock private DocumentRepository documentRepository;
  @Mock private ChunkRepository chunkRepository;
  @Mock private DocumentStatusService statusService;
  @Mock private DocumentProcessingService documentProcessingService;
  @Mock private ChunkVectorIndexService chunkVectorIndexService;
  @Mock private BlobStore blobStore;
  @Mock private PlatformTransactionManager transactionManager;

  private SimpleMeterRegistry meterRegistry;
  private DocumentServiceImpl documentService;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    documentService =
        new DocumentServiceImpl(
            documentRepository,
            chunkRepository,
            statusService,
            documentProcessingService,
            chunkVectorIndexService,
            blobStore,
            meterRegistry,
            transactionManager);

    when(documentRepository.save(any(Document.class)))
        .thenAnswer(
            inv -> {
              Document d = inv.getArgument(0);
              if (d.getId() == null) {
                d.setId(UUID.randomUUID());
              }
              return d;
            });
    when(documentRepository.findByCollectionIdAndContentHash(anyString(), anyString()))
        .thenReturn(Optional.empty());
    when(documentRepository.findFirstByContentHashAndStatusOrderByCreatedAtAsc(
            anyString(), eq(DocumentStatus.READY)))
        .thenReturn(Optional.empty());
  }

  private static MockMultipartFile pdf() {
    return new MockMultipartFile("file", "report.pdf", "application/pdf", CONTENT);
  }

  private static Document document(DocumentStatus status) {
    return Document.builder()
        .id(UUID.randomUUID())
        .collectionId(COLLECTION)
        .fileName("report.pdf")
        .contentHash(HASH)
        .status(status)
        .build();
  }

  @Nested
  @DisplayName("register")
  class Register {

    @Test
    @DisplayName("Should store the file and start processing")
    void shouldStoreFileAndStartProcessing() {
      // When
      DocumentService.Registration registration = documentService.register(COLLECTION, pdf());

      // Then
      Document document = registration.document();
      assertThat(registration.deduplicated()).isFalse();
      assertThat(document.getContentHash()).isEqualTo(HASH);
      assertThat(document.getByteSize()).isEqualTo(CONTENT.length);
      assertThat(document.getStoragePath())
          .isEqualTo("rag/" + COLLECTION + "/" + document.getId() + "/report.pdf");
      verify(blobStore).put(eq(document.getStoragePath()), eq(CONTENT), anyString());
      verify(documentProcessingService).processDocumentAsync(document.getId(), false);
      assertThat(meterRegistry.counter("documents.uploaded", "type", "pdf").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should return the existing document for duplicate content")
    void shouldReturnExistingForDuplicate() {
      Document existing = document(DocumentStatus.READY);
      when(documentRepository.findByCollectionIdAndContentHash(COLLECTION, HASH))
          .thenReturn(Optional.of(existing));

      DocumentService.Registration registration = documentService.register(COLLECTION, pdf());

      assertThat(registration.deduplicated()).isTrue();
      assertThat(registration.document()).isSameAs(existing);
      verify(documentRepository, never()).save(any());
      verify(blobStore, never()).put(anyString(), any(), anyString());
      verify(documentProcessingService, never()).processDocumentAsync(any(), anyBoolean());
    }

    @Test
    @DisplayName("Should hand a processed copy to the background clone instead of parsing")
    void shouldHandOffCloneOfProcessedCopy() {
      Document source = document(DocumentStatus.READY);
      when(documentRepository.findFirstByContentHashAndStatusOrderByCreatedAtAsc(
              HASH, DocumentStatus.READY))
          .thenReturn(Optional.of(source));

      DocumentService.Registration registration = documentService.register("col-2", pdf());

      UUID id = registration.document().getId();
      assertThat(registration.deduplicated()).isFalse();
      assertThat(registration.document().getStatus()).isEqualTo(DocumentStatus.UPLOADED);
      verify(documentProcessingService).cloneDocumentAsync(source.getId(), id);
      verify(documentProcessingService, never()).processDocumentAsync(any(), anyBoolean());
      verify(statusService, never()).markReady(any(), anyInt());
    }

    @Test
    @DisplayName("Should reject unsupported file types")
    void shouldRejectUnsupportedTypes() {
      MockMultipartFile exe =
          new MockMultipartFile("file", "setup.exe", "application/octet-stream", CONTENT);

      assertThatThrownBy(() -> documentService.register(COLLECTION, exe))
          .isInstanceOf(UnsupportedFileTypeException.class);
      verify(documentRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should reject empty files")
    void shouldRejectEmptyFiles() {
      MockMultipartFile empty =
          new MockMultipartFile("file", "report.pdf", "application/pdf", new byte[0]);

      assertThatThrownBy(() -> documentService.register(COLLECTION, empty))
          .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should remove the row when the blob store rejects the file")
    void shouldRemoveRowWhenStorageFails() {
      doThrow(new StorageException("key", "bucket missing", null))
          .when(blobStore)
          .put(anyString(), any(), anyString());

      assertThatThrownBy(() -> documentService.register(COLLECTION, pdf()))
          .isInstanceOf(StorageException.class);
      verify(documentRepository).delete(any(Document.class));
      verify(documentProcessingService, never()).processDocumentAsync(any(), anyBoolean());
    }
  }

  @Nested
  @DisplayName("process and reparse")
  class ProcessAndReparse {

    @Test
    @DisplayName("Should not enqueue a document that is already ready")
    void shouldNotEnqueueReadyDocument() {
      Document ready = document(DocumentStatus.READY);
      when(documentRepository.findById(ready.getId())).thenReturn(Optional.of(ready));

      documentService.process(ready.getId());

      verify(documentProcessingService, never()).processDocumentAsync(any(), anyBoolean());
    }

    @Test
    @DisplayName("Should enqueue a failed document")
    void shouldEnqueueFailedDocument() {
      Document failed = document(DocumentStatus.FAILED);
      when(documentRepository.findById(failed.getId())).thenReturn(Optional.of(failed));

      documentService.process(failed.getId());

      verify(documentProcessingService).processDocumentAsync(failed.getId(), false);
    }

    @Test
    @DisplayName("Should refuse to reparse a running document")
    void shouldRefuseReparseWhileRunning() {
      Document running = document(DocumentStatus.EMBEDDING);
      when(documentRepository.findById(running.getId())).thenReturn(Optional.of(running));

      assertThatThrownBy(() -> documentService.reparse(running.getId()))
          .isInstanceOf(InvalidDocumentStateException.class);
      verify(chunkVectorIndexService, never()).deleteByDocumentId(any());
      verify(chunkRepository, never()).deactivateByDocumentId(any());
    }

    @Test
    @DisplayName("Should retire old chunks and reprocess with fresh captions")
    void shouldResetAndReprocess() {
      Document ready = document(DocumentStatus.READY);
      UUID id = ready.getId();
      when(documentRepository.findById(id)).thenReturn(Optional.of(ready));
      when(statusService.transition(eq(id), eq(DocumentStatus.UPLOADED), any()))
          .thenReturn(true);

      documentService.reparse(id);

      verify(chunkVectorIndexService).deleteByDocumentId(id);
      verify(chunkRepository).deactivateByDocumentId(id);
      verify(documentProcessingService).processDocumentAsync(id, true);
    }

    @Test
    @DisplayName("Should throw for unknown documents")
    void shouldThrowForUnknownDocument() {
      UUID id = UUID.randomUUID();
      when(documentRepository.findById(id)).thenReturn(Optional.empty());

      assertThatThrownBy(() -> documentService.reparse(id))
          .isInstanceOf(DocumentNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("deleteDocument")
  class Delete {

    @Test
    @DisplayName("Should remove vectors, rows and stored objects")
    void shouldRemoveEverything() {
      Document ready = document(DocumentStatus.READY);
      UUID id = ready.getId();
      when(documentRepository.findById(id)).thenReturn(Optional.of(ready));

      documentService.deleteDocument(id);

      verify(chunkVectorIndexService).deleteByDocumentId(id);
      verify(chunkRepository).deleteByDocumentId(id);
      verify(documentRepository).deleteById(id);
      verify(blobStore).deletePrefix("rag/" + COLLECTION + "/" + id + "/");
      verify(blobStore).deletePrefix("rag/images/" + COLLECTION + "/" + id + "/");
    }

    @Test
    @DisplayName("Should finish when stored objects cannot be removed")
    void shouldTolerateBlobFailures() {
      Document ready = document(DocumentStatus.READY);
      when(documentRepository.findById(ready.getId())).thenReturn(Optional.of(ready));
      when(blobStore.deletePrefix(anyString()))
          .thenThrow(new StorageException("rag/", "unreachable", null));

      documentService.deleteDocument(ready.getId());

      assertThat(meterRegistry.counter("documents.deleted").count()).isEqualTo(1.0);
    }
  }
}
