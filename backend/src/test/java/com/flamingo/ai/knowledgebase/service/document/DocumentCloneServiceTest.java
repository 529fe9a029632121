package com.flamingo.ai.knowledgebase.service.document;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.exception.DocumentProcessingException;
import com.flamingo.ai.knowledgebase.service.rag.chunking.ChunkDraft;
import com.flamingo.ai.knowledgebase.service.rag.indexing.ChunkIndexer;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentCloneService Tests")
class DocumentCloneServiceTest {

  @Mock private ChunkRepository chunkRepository;
  @Mock private DocumentRepository documentRepository;
  @Mock private DocumentStatusService statusService;
  @Mock private ChunkIndexer chunkIndexer;

  @InjectMocks private DocumentCloneService cloneService;

  private Document source;
  private Document target;
  private Chunk parent;
  private Chunk child;

  @BeforeEach
  void setUp() {
    source =
        Document.builder()
            .id(UUID.randomUUID())
            .collectionId("col-a")
            .status(DocumentStatus.READY)
            .parserEngine("mineru-cloud")
            .summary("A report about latency.")
            .build();
    target = Document.builder().id(UUID.randomUUID()).collectionId("col-b").build();
    parent = chunk(null, 0, true);
    child = chunk(parent.getId(), 1, false);
    when(statusService.markReady(any(), anyInt())).thenReturn(true);
  }

  private Chunk chunk(UUID parentId, int index, boolean isParent) {
    return Chunk.builder()
        .id(UUID.randomUUID())
        .documentId(source.getId())
        .collectionId("col-a")
        .parentChunkId(parentId)
        .chunkIndex(index)
        .chunkType(ChunkType.TEXT)
        .content("content " + index)
        .parent(isParent)
        .pageNumbers(new ArrayList<>(List.of(0)))
        .build();
  }

  @Test
  @DisplayName("Should copy chunks under new ids and keep the parent links")
  void shouldRemapIds() {
    // When
    List<ChunkDraft> drafts = DocumentCloneService.remap(List.of(parent, child));

    // Then
    assertThat(drafts).hasSize(2);
    assertThat(drafts.get(0).id()).isNotEqualTo(parent.getId());
    assertThat(drafts.get(1).id()).isNotEqualTo(child.getId());
    assertThat(drafts.get(1).parentId()).isEqualTo(drafts.get(0).id());
    assertThat(drafts.get(0).parent()).isTrue();
    assertThat(drafts).extracting(ChunkDraft::content).containsExactly("content 0", "content 1");
  }

  @Test
  @DisplayName("Should index the copies and mark the target ready with the source summary")
  void shouldIndexCopiesAndMarkReady() {
    when(chunkRepository.findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(source.getId()))
        .thenReturn(List.of(parent, child));

    int cloned = cloneService.cloneInto(source, target);

    assertThat(cloned).isEqualTo(2);
    verify(chunkIndexer).index(any(Document.class), any());
    verify(statusService).recordParser(target.getId(), "mineru-cloud", null);
    verify(documentRepository).updateSummary(target.getId(), "A report about latency.");
    verify(statusService).markReady(target.getId(), 2);
  }

  @Test
  @DisplayName("Should refuse a source without active chunks")
  void shouldRefuseEmptySource() {
    when(chunkRepository.findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(source.getId()))
        .thenReturn(List.of());

    assertThatThrownBy(() -> cloneService.cloneInto(source, target))
        .isInstanceOf(DocumentProcessingException.class);
    verify(chunkIndexer, never()).index(any(), any());
  }
}
