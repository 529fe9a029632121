package com.flamingo.ai.knowledgebase.domain.entity;

import com.flamingo.ai.knowledgebase.domain.converter.IntegerListConverter;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * A persisted retrieval unit.
 *
 * <p>Parents ({@code parent == true}) hold expanded context and are never embedded. Children point
 * at their parent through {@code parentChunkId}; standalone chunks have neither. The id is assigned
 * before insert because it doubles as the vector-store document id.
 */
@Entity
@Table(
    name = "chunks",
    indexes = {
      @Index(name = "idx_chunks_document_active", columnList = "document_id, is_active"),
      @Index(name = "idx_chunks_document_order", columnList = "document_id, chunk_index"),
      @Index(name = "idx_chunks_parent", columnList = "parent_chunk_id")
    })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Chunk implements Persistable<UUID> {

  @Id private UUID id;

  @Column(name = "document_id", nullable = false)
  private UUID documentId;

  @Column(name = "collection_id", nullable = false)
  private String collectionId;

  @Column(name = "parent_chunk_id")
  private UUID parentChunkId;

  @Column(name = "chunk_index", nullable = false)
  private int chunkIndex;

  @Convert(converter = IntegerListConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private List<Integer> pageNumbers = new ArrayList<>();

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private ChunkType chunkType;

  @Column(nullable = false, columnDefinition = "TEXT")
  private String content;

  private int tokenCount;

  /** True for context-only parent chunks. */
  @Column(name = "is_parent", nullable = false)
  private boolean parent;

  @Column(name = "is_active", nullable = false)
  @Builder.Default
  private boolean active = true;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Transient @Builder.Default private boolean newEntity = true;

  @Override
  public boolean isNew() {
    return newEntity;
  }

  /** True if this chunk is sent to the vector store. */
  public boolean isEmbeddable() {
    return !parent;
  }

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = LocalDateTime.now();
    }
  }

  @PostLoad
  @PostPersist
  protected void markNotNew() {
    newEntity = false;
  }
}
