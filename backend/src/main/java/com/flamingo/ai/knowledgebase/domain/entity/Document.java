package com.flamingo.ai.knowledgebase.domain.entity;

import com.flamingo.ai.knowledgebase.domain.converter.JsonMapConverter;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** An uploaded file registered in a collection, identified by its content hash. */
@Entity
@Table(
    name = "documents",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_documents_collection_hash",
            columnNames = {"collection_id", "content_hash"}),
    indexes = @Index(name = "idx_documents_hash_status", columnList = "content_hash, status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Document {

  /** Default chunking strategy tag. */
  public static final String LAYOUT_PARENT_CHILD = "layout_parent_child";

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "collection_id", nullable = false)
  private String collectionId;

  @Column(nullable = false)
  private String fileName;

  /** SHA-256 of the file bytes, hex encoded. */
  @Column(name = "content_hash", nullable = false, length = 64)
  private String contentHash;

  private Long byteSize;

  private String mimeType;

  /** Object key of the original file in the blob store. */
  private String storagePath;

  private String parserEngine;

  private String parserVersion;

  @Builder.Default private String chunkingStrategy = LAYOUT_PARENT_CHILD;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  @Builder.Default
  private DocumentStatus status = DocumentStatus.UPLOADED;

  @Column(columnDefinition = "TEXT")
  private String errorLog;

  @Convert(converter = JsonMapConverter.class)
  @Column(columnDefinition = "TEXT")
  @Builder.Default
  private Map<String, Object> metadata = new LinkedHashMap<>();

  /** LLM-generated summary, produced lazily on first markdown request. */
  @Column(columnDefinition = "TEXT")
  private String summary;

  /** Number of active chunks (parents and children). */
  private Integer chunkCount;

  @Column(nullable = false, updatable = false)
  private LocalDateTime createdAt;

  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
