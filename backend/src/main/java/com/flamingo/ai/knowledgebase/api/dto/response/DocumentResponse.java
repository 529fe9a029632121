package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import java.time.LocalDateTime;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for document data. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

  private UUID id;
  private String collectionId;
  private String fileName;
  private String mimeType;
  private Long byteSize;
  private String contentHash;
  private DocumentStatus status;
  private String parserEngine;
  private String parserVersion;
  private String chunkingStrategy;
  private Integer chunkCount;
  private String summary;
  private String errorLog;
  private LocalDateTime createdAt;
  private LocalDateTime updatedAt;

  /** Creates a DocumentResponse from a Document entity. */
  public static DocumentResponse fromEntity(Document document) {
    return DocumentResponse.builder()
        .id(document.getId())
        .collectionId(document.getCollectionId())
        .fileName(document.getFileName())
        .mimeType(document.getMimeType())
        .byteSize(document.getByteSize())
        .contentHash(document.getContentHash())
        .status(document.getStatus())
        .parserEngine(document.getParserEngine())
        .parserVersion(document.getParserVersion())
        .chunkingStrategy(document.getChunkingStrategy())
        .chunkCount(document.getChunkCount())
        .summary(document.getSummary())
        .errorLog(document.getErrorLog())
        .createdAt(document.getCreatedAt())
        .updatedAt(document.getUpdatedAt())
        .build();
  }
}
