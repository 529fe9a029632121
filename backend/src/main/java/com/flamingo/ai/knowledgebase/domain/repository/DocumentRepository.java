package com.flamingo.ai.knowledgebase.domain.repository;

import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/** Repository for Document entities. */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

  /** Finds the document with the given content in a collection. */
  Optional<Document> findByCollectionIdAndContentHash(String collectionId, String contentHash);

  /** Finds a processed document with the same content, in any collection. */
  Optional<Document> findFirstByContentHashAndStatusOrderByCreatedAtAsc(
      String contentHash, DocumentStatus status);

  /** Finds all documents of a collection, newest first. */
  List<Document> findByCollectionIdOrderByCreatedAtDesc(String collectionId);

  /**
   * Moves a document to {@code target} only if its current status is one of {@code allowed}.
   *
   * @return number of updated rows (0 when the guard rejected the transition)
   */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Document d SET d.status = :target, d.updatedAt = CURRENT_TIMESTAMP "
          + "WHERE d.id = :id AND d.status IN :allowed")
  int updateStatusIfIn(
      @Param("id") UUID id,
      @Param("target") DocumentStatus target,
      @Param("allowed") Collection<DocumentStatus> allowed);

  /** Moves a document to {@code target} and records its final chunk count, guarded like above. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Document d SET d.status = :target, d.chunkCount = :chunkCount, d.errorLog = NULL, "
          + "d.updatedAt = CURRENT_TIMESTAMP WHERE d.id = :id AND d.status IN :allowed")
  int completeIfIn(
      @Param("id") UUID id,
      @Param("target") DocumentStatus target,
      @Param("chunkCount") int chunkCount,
      @Param("allowed") Collection<DocumentStatus> allowed);

  /** Stores a generated summary. */
  @Transactional
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Document d SET d.summary = :summary WHERE d.id = :id")
  int updateSummary(@Param("id") UUID id, @Param("summary") String summary);

  /** Marks a document failed with an error log, unless it is already READY. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query(
      "UPDATE Document d SET d.status = "
          + "com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus.FAILED, "
          + "d.errorLog = :errorLog, d.updatedAt = CURRENT_TIMESTAMP WHERE d.id = :id "
          + "AND d.status <> com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus.READY")
  int markFailed(@Param("id") UUID id, @Param("errorLog") String errorLog);
}
