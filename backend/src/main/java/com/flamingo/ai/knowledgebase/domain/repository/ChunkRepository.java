package com.flamingo.ai.knowledgebase.domain.repository;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Chunk entities. */
@Repository
public interface ChunkRepository extends JpaRepository<Chunk, UUID> {

  List<Chunk> findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(UUID documentId);

  List<Chunk> findByDocumentIdOrderByChunkIndexAsc(UUID documentId);

  long countByDocumentIdAndActiveTrue(UUID documentId);

  List<Chunk> findByIdInAndActiveTrue(Collection<UUID> ids);

  /** Retires every active chunk of a document. Rows are kept for auditing. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("UPDATE Chunk c SET c.active = false WHERE c.documentId = :documentId AND c.active = true")
  int deactivateByDocumentId(@Param("documentId") UUID documentId);

  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("DELETE FROM Chunk c WHERE c.documentId = :documentId")
  int deleteByDocumentId(@Param("documentId") UUID documentId);

  /**
   * Case-insensitive substring match over active chunk content. {@code query} must already have
   * its LIKE wildcards escaped with a backslash.
   *
   * <p>Parents are excluded; they are only returned as context of a matched child.
   */
  @Query(
      "SELECT c FROM Chunk c WHERE c.collectionId = :collectionId AND c.active = true "
          + "AND c.parent = false "
          + "AND LOWER(c.content) LIKE LOWER(CONCAT('%', :query, '%')) ESCAPE '\\' "
          + "AND (:allDocuments = true OR c.documentId IN :documentIds) "
          + "AND (:allTypes = true OR c.chunkType IN :chunkTypes) "
          + "ORDER BY c.documentId, c.chunkIndex")
  List<Chunk> findExactMatches(
      @Param("collectionId") String collectionId,
      @Param("query") String query,
      @Param("allDocuments") boolean allDocuments,
      @Param("documentIds") Collection<UUID> documentIds,
      @Param("allTypes") boolean allTypes,
      @Param("chunkTypes") Collection<ChunkType> chunkTypes,
      Pageable pageable);
}
