package com.flamingo.ai.knowledgebase.api.dto.request;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.service.rag.search.SearchQuery;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for a collection search. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  /** Documents to search. Null searches the whole collection; an empty list searches nothing. */
  private List<UUID> documentIds;

  /** Result cap; values above the configured maximum are lowered to it. */
  @Min(value = 1, message = "topK must be at least 1")
  private Integer topK;

  private Boolean enableRerank;

  private Set<ChunkType> chunkTypes;

  private Boolean enableExact;

  private Boolean enableSparse;

  private Boolean enableDense;

  @DecimalMin(value = "0.0", message = "rerankThreshold must be between 0 and 1")
  @DecimalMax(value = "1.0", message = "rerankThreshold must be between 0 and 1")
  private Double rerankThreshold;

  @DecimalMin(value = "-1.0", message = "fallbackThreshold must be between -1 and 1")
  @DecimalMax(value = "1.0", message = "fallbackThreshold must be between -1 and 1")
  private Double fallbackThreshold;

  /** Converts to the service query for a collection. */
  public SearchQuery toQuery(String collectionId) {
    return SearchQuery.builder()
        .collectionId(collectionId)
        .query(query)
        .documentIds(documentIds)
        .topK(topK)
        .enableRerank(enableRerank)
        .chunkTypes(chunkTypes)
        .enableExact(enableExact)
        .enableSparse(enableSparse)
        .enableDense(enableDense)
        .rerankThreshold(rerankThreshold)
        .fallbackThreshold(fallbackThreshold)
        .build();
  }
}
