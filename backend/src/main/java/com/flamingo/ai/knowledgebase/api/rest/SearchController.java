package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.request.SearchRequest;
import com.flamingo.ai.knowledgebase.api.dto.response.SearchResponse;
import com.flamingo.ai.knowledgebase.service.rag.search.HybridSearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for hybrid retrieval over a collection. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class SearchController {

  private final HybridSearchService hybridSearchService;

  /** Searches a collection. Never fails on retrieval errors; returns fewer or no hits instead. */
  @PostMapping("/collections/{collectionId}/search")
  public ResponseEntity<SearchResponse> search(
      @PathVariable String collectionId, @Valid @RequestBody SearchRequest request) {
    return ResponseEntity.ok(
        SearchResponse.from(hybridSearchService.search(request.toQuery(collectionId))));
  }
}
