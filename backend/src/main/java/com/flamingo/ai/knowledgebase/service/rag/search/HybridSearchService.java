package com.flamingo.ai.knowledgebase.service.rag.search;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkDocument;
import com.flamingo.ai.knowledgebase.elasticsearch.ChunkVectorIndexService;
import com.flamingo.ai.knowledgebase.service.rag.embedding.EmbeddingContent;
import com.flamingo.ai.knowledgebase.service.rag.embedding.EmbeddingService;
import com.flamingo.ai.knowledgebase.service.rag.embedding.SparseEmbeddingService;
import com.flamingo.ai.knowledgebase.service.rag.embedding.SparseVector;
import com.flamingo.ai.knowledgebase.service.rag.rerank.Reranker;
import com.flamingo.ai.knowledgebase.service.rag.rerank.Reranker.RerankOptions;
import com.flamingo.ai.knowledgebase.service.rag.rerank.Reranker.ScoredIndex;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * Three-stage hybrid retrieval: multi-path recall, Reciprocal Rank Fusion, then cross-encoder
 * reranking with parent context attached.
 *
 * <p>Recall paths run concurrently and are isolated: a path that fails or misses the shared
 * deadline contributes nothing. A search never throws; total failure yields an empty result.
 */
@Service
@Slf4j
public class HybridSearchService {

  static final String EXACT = "exact";
  static final String SPARSE = "sparse";
  static final String DENSE = "dense";

  /** Stands in for an unused IN-list; JPQL rejects empty collections. */
  private static final List<UUID> NO_DOCUMENTS = List.of(new UUID(0L, 0L));

  private final ChunkRepository chunkRepository;
  private final ChunkVectorIndexService chunkVectorIndexService;
  private final EmbeddingService embeddingService;
  private final SparseEmbeddingService sparseEmbeddingService;
  private final Reranker reranker;
  private final Executor retrievalExecutor;
  private final RagConfig ragConfig;
  private final MeterRegistry meterRegistry;

  public HybridSearchService(
      ChunkRepository chunkRepository,
      ChunkVectorIndexService chunkVectorIndexService,
      EmbeddingService embeddingService,
      SparseEmbeddingService sparseEmbeddingService,
      Reranker reranker,
      @Qualifier("retrievalExecutor") Executor retrievalExecutor,
      RagConfig ragConfig,
      MeterRegistry meterRegistry) {
    this.chunkRepository = chunkRepository;
    this.chunkVectorIndexService = chunkVectorIndexService;
    this.embeddingService = embeddingService;
    this.sparseEmbeddingService = sparseEmbeddingService;
    this.reranker = reranker;
    this.retrievalExecutor = retrievalExecutor;
    this.ragConfig = ragConfig;
    this.meterRegistry = meterRegistry;
  }

  /**
   * Runs the retrieval pipeline.
   *
   * @param query the request
   * @return hits in final order; empty when nothing qualifies or retrieval failed
   */
  @Timed(value = "rag.search", description = "Time for hybrid search")
  public SearchResult search(SearchQuery query) {
    if (query.selectsNothing()) {
      log.debug("Search in collection {} selects no documents", query.collectionId());
      return SearchResult.empty(query.query(), Map.of());
    }
    try {
      return doSearch(query);
    } catch (RuntimeException e) {
      log.error("Search failed in collection {}", query.collectionId(), e);
      return SearchResult.empty(query.query(), Map.of());
    }
  }

  private SearchResult doSearch(SearchQuery query) {
    RagConfig.Search config = ragConfig.getSearch();
    Map<String, Integer> pathStats = new LinkedHashMap<>();

    Map<String, List<UUID>> recalled = recall(query, pathStats);
    if (recalled.values().stream().allMatch(List::isEmpty)) {
      return SearchResult.empty(query.query(), pathStats);
    }

    List<RrfFusion.Fused> fused =
        RrfFusion.fuse(recalled, config.getRrfK()).stream()
            .limit(config.getFusedTopK())
            .toList();
    pathStats.put("rrf_top", fused.size());

    List<UUID> fusedIds = fused.stream().map(RrfFusion.Fused::chunkId).toList();
    Map<UUID, Chunk> chunksById =
        chunkRepository.findByIdInAndActiveTrue(fusedIds).stream()
            .collect(Collectors.toMap(Chunk::getId, Function.identity()));
    List<RrfFusion.Fused> candidates =
        fused.stream().filter(f -> chunksById.containsKey(f.chunkId())).toList();
    if (candidates.isEmpty()) {
      return SearchResult.empty(query.query(), pathStats);
    }

    int topK = effectiveTopK(query);
    List<Ranked> ranked = rank(query, candidates, chunksById, topK, pathStats);

    Map<UUID, String> parentContent = loadParents(ranked, chunksById);
    List<SearchHit> hits =
        ranked.stream()
            .map(r -> toHit(r, chunksById.get(r.fused().chunkId()), parentContent))
            .toList();

    log.info(
        "Search in collection {} returned {} hits (paths {})",
        query.collectionId(),
        hits.size(),
        pathStats);
    meterRegistry.counter("rag.search.success").increment();
    return new SearchResult(query.query(), hits, hits.size(), pathStats);
  }

  /** Launches the enabled recall paths and collects whatever finishes before the deadline. */
  Map<String, List<UUID>> recall(SearchQuery query, Map<String, Integer> pathStats) {
    Map<String, CompletableFuture<List<UUID>>> futures = new LinkedHashMap<>();
    if (query.exactEnabled()) {
      futures.put(
          EXACT, CompletableFuture.supplyAsync(() -> exactRecall(query), retrievalExecutor));
    }
    if (query.sparseEnabled()) {
      futures.put(
          SPARSE, CompletableFuture.supplyAsync(() -> sparseRecall(query), retrievalExecutor));
    }
    if (query.denseEnabled()) {
      futures.put(
          DENSE, CompletableFuture.supplyAsync(() -> denseRecall(query), retrievalExecutor));
    }

    long timeoutMs = ragConfig.getSearch().getTimeout().toMillis();
    try {
      CompletableFuture.allOf(futures.values().toArray(CompletableFuture[]::new))
          .get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("Recall deadline of {} ms reached, using completed paths only", timeoutMs);
    } catch (ExecutionException e) {
      log.debug("At least one recall path failed: {}", e.getCause().getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for recall paths");
    }

    Map<String, List<UUID>> recalled = new LinkedHashMap<>();
    futures.forEach(
        (path, future) -> {
          List<UUID> ids = collect(path, future);
          recalled.put(path, ids);
          pathStats.put(path, ids.size());
        });
    return recalled;
  }

  private List<UUID> collect(String path, CompletableFuture<List<UUID>> future) {
    if (!future.isDone()) {
      future.cancel(true);
      log.warn("Recall path {} timed out", path);
      meterRegistry.counter("search.path.failed", "path", path).increment();
      return List.of();
    }
    try {
      return future.join();
    } catch (CompletionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      log.warn("Recall path {} failed (skipped): {}", path, cause.getMessage());
      meterRegistry.counter("search.path.failed", "path", path).increment();
      return List.of();
    }
  }

  List<UUID> exactRecall(SearchQuery query) {
    String text = query.query().trim();
    if (text.isEmpty()) {
      return List.of();
    }
    List<String> terms = SparseEmbeddingService.tokenize(text).stream().distinct().toList();
    Map<UUID, Chunk> candidates = new LinkedHashMap<>();
    for (Chunk chunk : findLiteral(query, text)) {
      candidates.put(chunk.getId(), chunk);
    }
    String anchor = ExactMatchRanker.anchorTerm(terms);
    if (!anchor.isEmpty() && !anchor.equals(text.toLowerCase(Locale.ROOT))) {
      for (Chunk chunk : findLiteral(query, anchor)) {
        candidates.putIfAbsent(chunk.getId(), chunk);
      }
    }
    return ExactMatchRanker.rank(
            candidates.values(), text, terms, ragConfig.getSearch().getExactTopK())
        .stream()
        .map(Chunk::getId)
        .toList();
  }

  private List<Chunk> findLiteral(SearchQuery query, String literal) {
    boolean allDocuments = query.documentIds() == null;
    boolean allTypes = query.chunkTypes() == null || query.chunkTypes().isEmpty();
    Set<ChunkType> types = allTypes ? EnumSet.allOf(ChunkType.class) : query.chunkTypes();
    RagConfig.Search config = ragConfig.getSearch();
    int limit = Math.max(config.getExactTopK(), config.getExactCandidateLimit());
    return chunkRepository.findExactMatches(
        query.collectionId(),
        ExactMatchRanker.escapeLike(literal),
        allDocuments,
        allDocuments ? NO_DOCUMENTS : query.documentIds(),
        allTypes,
        types,
        PageRequest.of(0, limit));
  }

  List<UUID> sparseRecall(SearchQuery query) {
    SparseVector vector = sparseEmbeddingService.encodeQuery(query.query());
    List<ChunkDocument> documents =
        chunkVectorIndexService.sparseSearch(
            filter(query), vector.weights(), ragConfig.getSearch().getSparseTopK());
    return toIds(documents);
  }

  List<UUID> denseRecall(SearchQuery query) {
    List<Float> embedding = embeddingService.embed(query.query());
    List<ChunkDocument> documents =
        chunkVectorIndexService.vectorSearch(
            filter(query), embedding, ragConfig.getSearch().getDenseTopK());
    return toIds(documents);
  }

  private static Map<String, Object> filter(SearchQuery query) {
    List<String> types =
        query.chunkTypes() == null
            ? null
            : query.chunkTypes().stream().map(ChunkType::name).toList();
    return ChunkVectorIndexService.filter(query.collectionId(), query.documentIds(), types);
  }

  private static List<UUID> toIds(List<ChunkDocument> documents) {
    return documents.stream().map(d -> UUID.fromString(d.getId())).toList();
  }

  private record Ranked(RrfFusion.Fused fused, Double rerankScore) {
    double score() {
      return rerankScore != null ? rerankScore : fused.score();
    }
  }

  /** Reranks when enabled; otherwise, or when reranking fails, keeps RRF order. */
  private List<Ranked> rank(
      SearchQuery query,
      List<RrfFusion.Fused> candidates,
      Map<UUID, Chunk> chunksById,
      int topK,
      Map<String, Integer> pathStats) {
    RagConfig.Rerank config = ragConfig.getRerank();
    boolean rerank = query.enableRerank() != null ? query.enableRerank() : config.isEnabled();
    if (rerank) {
      int maxTokens = ragConfig.getEmbedding().getMaxEmbeddingTokens();
      List<String> documents =
          candidates.stream()
              .map(f -> chunksById.get(f.chunkId()))
              .map(c -> EmbeddingContent.select(c.getChunkType(), c.getContent(), maxTokens))
              .toList();
      RerankOptions options =
          new RerankOptions(
              topK,
              Objects.requireNonNullElse(query.rerankThreshold(), config.getThreshold()),
              Objects.requireNonNullElse(
                  query.fallbackThreshold(), config.getFallbackThreshold()));
      try {
        List<ScoredIndex> scored = reranker.rerank(query.query(), documents, options);
        pathStats.put("rerank_top", scored.size());
        return scored.stream()
            .map(s -> new Ranked(candidates.get(s.index()), s.score()))
            .toList();
      } catch (RuntimeException e) {
        log.warn("Reranking failed, keeping RRF order: {}", e.getMessage());
      }
    }
    pathStats.put("rerank_top", 0);
    return candidates.stream().limit(topK).map(f -> new Ranked(f, null)).toList();
  }

  int effectiveTopK(SearchQuery query) {
    RagConfig.Search config = ragConfig.getSearch();
    int requested = query.topK() != null && query.topK() > 0 ? query.topK() : config.getFusedTopK();
    return Math.min(requested, config.getMaxTopK());
  }

  private Map<UUID, String> loadParents(List<Ranked> ranked, Map<UUID, Chunk> chunksById) {
    Set<UUID> parentIds =
        ranked.stream()
            .map(r -> chunksById.get(r.fused().chunkId()).getParentChunkId())
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    if (parentIds.isEmpty()) {
      return Map.of();
    }
    return chunkRepository.findByIdInAndActiveTrue(parentIds).stream()
        .collect(Collectors.toMap(Chunk::getId, Chunk::getContent));
  }

  private static SearchHit toHit(Ranked ranked, Chunk chunk, Map<UUID, String> parentContent) {
    RrfFusion.Fused fused = ranked.fused();
    return new SearchHit(
        chunk.getId(),
        chunk.getDocumentId(),
        chunk.getContent(),
        chunk.getChunkType(),
        chunk.getPageNumbers(),
        round(ranked.score()),
        round(fused.score()),
        ranked.rerankScore() != null ? round(ranked.rerankScore()) : null,
        fused.sources(),
        chunk.getParentChunkId() != null ? parentContent.get(chunk.getParentChunkId()) : null);
  }

  static double round(double value) {
    return Math.round(value * 1_000_000d) / 1_000_000d;
  }
}
