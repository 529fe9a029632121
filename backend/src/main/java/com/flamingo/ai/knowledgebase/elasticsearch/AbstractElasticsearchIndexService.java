package com.flamingo.ai.knowledgebase.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.knowledgebase.exception.VectorIndexException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Abstract base class for Elasticsearch index services.
 *
 * <p>Handles index creation and mapping evolution, bulk upserts, kNN and sparse searches, and
 * delete-by-query. Subclasses define the schema, the document conversion and the queries.
 *
 * <p>Write and search failures are thrown as {@link VectorIndexException}; callers decide whether
 * a failure is fatal.
 *
 * @param <T> the document type stored in the index
 */
@Slf4j
public abstract class AbstractElasticsearchIndexService<T>
    implements ElasticsearchIndexOperations<T, String> {

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractElasticsearchIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  /**
   * Defines the index properties (schema) for this document type.
   *
   * @return a map of field names to Elasticsearch property definitions
   */
  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T entity);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T entity);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  protected abstract SearchRequest buildSparseSearchRequest(
      Map<String, Object> filterCriteria, Map<String, Float> queryWeights, int topK);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /**
   * Returns the metric prefix for this index (e.g., "chunk").
   *
   * @return the metric prefix
   */
  protected abstract String getMetricPrefix();

  /**
   * Creates the index or reconciles its mapping at startup. An unreachable cluster is logged and
   * tolerated so the API can still serve registry operations; incompatible mappings fail fast.
   */
  @PostConstruct
  @Override
  public void initIndex() {
    boolean exists;
    try {
      exists = elasticsearchClient.indices().exists(e -> e.index(getIndexName())).value();
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Elasticsearch unavailable, skipping index initialization for {}: {}",
          getIndexName(),
          e.getMessage());
      return;
    }
    try {
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException e) {
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    // dynamic=false keeps undeclared fields out of the mapping.
    elasticsearchClient
        .indices()
        .create(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
  }

  /**
   * Adds missing fields to the existing index and throws on type mismatches, which require the
   * index to be recreated.
   */
  private void updateAndValidateMappings() throws IOException {
    Map<String, Property> expectedProperties = defineIndexProperties();
    var response = elasticsearchClient.indices().getMapping(g -> g.index(getIndexName()));
    var indexMapping = response.get(getIndexName());
    if (indexMapping == null) {
      return;
    }
    Map<String, Property> actualProperties = indexMapping.mappings().properties();

    List<String> mismatches = new ArrayList<>();
    Map<String, Property> missingFields = new HashMap<>();
    for (Map.Entry<String, Property> entry : expectedProperties.entrySet()) {
      Property actual = actualProperties.get(entry.getKey());
      if (actual == null) {
        missingFields.put(entry.getKey(), entry.getValue());
      } else if (entry.getValue()._kind() != actual._kind()) {
        mismatches.add(
            String.format(
                "field '%s' expected '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      String message =
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s); delete it and restart: "
              + String.join("; ", mismatches);
      log.error(message);
      throw new IllegalStateException(message);
    }

    if (!missingFields.isEmpty()) {
      elasticsearchClient
          .indices()
          .putMapping(p -> p.index(getIndexName()).properties(missingFields));
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified.", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index documents")
  public void indexDocuments(List<T> documents) {
    if (documents.isEmpty()) {
      return;
    }
    try {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T document : documents) {
        String id = getDocumentId(document);
        Map<String, Object> docMap = convertToDocument(document);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }

      BulkResponse response = elasticsearchClient.bulk(bulkBuilder.build());
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        BulkResponseItem failed =
            response.items().stream()
                .filter(item -> item.error() != null)
                .findFirst()
                .orElseThrow();
        throw new VectorIndexException(
            String.format(
                "Failed to index %s in %s: %s",
                failed.id(), getIndexName(), failed.error().reason()));
      }
      log.debug("Indexed {} documents to {}", documents.size(), getIndexName());
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(documents.size());
    } catch (IOException e) {
      throw new VectorIndexException("Failed to index documents to " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    return search("vectorSearch", buildVectorSearchRequest(filterCriteria, queryEmbedding, topK));
  }

  @Override
  @Timed(value = "elasticsearch.sparse_search", description = "Time for sparse search")
  @CircuitBreaker(name = "elasticsearch")
  public List<T> sparseSearch(
      Map<String, Object> filterCriteria, Map<String, Float> queryWeights, int topK) {
    return search("sparseSearch", buildSparseSearchRequest(filterCriteria, queryWeights, topK));
  }

  @SuppressWarnings("rawtypes")
  private List<T> search(String searchType, SearchRequest request) {
    try {
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<Hit<Map>> hits = response.hits().hits();
      log.debug("[{}] index={} returned={}", searchType, getIndexName(), hits.size());
      meterRegistry.counter(getMetricPrefix() + "." + searchType).increment();
      return mapHitsToDocuments(hits);
    } catch (IOException e) {
      throw new VectorIndexException(searchType + " failed for " + getIndexName(), e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete documents by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    try {
      Query deleteQuery = buildDeleteQuery(criteria);
      DeleteByQueryRequest request =
          DeleteByQueryRequest.of(
              d ->
                  d.index(getIndexName())
                      .query(deleteQuery)
                      .refresh(true)
                      .conflicts(Conflicts.Proceed));
      Long deleted = elasticsearchClient.deleteByQuery(request).deleted();
      log.info("Deleted {} documents from {} with criteria: {}", deleted, getIndexName(), criteria);
      meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
    } catch (IOException e) {
      throw new VectorIndexException(
          "Failed to delete documents from " + getIndexName() + " with " + criteria, e);
    }
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
      log.debug("Refreshed index: {}", getIndexName());
    } catch (IOException e) {
      log.warn("Failed to refresh index {}: {}", getIndexName(), e.getMessage());
    }
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata and not part of _source.
        source.put("id", hit.id());
        T document = convertFromDocument(source);
        if (document instanceof ScoredDocument scored && hit.score() != null) {
          scored.setRelevanceScore(hit.score());
        }
        documents.add(document);
      }
    }
    return documents;
  }

  /** Marker interface for documents that support relevance scoring. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
