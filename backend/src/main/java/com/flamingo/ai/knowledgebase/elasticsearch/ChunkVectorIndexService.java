package com.flamingo.ai.knowledgebase.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of embeddable chunks: one document per child or standalone chunk, carrying
 * a cosine {@code dense_vector} and a {@code rank_features} sparse vector.
 *
 * <p>Filter criteria keys: {@code collectionId} (required for searches), {@code documentIds} and
 * {@code chunkTypes} (optional collections).
 */
@Service
@Slf4j
public class ChunkVectorIndexService extends AbstractElasticsearchIndexService<ChunkDocument> {

  public static final String COLLECTION_ID = "collectionId";
  public static final String DOCUMENT_ID = "documentId";
  public static final String DOCUMENT_IDS = "documentIds";
  public static final String CHUNK_TYPES = "chunkTypes";

  static final int PREVIEW_CHARS = 2000;

  @Value("${elasticsearch.index-name:knowledge-base-chunks}")
  private String indexName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int vectorDimensions;

  @Autowired
  public ChunkVectorIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    super(elasticsearchClient, meterRegistry);
  }

  /** Constructor for testing - allows setting index name and vector dimensions. */
  @VisibleForTesting
  public ChunkVectorIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int vectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.vectorDimensions = vectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("documentId", Property.of(p -> p.keyword(k -> k)));
    properties.put("collectionId", Property.of(p -> p.keyword(k -> k)));
    properties.put("parentChunkId", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkType", Property.of(p -> p.keyword(k -> k)));
    properties.put("chunkIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("pageNumbers", Property.of(p -> p.integer(i -> i)));
    properties.put("hasParent", Property.of(p -> p.boolean_(b -> b)));
    properties.put("contentPreview", Property.of(p -> p.text(t -> t.index(false))));
    properties.put(
        "embedding",
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    properties.put("sparse", Property.of(p -> p.rankFeatures(r -> r)));
    return properties;
  }

  @Override
  protected Map<String, Object> convertToDocument(ChunkDocument chunk) {
    Map<String, Object> document = new HashMap<>();
    document.put("documentId", chunk.getDocumentId().toString());
    document.put("collectionId", chunk.getCollectionId());
    if (chunk.getParentChunkId() != null) {
      document.put("parentChunkId", chunk.getParentChunkId().toString());
    }
    document.put("chunkType", chunk.getChunkType());
    document.put("chunkIndex", chunk.getChunkIndex());
    document.put("pageNumbers", chunk.getPageNumbers());
    document.put("hasParent", chunk.hasParent());
    document.put("contentPreview", preview(chunk.getContentPreview()));
    if (chunk.getEmbedding() != null && !chunk.getEmbedding().isEmpty()) {
      document.put("embedding", chunk.getEmbedding());
    }
    if (chunk.getSparse() != null && !chunk.getSparse().isEmpty()) {
      document.put("sparse", chunk.getSparse());
    }
    return document;
  }

  @Override
  @SuppressWarnings("unchecked")
  protected ChunkDocument convertFromDocument(Map<String, Object> source) {
    Object parent = source.get("parentChunkId");
    Object pages = source.get("pageNumbers");
    List<Integer> pageNumbers = new ArrayList<>();
    if (pages instanceof List<?> list) {
      for (Object page : list) {
        if (page instanceof Number n) {
          pageNumbers.add(n.intValue());
        }
      }
    }
    Object chunkIndex = source.get("chunkIndex");
    return ChunkDocument.builder()
        .id((String) source.get("id"))
        .documentId(UUID.fromString((String) source.get("documentId")))
        .collectionId((String) source.get("collectionId"))
        .parentChunkId(parent == null ? null : UUID.fromString(parent.toString()))
        .chunkIndex(chunkIndex instanceof Number n ? n.intValue() : 0)
        .chunkType((String) source.get("chunkType"))
        .pageNumbers(pageNumbers)
        .contentPreview((String) source.get("contentPreview"))
        .build();
  }

  @Override
  protected String getDocumentId(ChunkDocument entity) {
    return entity.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK) {
    List<Query> filters = buildFilters(filterCriteria);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k ->
                        k.field("embedding")
                            .queryVector(queryEmbedding)
                            .k(topK)
                            .numCandidates(topK * 2)
                            .filter(filters))
                .source(src -> src.filter(f -> f.excludes("embedding", "sparse")))
                .size(topK));
  }

  @Override
  protected SearchRequest buildSparseSearchRequest(
      Map<String, Object> filterCriteria, Map<String, Float> queryWeights, int topK) {
    List<Query> filters = buildFilters(filterCriteria);
    List<Query> should = new ArrayList<>();
    queryWeights.forEach(
        (term, weight) ->
            should.add(
                Query.of(
                    q ->
                        q.rankFeature(
                            r -> r.field("sparse." + term).linear(l -> l).boost(weight)))));
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .query(q -> q.bool(b -> b.filter(filters).should(should).minimumShouldMatch("1")))
                .source(src -> src.filter(f -> f.excludes("embedding", "sparse")))
                .size(topK));
  }

  private static List<Query> buildFilters(Map<String, Object> criteria) {
    Object collectionId = criteria.get(COLLECTION_ID);
    if (collectionId == null) {
      throw new IllegalArgumentException("collectionId filter is required for chunk search");
    }
    List<Query> filters = new ArrayList<>();
    filters.add(Query.of(q -> q.term(t -> t.field("collectionId").value(collectionId.toString()))));
    addTermsFilter(filters, "documentId", criteria.get(DOCUMENT_IDS));
    addTermsFilter(filters, "chunkType", criteria.get(CHUNK_TYPES));
    return filters;
  }

  private static void addTermsFilter(List<Query> filters, String field, Object values) {
    if (!(values instanceof Collection<?> collection) || collection.isEmpty()) {
      return;
    }
    List<FieldValue> fieldValues =
        collection.stream().map(v -> FieldValue.of(v.toString())).toList();
    filters.add(Query.of(q -> q.terms(t -> t.field(field).terms(tv -> tv.value(fieldValues)))));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    if (criteria.containsKey(DOCUMENT_ID)) {
      String documentId = criteria.get(DOCUMENT_ID).toString();
      return Query.of(q -> q.term(t -> t.field("documentId").value(documentId)));
    }
    throw new IllegalArgumentException("deleteBy requires documentId in criteria");
  }

  @Override
  protected String getMetricPrefix() {
    return "chunk_index";
  }

  private static String preview(String content) {
    if (content == null) {
      return "";
    }
    return content.length() <= PREVIEW_CHARS ? content : content.substring(0, PREVIEW_CHARS);
  }

  /** Builds the filter map used by the recall paths. */
  public static Map<String, Object> filter(
      String collectionId, Collection<UUID> documentIds, Collection<String> chunkTypes) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(COLLECTION_ID, collectionId);
    if (documentIds != null && !documentIds.isEmpty()) {
      criteria.put(DOCUMENT_IDS, documentIds);
    }
    if (chunkTypes != null && !chunkTypes.isEmpty()) {
      criteria.put(CHUNK_TYPES, chunkTypes);
    }
    return criteria;
  }

  /**
   * Deletes every vector of a document.
   *
   * @param documentId the document ID
   */
  public void deleteByDocumentId(UUID documentId) {
    Map<String, Object> criteria = new HashMap<>();
    criteria.put(DOCUMENT_ID, documentId);
    deleteBy(criteria);
  }
}
