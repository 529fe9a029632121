package com.flamingo.ai.knowledgebase.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Generic interface for Elasticsearch index operations.
 *
 * @param <T> the document type stored in the index
 * @param <ID> the document ID type
 */
public interface ElasticsearchIndexOperations<T, ID> {

  /**
   * Initializes the index with appropriate mappings.
   *
   * <p>Creates the index if it doesn't exist, using the schema defined by the implementation.
   */
  void initIndex();

  /**
   * Upserts documents in bulk. Any rejected item fails the whole call.
   *
   * @param documents the documents to index
   */
  void indexDocuments(List<T> documents);

  /**
   * Approximate kNN search on the dense embedding.
   *
   * @param filterCriteria key-value pairs for filtering
   * @param queryEmbedding the query vector
   * @param topK number of results to return
   * @return matching documents ordered by similarity
   */
  List<T> vectorSearch(Map<String, Object> filterCriteria, List<Float> queryEmbedding, int topK);

  /**
   * Lexical search on the sparse term weights.
   *
   * @param filterCriteria key-value pairs for filtering
   * @param queryWeights query term weights by term id
   * @param topK number of results to return
   * @return matching documents ordered by weighted term overlap
   */
  List<T> sparseSearch(
      Map<String, Object> filterCriteria, Map<String, Float> queryWeights, int topK);

  /**
   * Deletes documents matching the given criteria.
   *
   * @param criteria key-value pairs for filtering documents to delete
   */
  void deleteBy(Map<String, Object> criteria);

  /** Refreshes the index to make recent changes visible for search. */
  void refresh();

  /**
   * Gets the name of the Elasticsearch index.
   *
   * @return the index name
   */
  String getIndexName();
}
