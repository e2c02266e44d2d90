package com.flamingo.ai.deckindex.elasticsearch;

import java.util.List;
import java.util.Map;

/**
 * Operations on a vector index.
 *
 * @param <T> the point type stored in the index
 */
public interface VectorIndexOperations<T> {

  /** Creates the index if it does not exist and verifies the mappings of an existing one. */
  void initIndex();

  /**
   * Writes the given points, replacing any point with the same id.
   *
   * @param points the points to write
   * @throws IndexOperationException if the index rejects the request or any point
   */
  void indexDocuments(List<T> points);

  /**
   * Nearest-neighbour search on one vector field.
   *
   * @param filterCriteria optional filters, may be empty
   * @param vectorField the dense vector field to search
   * @param queryVector the query vector
   * @param topK number of results
   * @return matching points ordered by similarity
   */
  List<T> vectorSearch(
      Map<String, Object> filterCriteria, String vectorField, List<Float> queryVector, int topK);

  /**
   * Deletes every point matching the criteria.
   *
   * @param criteria implementation-defined filter keys
   * @throws IndexOperationException if the delete fails
   */
  void deleteBy(Map<String, Object> criteria);

  /** Makes recent writes visible to search. */
  void refresh();

  String getIndexName();
}
