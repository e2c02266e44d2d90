package com.flamingo.ai.deckindex.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.Conflicts;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryRequest;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.PutMappingRequest;
import com.google.common.collect.Lists;
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
 * Base class for Elasticsearch-backed vector indexes.
 *
 * <p>Writes fail loudly: a bulk response with item errors or a failed delete raises {@link
 * IndexOperationException} so callers never assume data was written when it was not. Only searches
 * are guarded by the circuit breaker.
 *
 * @param <T> the point type stored in the index
 */
@Slf4j
public abstract class AbstractVectorIndexService<T> implements VectorIndexOperations<T> {

  private static final int BULK_BATCH_SIZE = 500;

  protected final ElasticsearchClient elasticsearchClient;
  protected final MeterRegistry meterRegistry;

  protected AbstractVectorIndexService(
      ElasticsearchClient elasticsearchClient, MeterRegistry meterRegistry) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
  }

  @Override
  public abstract String getIndexName();

  protected abstract Map<String, Property> defineIndexProperties();

  protected abstract Map<String, Object> convertToDocument(T point);

  protected abstract T convertFromDocument(Map<String, Object> source);

  protected abstract String getDocumentId(T point);

  protected abstract SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, String vectorField, List<Float> queryVector, int topK);

  protected abstract Query buildDeleteQuery(Map<String, Object> criteria);

  /** Prefix of the counters this index reports, e.g. {@code slide_point}. */
  protected abstract String getMetricPrefix();

  @PostConstruct
  @Override
  public void initIndex() {
    try {
      var indices = elasticsearchClient.indices();
      if (indices == null) {
        log.warn(
            "Elasticsearch client not available, skipping index initialization for {}",
            getIndexName());
        return;
      }
      boolean exists = indices.exists(e -> e.index(getIndexName())).value();
      if (!exists) {
        createIndex();
        log.info("Created Elasticsearch index: {}", getIndexName());
      } else {
        updateAndValidateMappings();
      }
    } catch (IOException | RuntimeException e) {
      log.error(
          "Failed to initialize Elasticsearch index '{}': {}", getIndexName(), e.getMessage(), e);
      throw new IllegalStateException(
          "Failed to initialize Elasticsearch index '" + getIndexName() + "'", e);
    }
  }

  private void createIndex() throws IOException {
    Map<String, Property> properties = defineIndexProperties();
    CreateIndexRequest request =
        CreateIndexRequest.of(
            c ->
                c.index(getIndexName())
                    .mappings(m -> m.dynamic(DynamicMapping.False).properties(properties)));
    elasticsearchClient.indices().create(request);
  }

  /**
   * Adds missing fields to an existing index. Fields whose type changed cannot be migrated in
   * place, so startup fails and the index has to be recreated.
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
                "field '%s' expected type '%s' but found '%s'",
                entry.getKey(), entry.getValue()._kind(), actual._kind()));
      }
    }
    if (!mismatches.isEmpty()) {
      throw new IllegalStateException(
          "Index '"
              + getIndexName()
              + "' has incompatible field type(s), delete it and restart: "
              + String.join("; ", mismatches));
    }

    if (!missingFields.isEmpty()) {
      PutMappingRequest putRequest =
          PutMappingRequest.of(p -> p.index(getIndexName()).properties(missingFields));
      elasticsearchClient.indices().putMapping(putRequest);
      log.info(
          "Added {} new field(s) to index '{}': {}",
          missingFields.size(),
          getIndexName(),
          missingFields.keySet());
    } else {
      log.debug("Index '{}' mapping verified", getIndexName());
    }
  }

  @Override
  @Timed(value = "elasticsearch.index", description = "Time to index points")
  public void indexDocuments(List<T> points) {
    if (points.isEmpty()) {
      return;
    }
    for (List<T> batch : Lists.partition(points, BULK_BATCH_SIZE)) {
      BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
      for (T point : batch) {
        String id = getDocumentId(point);
        Map<String, Object> docMap = convertToDocument(point);
        bulkBuilder.operations(
            op -> op.index(idx -> idx.index(getIndexName()).id(id).document(docMap)));
      }
      BulkResponse response;
      try {
        response = elasticsearchClient.bulk(bulkBuilder.build());
      } catch (IOException e) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new IndexOperationException(
            "Bulk write to " + getIndexName() + " failed: " + e.getMessage(), e);
      }
      if (response.errors()) {
        meterRegistry.counter(getMetricPrefix() + ".index.errors").increment();
        throw new IndexOperationException(
            "Bulk write to " + getIndexName() + " rejected: " + firstItemError(response));
      }
      meterRegistry.counter(getMetricPrefix() + ".indexed").increment(batch.size());
    }
    log.debug("Indexed {} points to {}", points.size(), getIndexName());
  }

  private static String firstItemError(BulkResponse response) {
    long failed = response.items().stream().filter(item -> item.error() != null).count();
    return response.items().stream()
        .filter(item -> item.error() != null)
        .findFirst()
        .map(BulkResponseItem::error)
        .map(error -> failed + " item(s) failed, first: " + error.type() + " " + error.reason())
        .orElse("unknown item error");
  }

  @Override
  @Timed(value = "elasticsearch.vector_search", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch", fallbackMethod = "vectorSearchFallback")
  public List<T> vectorSearch(
      Map<String, Object> filterCriteria, String vectorField, List<Float> queryVector, int topK) {
    try {
      SearchRequest request =
          buildVectorSearchRequest(filterCriteria, vectorField, queryVector, topK);
      SearchResponse<Map> response = elasticsearchClient.search(request, Map.class);
      List<T> results = mapHitsToDocuments(response.hits().hits());
      log.info(
          "[vectorSearch] index={} field={} returned={}",
          getIndexName(),
          vectorField,
          results.size());
      meterRegistry.counter(getMetricPrefix() + ".vector_search").increment();
      return results;
    } catch (IOException e) {
      throw new IndexOperationException("Vector search failed on " + getIndexName(), e);
    }
  }

  @SuppressWarnings("unused")
  private List<T> vectorSearchFallback(
      Map<String, Object> filterCriteria,
      String vectorField,
      List<Float> queryVector,
      int topK,
      Throwable t) {
    log.warn("{} vector search fallback triggered: {}", getIndexName(), t.getMessage());
    meterRegistry.counter(getMetricPrefix() + ".vector_search.fallback").increment();
    return List.of();
  }

  @Override
  @Timed(value = "elasticsearch.delete_by", description = "Time to delete points by criteria")
  public void deleteBy(Map<String, Object> criteria) {
    Query deleteQuery = buildDeleteQuery(criteria);
    DeleteByQueryRequest request =
        DeleteByQueryRequest.of(
            d -> d.index(getIndexName()).query(deleteQuery).conflicts(Conflicts.Proceed));
    DeleteByQueryResponse response;
    try {
      response = elasticsearchClient.deleteByQuery(request);
    } catch (IOException e) {
      throw new IndexOperationException(
          "Delete from " + getIndexName() + " failed: " + e.getMessage(), e);
    }
    if (response.failures() != null && !response.failures().isEmpty()) {
      throw new IndexOperationException(
          "Delete from "
              + getIndexName()
              + " left "
              + response.failures().size()
              + " point(s) behind");
    }
    log.debug(
        "Deleted {} point(s) from {} with criteria {}",
        response.deleted(),
        getIndexName(),
        criteria.keySet());
    meterRegistry.counter(getMetricPrefix() + ".deleted").increment();
  }

  @Override
  public void refresh() {
    try {
      elasticsearchClient.indices().refresh(r -> r.index(getIndexName()));
    } catch (IOException e) {
      throw new IndexOperationException("Refresh of " + getIndexName() + " failed", e);
    }
  }

  @SuppressWarnings("unchecked")
  private List<T> mapHitsToDocuments(List<Hit<Map>> hits) {
    List<T> documents = new ArrayList<>();
    for (Hit<Map> hit : hits) {
      Map<String, Object> source = hit.source();
      if (source != null) {
        // _id is metadata, not part of _source
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

  /** Points that carry the similarity score of a search hit. */
  public interface ScoredDocument {
    void setRelevanceScore(Double score);
  }
}
