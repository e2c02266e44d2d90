package com.flamingo.ai.deckindex.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch._types.mapping.TextProperty;
import co.elastic.clients.elasticsearch._types.query_dsl.BoolQuery;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Elasticsearch index of slide points.
 *
 * <p>Delete criteria: {@link #CRITERIA_REMOTE_ID} is required; {@link #CRITERIA_KEEP_IDS} (a
 * collection of point ids) spares the listed points, which is how a document's stale points are
 * pruned after its new points were written.
 */
@Service
@Slf4j
public class SlidePointIndexService extends AbstractVectorIndexService<IndexPoint> {

  public static final String CRITERIA_REMOTE_ID = "remoteId";
  public static final String CRITERIA_KEEP_IDS = "keepIds";

  private final String indexName;
  private final int textVectorDimensions;
  private final int visualVectorDimensions;

  @Autowired
  public SlidePointIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      IngestionConfig ingestionConfig) {
    this(
        elasticsearchClient,
        meterRegistry,
        ingestionConfig.getIndexing().getIndexName(),
        ingestionConfig.getIndexing().getTextVectorDimensions(),
        ingestionConfig.getIndexing().getVisualVectorDimensions());
  }

  @VisibleForTesting
  public SlidePointIndexService(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      String indexName,
      int textVectorDimensions,
      int visualVectorDimensions) {
    super(elasticsearchClient, meterRegistry);
    this.indexName = indexName;
    this.textVectorDimensions = textVectorDimensions;
    this.visualVectorDimensions = visualVectorDimensions;
  }

  @Override
  public String getIndexName() {
    return indexName;
  }

  @Override
  protected String getMetricPrefix() {
    return "slide_point";
  }

  @Override
  protected Map<String, Property> defineIndexProperties() {
    Map<String, Property> properties = new HashMap<>();
    // Exact-match fields used by deletes and filters
    properties.put("remoteId", Property.of(p -> p.keyword(k -> k)));
    properties.put("contentHash", Property.of(p -> p.keyword(k -> k)));
    properties.put("displayName", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("unitIndex", Property.of(p -> p.integer(i -> i)));
    properties.put("chunkId", Property.of(p -> p.integer(i -> i)));
    properties.put("title", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("text", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("notes", Property.of(p -> p.text(TextProperty.of(t -> t))));
    properties.put("assetPath", Property.of(p -> p.keyword(k -> k.index(false))));
    properties.put("indexedAt", Property.of(p -> p.date(d -> d)));
    properties.put(VectorKind.TEXT.getFieldName(), denseVector(textVectorDimensions));
    properties.put(VectorKind.VISUAL.getFieldName(), denseVector(visualVectorDimensions));
    return properties;
  }

  private static Property denseVector(int dimensions) {
    return Property.of(
        p ->
            p.denseVector(
                DenseVectorProperty.of(
                    d -> d.dims(dimensions).index(true).similarity(DenseVectorSimilarity.Cosine))));
  }

  @Override
  protected Map<String, Object> convertToDocument(IndexPoint point) {
    Map<String, Object> document = new HashMap<>();
    document.put("remoteId", point.getRemoteId());
    document.put("contentHash", point.getContentHash());
    document.put("displayName", point.getDisplayName());
    document.put("unitIndex", point.getUnitIndex());
    document.put("chunkId", point.getChunkId());
    document.put("indexedAt", point.getIndexedAt());
    if (point.getTitle() != null) {
      document.put("title", point.getTitle());
    }
    document.put("text", point.getText());
    document.put("notes", point.getNotes());
    if (point.getAssetPath() != null) {
      document.put("assetPath", point.getAssetPath());
    }
    if (point.getTextVector() != null) {
      document.put(VectorKind.TEXT.getFieldName(), point.getTextVector());
    }
    if (point.getVisualVector() != null) {
      document.put(VectorKind.VISUAL.getFieldName(), point.getVisualVector());
    }
    return document;
  }

  @Override
  protected IndexPoint convertFromDocument(Map<String, Object> source) {
    return IndexPoint.builder()
        .id((String) source.get("id"))
        .remoteId((String) source.get("remoteId"))
        .contentHash((String) source.get("contentHash"))
        .displayName((String) source.get("displayName"))
        .unitIndex(intValue(source.get("unitIndex")))
        .chunkId(intValue(source.get("chunkId")))
        .title((String) source.get("title"))
        .text((String) source.get("text"))
        .notes((String) source.get("notes"))
        .assetPath((String) source.get("assetPath"))
        .indexedAt(source.get("indexedAt") != null ? source.get("indexedAt").toString() : null)
        .build();
  }

  private static int intValue(Object value) {
    return value instanceof Number n ? n.intValue() : 0;
  }

  @Override
  protected String getDocumentId(IndexPoint point) {
    return point.getId();
  }

  @Override
  protected SearchRequest buildVectorSearchRequest(
      Map<String, Object> filterCriteria, String vectorField, List<Float> queryVector, int topK) {
    Object remoteId = filterCriteria.get(CRITERIA_REMOTE_ID);
    return SearchRequest.of(
        s ->
            s.index(indexName)
                .knn(
                    k -> {
                      k.field(vectorField)
                          .queryVector(queryVector)
                          .k(topK)
                          .numCandidates(Math.max(topK * 4, 50));
                      if (remoteId != null) {
                        k.filter(f -> f.term(t -> t.field("remoteId").value(remoteId.toString())));
                      }
                      return k;
                    })
                .source(
                    src ->
                        src.filter(
                            f ->
                                f.excludes(
                                    VectorKind.TEXT.getFieldName(),
                                    VectorKind.VISUAL.getFieldName())))
                .size(topK));
  }

  @Override
  protected Query buildDeleteQuery(Map<String, Object> criteria) {
    Object remoteId = criteria.get(CRITERIA_REMOTE_ID);
    if (remoteId == null) {
      throw new IllegalArgumentException("remoteId criterion is required for delete");
    }
    BoolQuery.Builder bool = new BoolQuery.Builder();
    bool.filter(f -> f.term(t -> t.field("remoteId").value(remoteId.toString())));
    Object keep = criteria.get(CRITERIA_KEEP_IDS);
    if (keep instanceof Collection<?> keepIds && !keepIds.isEmpty()) {
      List<String> ids = new ArrayList<>();
      keepIds.forEach(id -> ids.add(id.toString()));
      bool.mustNot(m -> m.ids(i -> i.values(ids)));
    }
    return Query.of(q -> q.bool(bool.build()));
  }
}
