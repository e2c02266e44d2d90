package com.flamingo.ai.deckindex.pipeline.stage;

import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.EmbeddingVector;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.elasticsearch.IndexOperationException;
import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import com.flamingo.ai.deckindex.elasticsearch.SlidePointIndexService;
import com.flamingo.ai.deckindex.elasticsearch.VectorIndexOperations;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes a document's points to the vector index.
 *
 * <p>{@link #replace} upserts the new points first and then prunes every other point of the
 * document, so a document that had results keeps returning results throughout the update. Index
 * failures are systemic: they affect every document and abort the batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IndexWriter {

  private final VectorIndexOperations<IndexPoint> index;

  /**
   * Replaces all points of {@code remoteId} with {@code points}.
   *
   * @param remoteId the document
   * @param points the complete new point set, may be empty
   */
  public void replace(String remoteId, List<IndexPoint> points) {
    List<String> keepIds = points.stream().map(IndexPoint::getId).toList();
    try {
      index.indexDocuments(points);
      Map<String, Object> criteria = new HashMap<>();
      criteria.put(SlidePointIndexService.CRITERIA_REMOTE_ID, remoteId);
      criteria.put(SlidePointIndexService.CRITERIA_KEEP_IDS, keepIds);
      index.deleteBy(criteria);
      index.refresh();
    } catch (IndexOperationException | ElasticsearchException e) {
      throw new SystemicFailureException(
          "index", "Index replace failed for " + remoteId + ": " + e.getMessage(), e);
    }
    log.debug("Replaced index entries of {} with {} points", remoteId, points.size());
  }

  /** Removes every point of a document that disappeared from the source. */
  public void delete(String remoteId) {
    try {
      index.deleteBy(Map.of(SlidePointIndexService.CRITERIA_REMOTE_ID, remoteId));
      index.refresh();
    } catch (IndexOperationException | ElasticsearchException e) {
      throw new SystemicFailureException(
          "index", "Index delete failed for " + remoteId + ": " + e.getMessage(), e);
    }
  }

  /**
   * Builds one point per unit that has at least one vector.
   *
   * @param displayName document name stored in the payload
   * @param contentHash hash of the bytes the units were extracted from
   * @param units the document's units
   * @param assets rendered assets by unit
   * @param vectors vectors of any kind
   * @param indexedAt timestamp stored in the payload
   * @return points in unit order
   */
  public static List<IndexPoint> assemble(
      String displayName,
      String contentHash,
      List<ContentUnit> units,
      List<RenderedAsset> assets,
      List<EmbeddingVector> vectors,
      Instant indexedAt) {
    Map<Integer, String> assetPaths = new HashMap<>();
    for (RenderedAsset asset : assets) {
      if (asset.hasImage()) {
        assetPaths.put(asset.unitIndex(), asset.path());
      }
    }
    Map<String, Map<VectorKind, List<Float>>> vectorsByUnit = new HashMap<>();
    for (EmbeddingVector vector : vectors) {
      vectorsByUnit
          .computeIfAbsent(unitKey(vector.unitIndex(), vector.chunkId()), k -> new HashMap<>())
          .put(vector.kind(), vector.vector());
    }

    List<IndexPoint> points = new ArrayList<>();
    for (ContentUnit unit : units) {
      Map<VectorKind, List<Float>> unitVectors =
          vectorsByUnit.get(unitKey(unit.unitIndex(), unit.chunkId()));
      if (unitVectors == null || unitVectors.isEmpty()) {
        continue;
      }
      points.add(
          IndexPoint.builder()
              .id(IndexPoint.pointId(unit.remoteId(), unit.unitIndex(), unit.chunkId()))
              .remoteId(unit.remoteId())
              .displayName(displayName)
              .contentHash(contentHash)
              .unitIndex(unit.unitIndex())
              .chunkId(unit.chunkId())
              .title(unit.title())
              .text(unit.text())
              .notes(unit.notes())
              .assetPath(assetPaths.get(unit.unitIndex()))
              .indexedAt(indexedAt.toString())
              .textVector(unitVectors.get(VectorKind.TEXT))
              .visualVector(unitVectors.get(VectorKind.VISUAL))
              .build());
    }
    return points;
  }

  private static String unitKey(int unitIndex, int chunkId) {
    return unitIndex + ":" + chunkId;
  }
}
