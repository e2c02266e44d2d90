package com.flamingo.ai.deckindex.elasticsearch;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One searchable point: a content unit with its vectors and the payload needed to show a result.
 *
 * <p>Ids are deterministic ({@code remoteId:unitIndex:chunkId}) so rewriting a document overwrites
 * its previous points in place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IndexPoint implements AbstractVectorIndexService.ScoredDocument {

  private String id;
  private String remoteId;
  private String displayName;

  /** SHA-256 of the document bytes the point was built from. */
  private String contentHash;

  private int unitIndex;
  private int chunkId;
  private String title;
  private String text;
  private String notes;

  /** Rendered image of the unit, absent when rendering produced none. */
  private String assetPath;

  private String indexedAt;
  private List<Float> textVector;
  private List<Float> visualVector;

  @Builder.Default private Double relevanceScore = 0.0;

  public static String pointId(String remoteId, int unitIndex, int chunkId) {
    return remoteId + ":" + unitIndex + ":" + chunkId;
  }
}
