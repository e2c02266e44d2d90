package com.flamingo.ai.deckindex.api.dto.response;

import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** One search result. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHitResponse {

  private String id;
  private Double score;
  private String remoteId;
  private String displayName;
  private int unitIndex;
  private String title;
  private String text;
  private String assetPath;

  public static SearchHitResponse fromPoint(IndexPoint point) {
    return SearchHitResponse.builder()
        .id(point.getId())
        .score(point.getRelevanceScore())
        .remoteId(point.getRemoteId())
        .displayName(point.getDisplayName())
        .unitIndex(point.getUnitIndex())
        .title(point.getTitle())
        .text(point.getText())
        .assetPath(point.getAssetPath())
        .build();
  }
}
