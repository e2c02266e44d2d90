package com.flamingo.ai.deckindex.search;

import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import com.flamingo.ai.deckindex.elasticsearch.VectorIndexOperations;
import com.flamingo.ai.deckindex.embedding.TextUnitEmbedder;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Read-side text search over the indexed slides. */
@Service
@RequiredArgsConstructor
@Slf4j
public class SlideSearchService {

  private final TextUnitEmbedder textEmbedder;
  private final VectorIndexOperations<IndexPoint> index;

  /**
   * Embeds the query and returns the nearest slides by text vector.
   *
   * @param query free-text query
   * @param topK number of hits
   * @return hits ordered by similarity, empty when the index is unavailable
   */
  public List<IndexPoint> search(String query, int topK) {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    List<Float> queryVector = textEmbedder.embedQuery(query.trim());
    List<IndexPoint> hits =
        index.vectorSearch(Map.of(), VectorKind.TEXT.getFieldName(), queryVector, topK);
    log.debug("Search '{}' returned {} hits", query, hits.size());
    return hits;
  }
}
