package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;

/** A content unit together with its rendered image, which may be absent. */
public record EmbeddingInput(ContentUnit unit, RenderedAsset asset) {

  public boolean hasImage() {
    return asset != null && asset.hasImage();
  }
}
