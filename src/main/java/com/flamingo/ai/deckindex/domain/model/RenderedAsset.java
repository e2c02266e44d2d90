package com.flamingo.ai.deckindex.domain.model;

/** Rendered image of a content unit. {@code path} is null when the unit produced no image. */
public record RenderedAsset(String remoteId, int unitIndex, String path) {

  public boolean hasImage() {
    return path != null;
  }
}
