package com.flamingo.ai.deckindex.domain.model;

/**
 * One independently processed piece of a document, such as a slide or a page.
 *
 * @param remoteId owning document
 * @param unitIndex 1-based position in the source ordering
 * @param chunkId chunk within the unit, 0 for the single default chunk
 * @param title unit title when the source format has one, may be null
 * @param text cleaned body text
 * @param notes cleaned speaker notes, empty when absent
 */
public record ContentUnit(
    String remoteId, int unitIndex, int chunkId, String title, String text, String notes) {

  public static final int DEFAULT_CHUNK = 0;

  /** Returns true if the text or the notes carry content. */
  public boolean hasContent() {
    return (text != null && !text.isBlank()) || (notes != null && !notes.isBlank());
  }
}
