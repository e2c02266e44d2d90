package com.flamingo.ai.deckindex.domain.enums;

/**
 * Processing state of a document in the ledger.
 *
 * <p>An intermediate status names the last stage whose output is durably staged, so the next run
 * resumes with the stage that follows it.
 */
public enum ProcessingStatus {
  /** Queued for processing; nothing staged yet. */
  PENDING,

  /** Source bytes are staged and the content hash is recorded. */
  DOWNLOADING,

  /** Content units are extracted and staged. */
  EXTRACTING,

  /** Rendered assets are staged. */
  RENDERING,

  /** Embedding vectors are staged. */
  EMBEDDING,

  /** Index entries have been replaced; only finalization remains. */
  INDEXING,

  /** Document is fully indexed. */
  SUCCESS,

  /** Processing failed; requires a detected change or an explicit reset. */
  FAILED;

  public boolean isTerminal() {
    return this == SUCCESS || this == FAILED;
  }

  /**
   * Checks whether a record in this status may move to {@code next}.
   *
   * <p>Forward moves along the stage sequence are allowed (skipping stages included), any
   * non-terminal status may fail, and terminal statuses may only go back to {@link #PENDING}.
   *
   * @param next the requested status
   * @return true if the transition is legal
   */
  public boolean canTransitionTo(ProcessingStatus next) {
    if (next == this) {
      return true;
    }
    if (next == FAILED) {
      return !isTerminal();
    }
    if (next == PENDING) {
      return isTerminal();
    }
    return !isTerminal() && next.ordinal() > ordinal();
  }
}
