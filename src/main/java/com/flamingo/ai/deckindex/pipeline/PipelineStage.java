package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;

/** Steps a document goes through, each recording one status once its output is durable. */
public enum PipelineStage {
  DOWNLOAD("download", ProcessingStatus.DOWNLOADING),
  EXTRACT("extract", ProcessingStatus.EXTRACTING),
  RENDER("render", ProcessingStatus.RENDERING),
  EMBED("embed", ProcessingStatus.EMBEDDING),
  INDEX("index", ProcessingStatus.INDEXING),
  FINALIZE("finalize", ProcessingStatus.SUCCESS);

  private final String metricName;
  private final ProcessingStatus completedStatus;

  PipelineStage(String metricName, ProcessingStatus completedStatus) {
    this.metricName = metricName;
    this.completedStatus = completedStatus;
  }

  public String metricName() {
    return metricName;
  }

  /** Status recorded once this stage's output is durable. */
  public ProcessingStatus completedStatus() {
    return completedStatus;
  }

  /**
   * First stage whose work is not yet recorded for a document in {@code status}.
   *
   * @throws IllegalArgumentException for terminal statuses, which have nothing to resume
   */
  public static PipelineStage resumeFrom(ProcessingStatus status) {
    if (status.isTerminal()) {
      throw new IllegalArgumentException("Nothing to resume from terminal status " + status);
    }
    for (PipelineStage stage : values()) {
      if (stage.completedStatus.ordinal() > status.ordinal()) {
        return stage;
      }
    }
    throw new IllegalStateException("No stage after " + status);
  }
}
