package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.enums.RunMode;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/** Summary of one pipeline run. */
@Getter
@Builder
public class BatchReport {

  private final RunMode mode;
  private final Instant startedAt;
  private final Instant finishedAt;

  private final int listed;
  private final int newDocuments;
  private final int modified;
  private final int unchanged;
  private final int resumed;
  private final int deleted;

  private final int succeeded;

  /** Candidates whose bytes matched the live index entries. */
  private final int shortCircuited;

  private final int failed;

  /** Documents left in their partial state by an abort. */
  private final int cancelled;

  private final List<FailedDocument> failures;

  /** Failed share of the processed documents, 0 when nothing was processed. */
  private final double failureRate;

  /** Average processing time of the documents that succeeded in this run. */
  private final long averageDurationMs;

  private final boolean aborted;

  /** Documents that reached a terminal status in this run. */
  public int getProcessed() {
    return succeeded + shortCircuited + failed;
  }

  /**
   * A document that failed in this run.
   *
   * @param remoteId the document
   * @param displayName its name
   * @param error the captured error message
   */
  public record FailedDocument(String remoteId, String displayName, String error) {}
}
