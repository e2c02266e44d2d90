package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.EmbeddingVector;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

/**
 * One document moving through the stages of a run.
 *
 * <p>Stage outputs are kept in memory while the document moves on. A resumed document starts with
 * none of them and reads what it needs back from staging.
 */
@Getter
@Setter
public class DocumentJob {

  /** How the document left the run. */
  public enum Outcome {
    SUCCEEDED,
    SHORT_CIRCUITED,
    FAILED,
    CANCELLED
  }

  private final SourceDocument document;
  private final String stagingKey;
  private final PipelineStage resumeStage;
  private ProcessingRecord record;
  private List<ContentUnit> units;
  private List<RenderedAsset> assets;
  private List<EmbeddingVector> vectors;
  private Outcome outcome;
  private String error;

  public DocumentJob(SourceDocument document, ProcessingRecord record, String stagingKey) {
    this.document = document;
    this.record = record;
    this.stagingKey = stagingKey;
    this.resumeStage = PipelineStage.resumeFrom(record.getStatus());
  }

  public String getRemoteId() {
    return document.remoteId();
  }

  public boolean isFinished() {
    return outcome != null;
  }

  public void finish(Outcome outcome) {
    this.outcome = outcome;
  }

  public void fail(String error) {
    this.outcome = Outcome.FAILED;
    this.error = error;
  }
}
