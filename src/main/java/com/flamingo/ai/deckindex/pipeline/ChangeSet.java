package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import java.util.List;

/**
 * Worklist of one run, partitioned by how each document relates to the ledger.
 *
 * @param newDocuments listed documents without a ledger record
 * @param modified terminal records whose document is a candidate for reprocessing
 * @param unchanged listed documents skipped by this run
 * @param resumed records left in an intermediate status by an earlier run
 * @param deleted records whose document is no longer listed
 */
public record ChangeSet(
    List<SourceDocument> newDocuments,
    List<Candidate> modified,
    List<SourceDocument> unchanged,
    List<Candidate> resumed,
    List<ProcessingRecord> deleted) {

  /** A listed document together with its current ledger record. */
  public record Candidate(SourceDocument document, ProcessingRecord record) {}

  public int workCount() {
    return newDocuments.size() + modified.size() + resumed.size();
  }
}
