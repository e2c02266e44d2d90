package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.RunMode;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Classifies the remote listing against the ledger.
 *
 * <p>In incremental mode a document with a terminal record is a candidate only when the source
 * reports a modification time strictly newer than the one observed when the record was last queued
 * or confirmed. Full mode makes every listed document a candidate; the content hash computed after
 * download decides whether it is reprocessed. Records in an intermediate status are resumed in both
 * modes.
 */
@Component
@Slf4j
public class ChangeDetector {

  public ChangeSet detect(
      List<SourceDocument> listing, Collection<ProcessingRecord> records, RunMode mode) {
    Map<String, ProcessingRecord> byId = new LinkedHashMap<>();
    for (ProcessingRecord record : records) {
      byId.put(record.getRemoteId(), record);
    }

    List<SourceDocument> newDocuments = new ArrayList<>();
    List<ChangeSet.Candidate> modified = new ArrayList<>();
    List<SourceDocument> unchanged = new ArrayList<>();
    List<ChangeSet.Candidate> resumed = new ArrayList<>();
    Map<String, SourceDocument> seen = new LinkedHashMap<>();

    for (SourceDocument document : listing) {
      if (seen.putIfAbsent(document.remoteId(), document) != null) {
        log.warn(
            "Remote listing contains {} more than once, keeping the first", document.remoteId());
        continue;
      }
      ProcessingRecord record = byId.get(document.remoteId());
      if (record == null) {
        newDocuments.add(document);
      } else if (!record.getStatus().isTerminal()) {
        resumed.add(new ChangeSet.Candidate(document, record));
      } else if (mode == RunMode.FULL || isNewer(document, record)) {
        modified.add(new ChangeSet.Candidate(document, record));
      } else {
        unchanged.add(document);
      }
    }

    List<ProcessingRecord> deleted = new ArrayList<>();
    for (ProcessingRecord record : byId.values()) {
      if (!seen.containsKey(record.getRemoteId())) {
        deleted.add(record);
      }
    }

    return new ChangeSet(newDocuments, modified, unchanged, resumed, deleted);
  }

  private static boolean isNewer(SourceDocument document, ProcessingRecord record) {
    if (record.getRemoteModifiedTime() == null) {
      return true;
    }
    return document.modifiedTime() != null
        && document.modifiedTime().isAfter(record.getRemoteModifiedTime());
  }
}
