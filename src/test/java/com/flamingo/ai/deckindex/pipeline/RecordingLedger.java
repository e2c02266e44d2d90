package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.entity.ProcessingEvent;
import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import com.flamingo.ai.deckindex.exception.IllegalStatusTransitionException;
import com.flamingo.ai.deckindex.exception.ProcessingRecordNotFoundException;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import com.flamingo.ai.deckindex.ledger.LedgerStatistics;
import com.flamingo.ai.deckindex.ledger.ProcessingLedger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory ledger that enforces status transitions and records every write. Can be switched to
 * fail all writes.
 */
public class RecordingLedger implements ProcessingLedger {

  /** One accepted write. */
  public record Write(String operation, String remoteId, ProcessingStatus status) {}

  private final Map<String, ProcessingRecord> records = new TreeMap<>();
  private final List<Write> writes = new ArrayList<>();
  private volatile boolean unavailable;

  @Override
  public synchronized Optional<ProcessingRecord> get(String remoteId) {
    return Optional.ofNullable(records.get(remoteId)).map(ProcessingRecord::copy);
  }

  @Override
  public synchronized ProcessingRecord upsert(ProcessingRecord record) {
    checkAvailable();
    ProcessingRecord existing = records.get(record.getRemoteId());
    if (existing != null && !existing.getStatus().canTransitionTo(record.getStatus())) {
      throw new IllegalStatusTransitionException(
          record.getRemoteId(), existing.getStatus(), record.getStatus());
    }
    ProcessingRecord stored = record.copy();
    stored.setCreatedAt(existing != null ? existing.getCreatedAt() : Instant.now());
    records.put(stored.getRemoteId(), stored);
    writes.add(new Write("upsert", stored.getRemoteId(), stored.getStatus()));
    return stored.copy();
  }

  @Override
  public synchronized ProcessingRecord recordRetry(String remoteId, String stage, String cause) {
    checkAvailable();
    ProcessingRecord stored = records.get(remoteId);
    if (stored == null) {
      throw new ProcessingRecordNotFoundException(remoteId);
    }
    stored.setRetryCount(stored.getRetryCount() + 1);
    writes.add(new Write("retry:" + stage, remoteId, stored.getStatus()));
    return stored.copy();
  }

  @Override
  public synchronized List<ProcessingRecord> listByStatus(ProcessingStatus status) {
    return records.values().stream()
        .filter(r -> r.getStatus() == status)
        .map(ProcessingRecord::copy)
        .toList();
  }

  @Override
  public synchronized List<ProcessingRecord> listAll() {
    checkAvailable();
    return records.values().stream().map(ProcessingRecord::copy).toList();
  }

  @Override
  public synchronized int resetFailed() {
    List<ProcessingRecord> failed = listByStatus(ProcessingStatus.FAILED);
    for (ProcessingRecord record : failed) {
      records.get(record.getRemoteId()).requeue();
      writes.add(new Write("reset", record.getRemoteId(), ProcessingStatus.PENDING));
    }
    return failed.size();
  }

  @Override
  public synchronized void delete(String remoteId) {
    checkAvailable();
    records.remove(remoteId);
    writes.add(new Write("delete", remoteId, null));
  }

  @Override
  public List<ProcessingEvent> events(String remoteId) {
    return List.of();
  }

  @Override
  public synchronized LedgerStatistics statistics() {
    Map<ProcessingStatus, Long> byStatus = new EnumMap<>(ProcessingStatus.class);
    for (ProcessingStatus status : ProcessingStatus.values()) {
      byStatus.put(status, 0L);
    }
    records.values().forEach(r -> byStatus.merge(r.getStatus(), 1L, Long::sum));
    Instant last =
        records.values().stream()
            .map(ProcessingRecord::getFinishedAt)
            .filter(Objects::nonNull)
            .max(Comparator.naturalOrder())
            .orElse(null);
    return new LedgerStatistics(records.size(), byStatus, 0, 0.0, last);
  }

  public synchronized ProcessingRecord require(String remoteId) {
    return get(remoteId).orElseThrow(() -> new AssertionError("No record for " + remoteId));
  }

  /** Remote ids written since the last {@link #clearWrites()}, in write order. */
  public synchronized List<String> writtenIds() {
    return writes.stream().map(Write::remoteId).distinct().toList();
  }

  public synchronized List<Write> writes() {
    return List.copyOf(writes);
  }

  public synchronized void clearWrites() {
    writes.clear();
  }

  public void setUnavailable(boolean unavailable) {
    this.unavailable = unavailable;
  }

  private void checkAvailable() {
    if (unavailable) {
      throw new SystemicFailureException(
          "ledger", "Ledger write failed: database is locked", new IllegalStateException());
    }
  }
}
