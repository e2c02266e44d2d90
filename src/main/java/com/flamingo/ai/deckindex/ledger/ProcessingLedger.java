package com.flamingo.ai.deckindex.ledger;

import com.flamingo.ai.deckindex.domain.entity.ProcessingEvent;
import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import java.util.List;
import java.util.Optional;

/**
 * Durable per-document processing state. The source of truth for what needs (re)processing.
 *
 * <p>Every write is one atomic transaction. Records returned by the ledger are detached copies;
 * callers change them and hand them back through {@link #upsert}.
 */
public interface ProcessingLedger {

  Optional<ProcessingRecord> get(String remoteId);

  /**
   * Inserts or replaces a record.
   *
   * @param record the record to store
   * @return the stored state
   * @throws com.flamingo.ai.deckindex.exception.IllegalStatusTransitionException if the status
   *     change is not allowed from the stored status
   * @throws com.flamingo.ai.deckindex.exception.SystemicFailureException if the store is
   *     unavailable
   */
  ProcessingRecord upsert(ProcessingRecord record);

  /**
   * Persists an incremented retry count together with an audit entry.
   *
   * @param remoteId the document
   * @param stage stage that retried
   * @param cause failure that triggered the retry
   * @return the stored state
   */
  ProcessingRecord recordRetry(String remoteId, String stage, String cause);

  List<ProcessingRecord> listByStatus(ProcessingStatus status);

  default List<ProcessingRecord> listFailed() {
    return listByStatus(ProcessingStatus.FAILED);
  }

  List<ProcessingRecord> listAll();

  /**
   * Moves every failed record back to pending.
   *
   * @return number of records reset
   */
  int resetFailed();

  /** Removes a record whose document disappeared from the source. */
  void delete(String remoteId);

  List<ProcessingEvent> events(String remoteId);

  LedgerStatistics statistics();
}
