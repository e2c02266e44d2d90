package com.flamingo.ai.deckindex.ledger;

import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import java.time.Instant;
import java.util.Map;

/**
 * Aggregate view over the ledger.
 *
 * @param totalRecords number of records
 * @param byStatus record count per status, every status present
 * @param totalUnits units of successfully indexed documents
 * @param averageDurationMs average processing duration of successful documents, 0 when none
 * @param lastFinishedAt most recent completion time, null when nothing finished yet
 */
public record LedgerStatistics(
    long totalRecords,
    Map<ProcessingStatus, Long> byStatus,
    long totalUnits,
    double averageDurationMs,
    Instant lastFinishedAt) {}
