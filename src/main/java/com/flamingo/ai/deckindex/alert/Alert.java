package com.flamingo.ai.deckindex.alert;

import com.flamingo.ai.deckindex.pipeline.BatchReport;
import java.util.List;

/**
 * Signal raised when a batch failed too many documents.
 *
 * @param severity how far the threshold was exceeded
 * @param message one-line summary
 * @param failureRate failed share of the processed documents
 * @param threshold configured failure-rate threshold
 * @param failedDocuments remote ids of the failed documents
 * @param report metrics of the batch
 */
public record Alert(
    AlertSeverity severity,
    String message,
    double failureRate,
    double threshold,
    List<String> failedDocuments,
    BatchReport report) {}
