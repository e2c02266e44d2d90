package com.flamingo.ai.deckindex.api.rest;

import com.flamingo.ai.deckindex.api.dto.response.ProcessingEventResponse;
import com.flamingo.ai.deckindex.api.dto.response.ProcessingRecordResponse;
import com.flamingo.ai.deckindex.api.dto.response.RecordDetailResponse;
import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import com.flamingo.ai.deckindex.domain.enums.RunMode;
import com.flamingo.ai.deckindex.exception.ProcessingRecordNotFoundException;
import com.flamingo.ai.deckindex.ledger.LedgerStatistics;
import com.flamingo.ai.deckindex.ledger.ProcessingLedger;
import com.flamingo.ai.deckindex.pipeline.BatchReport;
import com.flamingo.ai.deckindex.pipeline.IngestionOrchestrator;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for pipeline runs and the processing ledger. */
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

  private final IngestionOrchestrator orchestrator;
  private final ProcessingLedger ledger;

  /** Runs the pipeline now and returns its summary once every document settled. */
  @PostMapping("/runs")
  public ResponseEntity<BatchReport> run(
      @RequestParam(defaultValue = "incremental") String mode) {
    return ResponseEntity.ok(orchestrator.run(RunMode.fromString(mode)));
  }

  @PostMapping("/runs/cancel")
  public ResponseEntity<Map<String, Boolean>> cancel() {
    return ResponseEntity.ok(Map.of("cancelled", orchestrator.cancel()));
  }

  /** Lists ledger records, all of them when no status is given. */
  @GetMapping("/records")
  public ResponseEntity<List<ProcessingRecordResponse>> listRecords(
      @RequestParam(required = false) ProcessingStatus status) {
    List<ProcessingRecord> records =
        status == null ? ledger.listAll() : ledger.listByStatus(status);
    return ResponseEntity.ok(records.stream().map(ProcessingRecordResponse::fromEntity).toList());
  }

  @GetMapping("/records/failed")
  public ResponseEntity<List<ProcessingRecordResponse>> listFailed() {
    return ResponseEntity.ok(
        ledger.listFailed().stream().map(ProcessingRecordResponse::fromEntity).toList());
  }

  /** Moves every failed record back to pending for the next run. */
  @PostMapping("/records/failed/reset")
  public ResponseEntity<Map<String, Integer>> resetFailed() {
    return ResponseEntity.ok(Map.of("reset", ledger.resetFailed()));
  }

  /** Gets one record with its audit trail. Remote ids may contain slashes. */
  @GetMapping("/records/{*remoteId}")
  public ResponseEntity<RecordDetailResponse> getRecord(@PathVariable String remoteId) {
    String id = remoteId.startsWith("/") ? remoteId.substring(1) : remoteId;
    ProcessingRecord record =
        ledger.get(id).orElseThrow(() -> new ProcessingRecordNotFoundException(id));
    List<ProcessingEventResponse> events =
        ledger.events(id).stream().map(ProcessingEventResponse::fromEntity).toList();
    return ResponseEntity.ok(
        new RecordDetailResponse(ProcessingRecordResponse.fromEntity(record), events));
  }

  @GetMapping("/statistics")
  public ResponseEntity<LedgerStatistics> statistics() {
    return ResponseEntity.ok(ledger.statistics());
  }
}
