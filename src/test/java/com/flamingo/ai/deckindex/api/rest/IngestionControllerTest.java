package com.flamingo.ai.deckindex.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import com.flamingo.ai.deckindex.domain.enums.RunMode;
import com.flamingo.ai.deckindex.exception.GlobalExceptionHandler;
import com.flamingo.ai.deckindex.exception.IngestionRunInProgressException;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import com.flamingo.ai.deckindex.ledger.ProcessingLedger;
import com.flamingo.ai.deckindex.pipeline.BatchReport;
import com.flamingo.ai.deckindex.pipeline.IngestionOrchestrator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("IngestionController")
class IngestionControllerTest {

  @Mock private IngestionOrchestrator orchestrator;
  @Mock private ProcessingLedger ledger;

  private SimpleMeterRegistry meterRegistry;
  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    IngestionController controller = new IngestionController(orchestrator, ledger);
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
  }

  @Test
  @DisplayName("Should run the pipeline in the requested mode and return the batch summary")
  void shouldReturnReport_whenRunRequested() throws Exception {
    // Given
    when(orchestrator.run(RunMode.FULL))
        .thenReturn(
            BatchReport.builder()
                .mode(RunMode.FULL)
                .listed(3)
                .succeeded(2)
                .failed(1)
                .failureRate(1.0 / 3)
                .failures(
                    List.of(new BatchReport.FailedDocument("c.pptx", "c.pptx", "corrupt")))
                .build());

    // When / Then
    mockMvc
        .perform(post("/api/ingestion/runs").param("mode", "full"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.mode").value("FULL"))
        .andExpect(jsonPath("$.listed").value(3))
        .andExpect(jsonPath("$.succeeded").value(2))
        .andExpect(jsonPath("$.processed").value(3))
        .andExpect(jsonPath("$.failures[0].remoteId").value("c.pptx"));
  }

  @Test
  @DisplayName("Should default to an incremental run")
  void shouldRunIncremental_whenModeOmitted() throws Exception {
    // Given
    when(orchestrator.run(RunMode.INCREMENTAL))
        .thenReturn(BatchReport.builder().mode(RunMode.INCREMENTAL).failures(List.of()).build());

    // When / Then
    mockMvc.perform(post("/api/ingestion/runs")).andExpect(status().isOk());
    verify(orchestrator).run(RunMode.INCREMENTAL);
  }

  @Test
  @DisplayName("Should reject an unknown run mode with 400")
  void shouldReturnBadRequest_whenModeUnknown() throws Exception {
    mockMvc
        .perform(post("/api/ingestion/runs").param("mode", "sideways"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));

    verify(orchestrator, never()).run(any());
  }

  @Test
  @DisplayName("Should return 409 when a run is already in progress")
  void shouldReturnConflict_whenRunInProgress() throws Exception {
    // Given
    when(orchestrator.run(any())).thenThrow(new IngestionRunInProgressException());

    // When / Then
    mockMvc
        .perform(post("/api/ingestion/runs"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("INGESTION_001"));
    assertThat(meterRegistry.counter("api_errors_total", "error_type", "run_in_progress").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should return 503 when the run aborted on a systemic failure")
  void shouldReturnServiceUnavailable_whenRunAborted() throws Exception {
    // Given
    when(orchestrator.run(any()))
        .thenThrow(
            new SystemicFailureException("index", "cluster unavailable", new RuntimeException()));

    // When / Then
    mockMvc
        .perform(post("/api/ingestion/runs"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("INGESTION_002"));
  }

  @Test
  @DisplayName("Should report whether a running batch was cancelled")
  void shouldReturnCancelled_whenCancelRequested() throws Exception {
    // Given
    when(orchestrator.cancel()).thenReturn(true);

    // When / Then
    mockMvc
        .perform(post("/api/ingestion/runs/cancel"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.cancelled").value(true));
  }

  @Test
  @DisplayName("Should return a record with its events when the id contains slashes")
  void shouldReturnRecord_whenRemoteIdContainsSlashes() throws Exception {
    // Given
    ProcessingRecord record =
        ProcessingRecord.builder()
            .remoteId("sales/q1.pptx")
            .displayName("q1.pptx")
            .status(ProcessingStatus.SUCCESS)
            .remoteModifiedTime(Instant.parse("2026-01-01T00:00:00Z"))
            .build();
    when(ledger.get("sales/q1.pptx")).thenReturn(Optional.of(record));
    when(ledger.events("sales/q1.pptx")).thenReturn(List.of());

    // When / Then
    mockMvc
        .perform(get("/api/ingestion/records/sales/q1.pptx"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.record.remoteId").value("sales/q1.pptx"))
        .andExpect(jsonPath("$.record.status").value("SUCCESS"))
        .andExpect(jsonPath("$.events").isEmpty());
  }

  @Test
  @DisplayName("Should return 404 for an unknown record")
  void shouldReturnNotFound_whenRecordMissing() throws Exception {
    // Given
    when(ledger.get("missing.pptx")).thenReturn(Optional.empty());

    // When / Then
    mockMvc
        .perform(get("/api/ingestion/records/missing.pptx"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("RECORD_001"));
  }

  @Test
  @DisplayName("Should filter records by status")
  void shouldListRecordsByStatus_whenStatusGiven() throws Exception {
    // Given
    when(ledger.listByStatus(ProcessingStatus.FAILED))
        .thenReturn(
            List.of(
                ProcessingRecord.builder()
                    .remoteId("bad.pptx")
                    .displayName("bad.pptx")
                    .status(ProcessingStatus.FAILED)
                    .lastError("corrupt")
                    .build()));

    // When / Then
    mockMvc
        .perform(get("/api/ingestion/records").param("status", "FAILED"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].remoteId").value("bad.pptx"))
        .andExpect(jsonPath("$[0].lastError").value("corrupt"));
    verify(ledger, never()).listAll();
  }

  @Test
  @DisplayName("Should reset failed records and return how many moved to pending")
  void shouldReturnResetCount_whenFailedRecordsReset() throws Exception {
    // Given
    when(ledger.resetFailed()).thenReturn(4);

    // When / Then
    mockMvc
        .perform(post("/api/ingestion/records/failed/reset"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.reset").value(4));
  }
}
