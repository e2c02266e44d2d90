package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.alert.Alert;
import com.flamingo.ai.deckindex.alert.AlertSeverity;
import com.flamingo.ai.deckindex.alert.AlertSink;
import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import com.flamingo.ai.deckindex.domain.enums.RunMode;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.EmbeddingVector;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.domain.model.StagedDocument;
import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.IngestionCancelledException;
import com.flamingo.ai.deckindex.exception.IngestionRunInProgressException;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.ledger.ProcessingLedger;
import com.flamingo.ai.deckindex.pipeline.DocumentJob.Outcome;
import com.flamingo.ai.deckindex.pipeline.stage.DownloadStage;
import com.flamingo.ai.deckindex.pipeline.stage.EmbeddingStage;
import com.flamingo.ai.deckindex.pipeline.stage.ExtractionStage;
import com.flamingo.ai.deckindex.pipeline.stage.IndexWriter;
import com.flamingo.ai.deckindex.pipeline.stage.RenderingStage;
import com.flamingo.ai.deckindex.staging.StagingArea;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Drives documents through download, extraction, rendering, embedding and indexing.
 *
 * <p>Each stage runs on its own worker pool and a document is handed to the next pool only when
 * its current stage is done, so a document queued for the render slot never holds a download or
 * extraction worker. The ledger is written after every stage, once the stage's output
 * is staged, and a resumed document starts at the first stage without a recorded status.
 *
 * <p>Stage failures fail the document only. A {@link SystemicFailureException} trips the abort
 * signal: no new stage work is issued, in-flight work settles, and the exception is rethrown once
 * the run summary is logged. Documents stopped by an abort keep their partial status.
 */
@Service
@Slf4j
public class IngestionOrchestrator {

  private final ProcessingLedger ledger;
  private final ChangeDetector changeDetector;
  private final DownloadStage downloadStage;
  private final ExtractionStage extractionStage;
  private final RenderingStage renderingStage;
  private final EmbeddingStage embeddingStage;
  private final IndexWriter indexWriter;
  private final StagingArea staging;
  private final AlertSink alertSink;
  private final StageExecutors executors;
  private final MeterRegistry meterRegistry;
  private final Clock clock;
  private final double failureRateThreshold;

  private final AtomicBoolean running = new AtomicBoolean();
  private volatile RunContext activeRun;

  @Autowired
  public IngestionOrchestrator(
      ProcessingLedger ledger,
      ChangeDetector changeDetector,
      DownloadStage downloadStage,
      ExtractionStage extractionStage,
      RenderingStage renderingStage,
      EmbeddingStage embeddingStage,
      IndexWriter indexWriter,
      StagingArea staging,
      AlertSink alertSink,
      StageExecutors executors,
      MeterRegistry meterRegistry,
      IngestionConfig ingestionConfig) {
    this(
        ledger,
        changeDetector,
        downloadStage,
        extractionStage,
        renderingStage,
        embeddingStage,
        indexWriter,
        staging,
        alertSink,
        executors,
        meterRegistry,
        Clock.systemUTC(),
        ingestionConfig.getAlerting().getFailureRateThreshold());
  }

  @VisibleForTesting
  public IngestionOrchestrator(
      ProcessingLedger ledger,
      ChangeDetector changeDetector,
      DownloadStage downloadStage,
      ExtractionStage extractionStage,
      RenderingStage renderingStage,
      EmbeddingStage embeddingStage,
      IndexWriter indexWriter,
      StagingArea staging,
      AlertSink alertSink,
      StageExecutors executors,
      MeterRegistry meterRegistry,
      Clock clock,
      double failureRateThreshold) {
    this.ledger = ledger;
    this.changeDetector = changeDetector;
    this.downloadStage = downloadStage;
    this.extractionStage = extractionStage;
    this.renderingStage = renderingStage;
    this.embeddingStage = embeddingStage;
    this.indexWriter = indexWriter;
    this.staging = staging;
    this.alertSink = alertSink;
    this.executors = executors;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
    this.failureRateThreshold = failureRateThreshold;
  }

  /**
   * Runs the pipeline once and waits for every queued document to settle.
   *
   * @param mode incremental or full
   * @return the run summary
   * @throws IngestionRunInProgressException if another run is active
   * @throws SystemicFailureException if the ledger, the index or the remote listing failed; the
   *     run was aborted
   */
  @Timed(value = "ingestion.run", description = "Time of a pipeline run")
  public BatchReport run(RunMode mode) {
    if (!running.compareAndSet(false, true)) {
      throw new IngestionRunInProgressException();
    }
    RunContext context = new RunContext();
    activeRun = context;
    try {
      return execute(mode, context);
    } finally {
      activeRun = null;
      running.set(false);
    }
  }

  /**
   * Signals the active run to stop issuing stage work.
   *
   * @return false if no run is active
   */
  public boolean cancel() {
    RunContext context = activeRun;
    if (context == null) {
      return false;
    }
    log.warn("Cancellation requested, in-flight stage work will finish");
    context.abort(null);
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  private BatchReport execute(RunMode mode, RunContext context) {
    Instant startedAt = clock.instant();
    log.info("Starting {} ingestion run", mode);

    List<SourceDocument> listing;
    try {
      listing = downloadStage.listDocuments();
    } catch (TransientStageException | ContentProcessingException e) {
      throw new SystemicFailureException(
          "download", "Remote listing unavailable: " + e.getMessage(), e);
    }
    ChangeSet changes = changeDetector.detect(listing, ledger.listAll(), mode);
    log.info(
        "Change detection ({}): {} listed, {} new, {} modified, {} unchanged, {} resumed, {}"
            + " deleted",
        mode,
        listing.size(),
        changes.newDocuments().size(),
        changes.modified().size(),
        changes.unchanged().size(),
        changes.resumed().size(),
        changes.deleted().size());

    int deleted = removeDeleted(changes.deleted(), context);

    List<DocumentJob> jobs = new ArrayList<>(changes.workCount());
    for (SourceDocument document : changes.newDocuments()) {
      jobs.add(queueNew(document));
    }
    for (ChangeSet.Candidate candidate : changes.modified()) {
      jobs.add(queueCandidate(candidate));
    }
    for (ChangeSet.Candidate candidate : changes.resumed()) {
      jobs.add(resume(candidate));
    }

    List<CompletableFuture<DocumentJob>> futures = new ArrayList<>(jobs.size());
    for (DocumentJob job : jobs) {
      futures.add(process(job, context));
    }
    CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

    BatchReport report =
        summarize(mode, startedAt, listing.size(), changes, deleted, jobs, context.isAborted());
    logSummary(report, context);
    raiseAlertIfNeeded(report);

    SystemicFailureException failure = context.failure();
    if (failure != null) {
      throw failure;
    }
    return report;
  }

  // ---- queueing ----

  private int removeDeleted(List<ProcessingRecord> records, RunContext context) {
    int removed = 0;
    for (ProcessingRecord record : records) {
      if (context.isAborted()) {
        break;
      }
      String remoteId = record.getRemoteId();
      indexWriter.delete(remoteId);
      staging.discardAll(stagingKeyOf(record));
      ledger.delete(remoteId);
      removed++;
      log.info("Removed {} ({}): no longer in the source", remoteId, record.getDisplayName());
    }
    return removed;
  }

  private DocumentJob queueNew(SourceDocument document) {
    String key = staging.stagingKey(document.remoteId());
    ProcessingRecord record =
        ProcessingRecord.builder()
            .remoteId(document.remoteId())
            .displayName(document.displayName())
            .remoteModifiedTime(document.modifiedTime())
            .size(document.size())
            .stagingKey(key)
            .status(ProcessingStatus.PENDING)
            .build();
    return new DocumentJob(document, ledger.upsert(record), key);
  }

  private DocumentJob queueCandidate(ChangeSet.Candidate candidate) {
    SourceDocument document = candidate.document();
    ProcessingRecord record = candidate.record().copy();
    record.requeue();
    record.setDisplayName(document.displayName());
    record.setRemoteModifiedTime(document.modifiedTime());
    record.setSize(document.size());
    record.setStagingKey(stagingKeyOf(record));
    return new DocumentJob(document, ledger.upsert(record), record.getStagingKey());
  }

  private DocumentJob resume(ChangeSet.Candidate candidate) {
    ProcessingRecord record = candidate.record();
    DocumentJob job = new DocumentJob(candidate.document(), record, stagingKeyOf(record));
    log.info(
        "Resuming {} ({}) at {} from status {}",
        record.getRemoteId(),
        record.getDisplayName(),
        job.getResumeStage(),
        record.getStatus());
    return job;
  }

  private String stagingKeyOf(ProcessingRecord record) {
    return record.getStagingKey() != null
        ? record.getStagingKey()
        : staging.stagingKey(record.getRemoteId());
  }

  // ---- per-document pipeline ----

  private CompletableFuture<DocumentJob> process(DocumentJob job, RunContext context) {
    CompletableFuture<DocumentJob> chain = CompletableFuture.completedFuture(job);
    for (PipelineStage stage : PipelineStage.values()) {
      if (stage.ordinal() < job.getResumeStage().ordinal()) {
        continue;
      }
      Executor executor = executors.forStage(stage);
      chain =
          chain.thenCompose(
              current ->
                  current.isFinished()
                      ? CompletableFuture.completedFuture(current)
                      : CompletableFuture.supplyAsync(
                          () -> runStage(stage, current, context), executor));
    }
    return chain.exceptionally(
        e -> {
          log.error(
              "Unexpected failure while processing {}, leaving it for the next run",
              job.getRemoteId(),
              e);
          job.finish(Outcome.CANCELLED);
          return job;
        });
  }

  private DocumentJob runStage(PipelineStage stage, DocumentJob job, RunContext context) {
    if (context.isAborted()) {
      job.finish(Outcome.CANCELLED);
      return job;
    }
    if (job.getRecord().getStartedAt() == null) {
      job.getRecord().setStartedAt(clock.instant());
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      switch (stage) {
        case DOWNLOAD -> download(job, context);
        case EXTRACT -> extract(job);
        case RENDER -> render(job, context);
        case EMBED -> embed(job, context);
        case INDEX -> index(job);
        case FINALIZE -> finalizeDocument(job);
      }
    } catch (SystemicFailureException e) {
      log.error(
          "[{}] systemic failure on {}, aborting run: {}",
          stage.metricName(),
          job.getRemoteId(),
          e.getMessage(),
          e);
      context.abort(e);
      job.finish(Outcome.CANCELLED);
    } catch (IngestionCancelledException e) {
      log.warn("[{}] {} cancelled: {}", stage.metricName(), job.getRemoteId(), e.getMessage());
      job.finish(Outcome.CANCELLED);
    } catch (RuntimeException e) {
      markFailed(job, stage, e, context);
    } finally {
      sample.stop(meterRegistry.timer("ingestion.stage.duration", "stage", stage.metricName()));
    }
    return job;
  }

  private void download(DocumentJob job, RunContext context) {
    SourceDocument document = job.getDocument();
    StagedDocument staged =
        downloadStage.download(
            document, job.getStagingKey(), retryListener(job, PipelineStage.DOWNLOAD, context));

    ProcessingRecord record = job.getRecord().copy();
    record.setContentHash(staged.contentHash());
    record.setDisplayName(document.displayName());
    record.setSize(document.size());
    if (document.modifiedTime() != null) {
      record.setRemoteModifiedTime(document.modifiedTime());
    }

    if (staged.contentHash().equals(record.getIndexedContentHash())) {
      staging.discard(job.getStagingKey());
      record.markSucceeded(clock.instant());
      job.setRecord(ledger.upsert(record));
      job.finish(Outcome.SHORT_CIRCUITED);
      log.info(
          "{} ({}) content unchanged, index entries kept",
          job.getRemoteId(),
          document.displayName());
      return;
    }
    record.setStatus(PipelineStage.DOWNLOAD.completedStatus());
    job.setRecord(ledger.upsert(record));
  }

  private void extract(DocumentJob job) {
    List<ContentUnit> units = extractionStage.extract(job.getRemoteId(), job.getStagingKey());
    job.setUnits(units);
    advance(job, PipelineStage.EXTRACT, record -> record.setUnitCount(units.size()));
  }

  private void render(DocumentJob job, RunContext context) {
    List<RenderedAsset> assets =
        renderingStage.render(
            job.getRemoteId(),
            job.getStagingKey(),
            job.getRecord().getContentHash(),
            unitsOf(job),
            retryListener(job, PipelineStage.RENDER, context));
    job.setAssets(assets);
    advance(job, PipelineStage.RENDER, record -> {});
  }

  private void embed(DocumentJob job, RunContext context) {
    List<EmbeddingVector> vectors =
        embeddingStage.embed(
            job.getRemoteId(),
            job.getStagingKey(),
            unitsOf(job),
            assetsOf(job),
            retryListener(job, PipelineStage.EMBED, context));
    job.setVectors(vectors);
    advance(job, PipelineStage.EMBED, record -> {});
  }

  private void index(DocumentJob job) {
    List<IndexPoint> points =
        IndexWriter.assemble(
            job.getRecord().getDisplayName(),
            job.getRecord().getContentHash(),
            unitsOf(job),
            assetsOf(job),
            vectorsOf(job),
            clock.instant());
    indexWriter.replace(job.getRemoteId(), points);
    advance(job, PipelineStage.INDEX, record -> {});
  }

  private void finalizeDocument(DocumentJob job) {
    String contentHash = job.getRecord().getContentHash();
    staging.pruneRenderedAssets(job.getStagingKey(), contentHash);
    staging.discard(job.getStagingKey());
    ProcessingRecord record = job.getRecord().copy();
    record.markSucceeded(clock.instant());
    job.setRecord(ledger.upsert(record));
    job.finish(Outcome.SUCCEEDED);
    log.info(
        "{} ({}) indexed: {} units in {} ms",
        job.getRemoteId(),
        record.getDisplayName(),
        record.getUnitCount(),
        record.getProcessingDurationMs());
  }

  private void advance(DocumentJob job, PipelineStage stage, Consumer<ProcessingRecord> changes) {
    ProcessingRecord record = job.getRecord().copy();
    changes.accept(record);
    record.setStatus(stage.completedStatus());
    job.setRecord(ledger.upsert(record));
  }

  private void markFailed(
      DocumentJob job, PipelineStage stage, RuntimeException cause, RunContext context) {
    String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName();
    if (cause instanceof TransientStageException || cause instanceof ContentProcessingException) {
      log.warn(
          "[{}] {} ({}) failed: {}",
          stage.metricName(),
          job.getRemoteId(),
          job.getDocument().displayName(),
          message);
    } else {
      log.error(
          "[{}] {} ({}) failed unexpectedly",
          stage.metricName(),
          job.getRemoteId(),
          job.getDocument().displayName(),
          cause);
    }
    ProcessingRecord record = job.getRecord().copy();
    record.markFailed(stage.metricName() + ": " + message, clock.instant());
    try {
      job.setRecord(ledger.upsert(record));
    } catch (SystemicFailureException e) {
      log.error("Cannot record failure of {}, aborting run", job.getRemoteId(), e);
      context.abort(e);
      job.finish(Outcome.CANCELLED);
      return;
    }
    job.fail(message);
  }

  private RetryListener retryListener(DocumentJob job, PipelineStage stage, RunContext context) {
    return (attempt, cause) -> {
      meterRegistry.counter("ingestion.stage.retries", "stage", stage.metricName()).increment();
      String message = cause != null ? cause.getMessage() : "unknown";
      try {
        ProcessingRecord stored =
            ledger.recordRetry(job.getRemoteId(), stage.metricName(), message);
        job.getRecord().setRetryCount(stored.getRetryCount());
      } catch (SystemicFailureException e) {
        log.error("Cannot record retry of {}, aborting run", job.getRemoteId(), e);
        context.abort(e);
      }
    };
  }

  private List<ContentUnit> unitsOf(DocumentJob job) {
    if (job.getUnits() == null) {
      job.setUnits(staging.readUnits(job.getStagingKey()));
    }
    return job.getUnits();
  }

  private List<RenderedAsset> assetsOf(DocumentJob job) {
    if (job.getAssets() == null) {
      job.setAssets(staging.readAssets(job.getStagingKey()));
    }
    return job.getAssets();
  }

  private List<EmbeddingVector> vectorsOf(DocumentJob job) {
    if (job.getVectors() == null) {
      job.setVectors(staging.readVectors(job.getStagingKey()));
    }
    return job.getVectors();
  }

  // ---- reporting ----

  private BatchReport summarize(
      RunMode mode,
      Instant startedAt,
      int listed,
      ChangeSet changes,
      int deleted,
      List<DocumentJob> jobs,
      boolean aborted) {
    int succeeded = 0;
    int shortCircuited = 0;
    int failed = 0;
    int cancelled = 0;
    long totalDurationMs = 0;
    int timed = 0;
    List<BatchReport.FailedDocument> failures = new ArrayList<>();
    for (DocumentJob job : jobs) {
      Outcome outcome = job.getOutcome() != null ? job.getOutcome() : Outcome.CANCELLED;
      meterRegistry.counter("ingestion.documents", "outcome", outcome.name()).increment();
      switch (outcome) {
        case SUCCEEDED -> {
          succeeded++;
          Long duration = job.getRecord().getProcessingDurationMs();
          if (duration != null) {
            totalDurationMs += duration;
            timed++;
          }
        }
        case SHORT_CIRCUITED -> shortCircuited++;
        case FAILED -> {
          failed++;
          failures.add(
              new BatchReport.FailedDocument(
                  job.getRemoteId(), job.getDocument().displayName(), job.getError()));
        }
        case CANCELLED -> cancelled++;
      }
    }
    int processed = succeeded + shortCircuited + failed;
    return BatchReport.builder()
        .mode(mode)
        .startedAt(startedAt)
        .finishedAt(clock.instant())
        .listed(listed)
        .newDocuments(changes.newDocuments().size())
        .modified(changes.modified().size())
        .unchanged(changes.unchanged().size())
        .resumed(changes.resumed().size())
        .deleted(deleted)
        .succeeded(succeeded)
        .shortCircuited(shortCircuited)
        .failed(failed)
        .cancelled(cancelled)
        .failures(List.copyOf(failures))
        .failureRate(processed == 0 ? 0.0 : (double) failed / processed)
        .averageDurationMs(timed == 0 ? 0 : totalDurationMs / timed)
        .aborted(aborted)
        .build();
  }

  private void logSummary(BatchReport report, RunContext context) {
    Duration elapsed = Duration.between(report.getStartedAt(), report.getFinishedAt());
    log.info("========== Ingestion run summary ({}) ==========", report.getMode());
    log.info(
        "Listed: {} | New: {} | Modified: {} | Unchanged: {} | Resumed: {} | Deleted: {}",
        report.getListed(),
        report.getNewDocuments(),
        report.getModified(),
        report.getUnchanged(),
        report.getResumed(),
        report.getDeleted());
    log.info(
        "Processed: {} | Succeeded: {} | Content unchanged: {} | Failed: {} | Cancelled: {}",
        report.getProcessed(),
        report.getSucceeded(),
        report.getShortCircuited(),
        report.getFailed(),
        report.getCancelled());
    log.info(
        "Duration: {} s | Failure rate: {} % | Average document time: {} ms",
        elapsed.toSeconds(),
        String.format("%.1f", report.getFailureRate() * 100),
        report.getAverageDurationMs());
    for (BatchReport.FailedDocument failure : report.getFailures()) {
      log.info("  FAILED {} ({}): {}", failure.remoteId(), failure.displayName(), failure.error());
    }
    if (report.isAborted()) {
      SystemicFailureException failure = context.failure();
      log.warn(
          "Run aborted{}, {} document(s) left for the next run",
          failure != null ? " by a systemic failure: " + failure.getMessage() : "",
          report.getCancelled());
    }
  }

  private void raiseAlertIfNeeded(BatchReport report) {
    if (report.getProcessed() == 0 || report.getFailureRate() <= failureRateThreshold) {
      return;
    }
    AlertSeverity severity =
        report.getFailureRate() >= 2 * failureRateThreshold
            ? AlertSeverity.CRITICAL
            : AlertSeverity.WARNING;
    String message =
        String.format(
            "Batch failure rate %.1f%% exceeds threshold %.1f%% (%d of %d documents failed)",
            report.getFailureRate() * 100,
            failureRateThreshold * 100,
            report.getFailed(),
            report.getProcessed());
    List<String> failedIds =
        report.getFailures().stream().map(BatchReport.FailedDocument::remoteId).toList();
    try {
      alertSink.send(
          new Alert(
              severity, message, report.getFailureRate(), failureRateThreshold, failedIds, report));
    } catch (RuntimeException e) {
      log.error("Alert delivery failed: {}", message, e);
    }
  }

  /** Abort signal and first systemic failure of one run. */
  private static final class RunContext {

    private final AtomicBoolean aborted = new AtomicBoolean();
    private final AtomicReference<SystemicFailureException> failure = new AtomicReference<>();

    boolean isAborted() {
      return aborted.get();
    }

    void abort(SystemicFailureException cause) {
      if (cause != null) {
        failure.compareAndSet(null, cause);
      }
      aborted.set(true);
    }

    SystemicFailureException failure() {
      return failure.get();
    }
  }
}
