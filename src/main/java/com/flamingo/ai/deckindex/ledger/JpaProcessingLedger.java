package com.flamingo.ai.deckindex.ledger;

import com.flamingo.ai.deckindex.domain.entity.ProcessingEvent;
import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import com.flamingo.ai.deckindex.domain.repository.ProcessingEventRepository;
import com.flamingo.ai.deckindex.domain.repository.ProcessingRecordRepository;
import com.flamingo.ai.deckindex.exception.IllegalStatusTransitionException;
import com.flamingo.ai.deckindex.exception.ProcessingRecordNotFoundException;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Ledger backed by JPA. Each write runs in its own transaction and is retried briefly when the
 * database reports lock contention (SQLite allows a single writer).
 */
@Service
@Slf4j
public class JpaProcessingLedger implements ProcessingLedger {

  private static final int MAX_LOCK_RETRIES = 3;
  private static final long LOCK_RETRY_DELAY_MS = 100;
  private static final int MAX_ERROR_LENGTH = 4000;

  private final ProcessingRecordRepository recordRepository;
  private final ProcessingEventRepository eventRepository;
  private final TransactionTemplate writeTransaction;
  private final TransactionTemplate readTransaction;

  public JpaProcessingLedger(
      ProcessingRecordRepository recordRepository,
      ProcessingEventRepository eventRepository,
      PlatformTransactionManager transactionManager) {
    this.recordRepository = recordRepository;
    this.eventRepository = eventRepository;
    this.writeTransaction = new TransactionTemplate(transactionManager);
    this.writeTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    this.readTransaction = new TransactionTemplate(transactionManager);
    this.readTransaction.setReadOnly(true);
  }

  @Override
  public Optional<ProcessingRecord> get(String remoteId) {
    return read(() -> recordRepository.findById(remoteId).map(ProcessingRecord::copy));
  }

  @Override
  public ProcessingRecord upsert(ProcessingRecord record) {
    return write(
        "upsert " + record.getRemoteId(),
        () -> {
          Optional<ProcessingRecord> existing = recordRepository.findById(record.getRemoteId());
          ProcessingStatus previous = existing.map(ProcessingRecord::getStatus).orElse(null);
          if (previous != null && !previous.canTransitionTo(record.getStatus())) {
            throw new IllegalStatusTransitionException(
                record.getRemoteId(), previous, record.getStatus());
          }
          ProcessingRecord toSave = record.copy();
          toSave.setLastError(truncate(toSave.getLastError()));
          existing.ifPresent(stored -> toSave.setCreatedAt(stored.getCreatedAt()));
          ProcessingRecord saved = recordRepository.save(toSave);
          if (previous != record.getStatus()) {
            appendEvent(
                record.getRemoteId(),
                ProcessingEvent.Type.STATUS_CHANGE,
                previous,
                record.getStatus(),
                record.getStatus() == ProcessingStatus.FAILED ? saved.getLastError() : null);
          }
          return saved.copy();
        });
  }

  @Override
  public ProcessingRecord recordRetry(String remoteId, String stage, String cause) {
    return write(
        "retry " + remoteId,
        () -> {
          ProcessingRecord stored =
              recordRepository
                  .findById(remoteId)
                  .orElseThrow(() -> new ProcessingRecordNotFoundException(remoteId));
          stored.setRetryCount(stored.getRetryCount() + 1);
          ProcessingRecord saved = recordRepository.save(stored);
          appendEvent(
              remoteId,
              ProcessingEvent.Type.RETRY,
              stored.getStatus(),
              stored.getStatus(),
              truncate(stage + ": " + cause));
          return saved.copy();
        });
  }

  @Override
  public List<ProcessingRecord> listByStatus(ProcessingStatus status) {
    return read(
        () ->
            recordRepository.findByStatusOrderByRemoteIdAsc(status).stream()
                .map(ProcessingRecord::copy)
                .toList());
  }

  @Override
  public List<ProcessingRecord> listAll() {
    return read(
        () ->
            recordRepository.findAllByOrderByRemoteIdAsc().stream()
                .map(ProcessingRecord::copy)
                .toList());
  }

  @Override
  public int resetFailed() {
    int count =
        write(
            "reset failed",
            () -> {
              List<ProcessingRecord> failed =
                  recordRepository.findByStatusOrderByRemoteIdAsc(ProcessingStatus.FAILED);
              for (ProcessingRecord record : failed) {
                String lastError = record.getLastError();
                record.requeue();
                appendEvent(
                    record.getRemoteId(),
                    ProcessingEvent.Type.RESET,
                    ProcessingStatus.FAILED,
                    ProcessingStatus.PENDING,
                    lastError);
              }
              recordRepository.saveAll(failed);
              return failed.size();
            });
    log.info("Reset {} failed record(s) to PENDING", count);
    return count;
  }

  @Override
  public void delete(String remoteId) {
    write(
        "delete " + remoteId,
        () -> {
          recordRepository.deleteById(remoteId);
          appendEvent(remoteId, ProcessingEvent.Type.DELETED, null, null, null);
          return null;
        });
  }

  @Override
  public List<ProcessingEvent> events(String remoteId) {
    return read(() -> eventRepository.findByRemoteIdOrderByIdAsc(remoteId));
  }

  @Override
  public LedgerStatistics statistics() {
    return read(
        () -> {
          Map<ProcessingStatus, Long> byStatus = new EnumMap<>(ProcessingStatus.class);
          for (ProcessingStatus status : ProcessingStatus.values()) {
            byStatus.put(status, 0L);
          }
          long total = 0;
          for (Object[] row : recordRepository.countGroupedByStatus()) {
            long count = ((Number) row[1]).longValue();
            byStatus.put((ProcessingStatus) row[0], count);
            total += count;
          }
          Long units = recordRepository.sumUnitCountByStatus(ProcessingStatus.SUCCESS);
          Double average = recordRepository.averageDurationByStatus(ProcessingStatus.SUCCESS);
          return new LedgerStatistics(
              total,
              byStatus,
              units != null ? units.longValue() : 0L,
              average != null ? average : 0.0,
              recordRepository.findLatestFinishedAt());
        });
  }

  private void appendEvent(
      String remoteId,
      ProcessingEvent.Type type,
      ProcessingStatus from,
      ProcessingStatus to,
      String message) {
    eventRepository.save(
        ProcessingEvent.builder()
            .remoteId(remoteId)
            .eventType(type)
            .fromStatus(from)
            .toStatus(to)
            .message(message)
            .build());
  }

  private <T> T read(Supplier<T> query) {
    try {
      return readTransaction.execute(status -> query.get());
    } catch (DataAccessException | TransactionException e) {
      throw new SystemicFailureException("ledger", "Ledger read failed: " + e.getMessage(), e);
    }
  }

  private <T> T write(String operation, Supplier<T> mutation) {
    for (int attempt = 1; ; attempt++) {
      try {
        return writeTransaction.execute(status -> mutation.get());
      } catch (CannotAcquireLockException e) {
        if (attempt >= MAX_LOCK_RETRIES) {
          log.error("Ledger {} failed after {} lock retries", operation, attempt);
          throw new SystemicFailureException(
              "ledger", "Ledger is locked: " + e.getMessage(), e);
        }
        log.warn(
            "Ledger lock contention on {} (attempt {}/{}), retrying",
            operation,
            attempt,
            MAX_LOCK_RETRIES);
        sleepBeforeRetry(attempt, e);
      } catch (DataAccessException | TransactionException e) {
        log.error("Ledger {} failed: {}", operation, e.getMessage());
        throw new SystemicFailureException("ledger", "Ledger write failed: " + e.getMessage(), e);
      }
    }
  }

  private void sleepBeforeRetry(int attempt, CannotAcquireLockException cause) {
    try {
      Thread.sleep(LOCK_RETRY_DELAY_MS * attempt);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new SystemicFailureException("ledger", "Interrupted while waiting for ledger", cause);
    }
  }

  private static String truncate(String message) {
    if (message == null || message.length() <= MAX_ERROR_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_ERROR_LENGTH);
  }
}
