package com.flamingo.ai.deckindex.domain.repository;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import java.time.Instant;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for ledger records. */
@Repository
public interface ProcessingRecordRepository extends JpaRepository<ProcessingRecord, String> {

  List<ProcessingRecord> findByStatusOrderByRemoteIdAsc(ProcessingStatus status);

  List<ProcessingRecord> findAllByOrderByRemoteIdAsc();

  @Query("SELECT r.status, COUNT(r) FROM ProcessingRecord r GROUP BY r.status")
  List<Object[]> countGroupedByStatus();

  @Query("SELECT SUM(r.unitCount) FROM ProcessingRecord r WHERE r.status = :status")
  Long sumUnitCountByStatus(@Param("status") ProcessingStatus status);

  @Query("SELECT AVG(r.processingDurationMs) FROM ProcessingRecord r WHERE r.status = :status")
  Double averageDurationByStatus(@Param("status") ProcessingStatus status);

  @Query("SELECT MAX(r.finishedAt) FROM ProcessingRecord r")
  Instant findLatestFinishedAt();
}
