package com.flamingo.ai.deckindex.api.dto.response;

import com.flamingo.ai.deckindex.domain.entity.ProcessingRecord;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a ledger record. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProcessingRecordResponse {

  private String remoteId;
  private String displayName;
  private ProcessingStatus status;
  private String contentHash;
  private String indexedContentHash;
  private Instant remoteModifiedTime;
  private Long size;
  private int retryCount;
  private String lastError;
  private Instant startedAt;
  private Instant finishedAt;
  private Integer unitCount;
  private Long processingDurationMs;
  private Instant updatedAt;

  public static ProcessingRecordResponse fromEntity(ProcessingRecord record) {
    return ProcessingRecordResponse.builder()
        .remoteId(record.getRemoteId())
        .displayName(record.getDisplayName())
        .status(record.getStatus())
        .contentHash(record.getContentHash())
        .indexedContentHash(record.getIndexedContentHash())
        .remoteModifiedTime(record.getRemoteModifiedTime())
        .size(record.getSize())
        .retryCount(record.getRetryCount())
        .lastError(record.getLastError())
        .startedAt(record.getStartedAt())
        .finishedAt(record.getFinishedAt())
        .unitCount(record.getUnitCount())
        .processingDurationMs(record.getProcessingDurationMs())
        .updatedAt(record.getUpdatedAt())
        .build();
  }
}
