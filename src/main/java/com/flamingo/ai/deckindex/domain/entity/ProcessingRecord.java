package com.flamingo.ai.deckindex.domain.entity;

import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Duration;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Durable processing state of one remote document, keyed by its remote id. */
@Entity
@Table(
    name = "processing_records",
    indexes = @Index(name = "idx_processing_records_status", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ProcessingRecord {

  @Id
  @Column(name = "remote_id", nullable = false, length = 1024)
  private String remoteId;

  @Column(nullable = false, length = 1024)
  private String displayName;

  /** Modification time observed when the record was last queued or confirmed. */
  private Instant remoteModifiedTime;

  private Long size;

  /** Hash of the bytes currently staged or last processed. */
  @Column(length = 64)
  private String contentHash;

  /** Hash of the bytes whose index entries are live. */
  @Column(length = 64)
  private String indexedContentHash;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  @Builder.Default
  private ProcessingStatus status = ProcessingStatus.PENDING;

  @Builder.Default private int retryCount = 0;

  @Column(columnDefinition = "TEXT")
  private String lastError;

  private Instant startedAt;

  private Instant finishedAt;

  /** Number of content units (slides or pages) in the last processed version. */
  private Integer unitCount;

  private Long processingDurationMs;

  @Column(length = 64)
  private String stagingKey;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  private Instant updatedAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    updatedAt = createdAt;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = Instant.now();
  }

  /** Puts the record back in the queue after a detected change or an explicit reset. */
  public void requeue() {
    this.status = ProcessingStatus.PENDING;
    this.retryCount = 0;
    this.lastError = null;
    this.startedAt = null;
    this.finishedAt = null;
    this.processingDurationMs = null;
  }

  /** Marks the record as failed with the given error message. */
  public void markFailed(String error, Instant now) {
    this.status = ProcessingStatus.FAILED;
    this.lastError = error;
    finish(now);
  }

  /** Marks the record as successfully indexed for its current content hash. */
  public void markSucceeded(Instant now) {
    this.status = ProcessingStatus.SUCCESS;
    this.indexedContentHash = this.contentHash;
    this.lastError = null;
    finish(now);
  }

  private void finish(Instant now) {
    this.finishedAt = now;
    if (startedAt != null) {
      this.processingDurationMs = Duration.between(startedAt, now).toMillis();
    }
  }

  /** Returns a detached copy of this record. */
  public ProcessingRecord copy() {
    return toBuilder().build();
  }
}
