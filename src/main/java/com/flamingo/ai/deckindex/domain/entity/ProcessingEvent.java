package com.flamingo.ai.deckindex.domain.entity;

import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Audit trail entry for a ledger record. */
@Entity
@Table(
    name = "processing_events",
    indexes = @Index(name = "idx_processing_events_remote_id", columnList = "remote_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessingEvent {

  /** Event types written by the ledger. */
  public enum Type {
    STATUS_CHANGE,
    RETRY,
    RESET,
    DELETED
  }

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "remote_id", nullable = false, length = 1024)
  private String remoteId;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private Type eventType;

  @Enumerated(EnumType.STRING)
  @Column(length = 16)
  private ProcessingStatus fromStatus;

  @Enumerated(EnumType.STRING)
  @Column(length = 16)
  private ProcessingStatus toStatus;

  @Column(columnDefinition = "TEXT")
  private String message;

  @Column(nullable = false, updatable = false)
  private Instant createdAt;

  @PrePersist
  protected void onCreate() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
