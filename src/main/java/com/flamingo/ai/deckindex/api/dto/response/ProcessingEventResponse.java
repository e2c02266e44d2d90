package com.flamingo.ai.deckindex.api.dto.response;

import com.flamingo.ai.deckindex.domain.entity.ProcessingEvent;
import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;
import java.time.Instant;

/** One audit entry of a ledger record. */
public record ProcessingEventResponse(
    ProcessingEvent.Type type,
    ProcessingStatus fromStatus,
    ProcessingStatus toStatus,
    String message,
    Instant createdAt) {

  public static ProcessingEventResponse fromEntity(ProcessingEvent event) {
    return new ProcessingEventResponse(
        event.getEventType(),
        event.getFromStatus(),
        event.getToStatus(),
        event.getMessage(),
        event.getCreatedAt());
  }
}
