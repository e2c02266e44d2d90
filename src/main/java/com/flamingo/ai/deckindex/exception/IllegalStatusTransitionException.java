package com.flamingo.ai.deckindex.exception;

import com.flamingo.ai.deckindex.domain.enums.ProcessingStatus;

/** Exception thrown when a ledger write would move a record along an illegal transition. */
public class IllegalStatusTransitionException extends IllegalStateException {

  private final String remoteId;
  private final ProcessingStatus from;
  private final ProcessingStatus to;

  public IllegalStatusTransitionException(
      String remoteId, ProcessingStatus from, ProcessingStatus to) {
    super("Illegal status transition for " + remoteId + ": " + from + " -> " + to);
    this.remoteId = remoteId;
    this.from = from;
    this.to = to;
  }

  public String getRemoteId() {
    return remoteId;
  }

  public ProcessingStatus getFrom() {
    return from;
  }

  public ProcessingStatus getTo() {
    return to;
  }
}
