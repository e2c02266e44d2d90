package com.flamingo.ai.deckindex.exception;

/** Exception thrown when the ledger has no record for a remote id. */
public class ProcessingRecordNotFoundException extends RuntimeException {

  private final String remoteId;

  public ProcessingRecordNotFoundException(String remoteId) {
    super("Processing record not found: " + remoteId);
    this.remoteId = remoteId;
  }

  public String getRemoteId() {
    return remoteId;
  }
}
