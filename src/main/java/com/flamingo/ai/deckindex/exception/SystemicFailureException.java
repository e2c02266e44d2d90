package com.flamingo.ai.deckindex.exception;

/**
 * A failure that affects every document, such as an unavailable ledger or an unreachable index.
 * Aborts the running batch instead of failing a single document.
 */
public class SystemicFailureException extends IngestionException {

  public SystemicFailureException(String stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
