package com.flamingo.ai.deckindex.exception;

/** A failure that may succeed on a later attempt. Retried by the stage's retry policy. */
public class TransientStageException extends IngestionException {

  public TransientStageException(String stage, String message) {
    super(stage, message);
  }

  public TransientStageException(String stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
