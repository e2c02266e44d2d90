package com.flamingo.ai.deckindex.exception;

/** Stage work stopped because the batch was cancelled or the worker was interrupted. */
public class IngestionCancelledException extends IngestionException {

  public IngestionCancelledException(String stage, String message) {
    super(stage, message);
  }
}
