package com.flamingo.ai.deckindex.exception;

/** Base class of all pipeline failures. */
public abstract class IngestionException extends RuntimeException {

  private final String stage;

  protected IngestionException(String stage, String message) {
    super(message);
    this.stage = stage;
  }

  protected IngestionException(String stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = stage;
  }

  /** Pipeline stage that raised the failure, or {@code null} outside of a stage. */
  public String getStage() {
    return stage;
  }
}
