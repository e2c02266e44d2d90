package com.flamingo.ai.deckindex.exception;

/** The document content cannot be processed. Never retried. */
public class ContentProcessingException extends IngestionException {

  public ContentProcessingException(String stage, String message) {
    super(stage, message);
  }

  public ContentProcessingException(String stage, String message, Throwable cause) {
    super(stage, message, cause);
  }
}
