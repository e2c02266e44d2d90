package com.flamingo.ai.deckindex.elasticsearch;

/** An index request failed or was partially rejected. */
public class IndexOperationException extends RuntimeException {

  public IndexOperationException(String message) {
    super(message);
  }

  public IndexOperationException(String message, Throwable cause) {
    super(message, cause);
  }
}
