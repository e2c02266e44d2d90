package com.flamingo.ai.deckindex.exception;

/** Exception thrown when a run is requested while another one is active. */
public class IngestionRunInProgressException extends RuntimeException {

  public IngestionRunInProgressException() {
    super("An ingestion run is already in progress");
  }
}
