package com.flamingo.ai.deckindex.alert;

/** Receives batch alerts. */
public interface AlertSink {

  void send(Alert alert);
}
