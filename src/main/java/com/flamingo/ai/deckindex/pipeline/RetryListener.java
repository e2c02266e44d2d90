package com.flamingo.ai.deckindex.pipeline;

/** Receives one callback per retry of a stage operation. */
@FunctionalInterface
public interface RetryListener {

  RetryListener NONE = (attempt, cause) -> {};

  /**
   * Called before the next attempt is made.
   *
   * @param attempt number of the retry, starting at 1
   * @param cause failure of the previous attempt
   */
  void onRetry(int attempt, Throwable cause);
}
