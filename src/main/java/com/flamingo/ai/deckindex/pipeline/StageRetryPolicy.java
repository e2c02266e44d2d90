package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.exception.IngestionCancelledException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.concurrent.Callable;
import lombok.extern.slf4j.Slf4j;

/**
 * Retry policy of one pipeline stage: a capped number of attempts with exponential backoff.
 *
 * <p>Only {@link TransientStageException} is retried. Content errors and systemic failures pass
 * through on the first occurrence; when the attempts are exhausted the last transient failure is
 * rethrown.
 */
@Slf4j
public class StageRetryPolicy {

  private final String stage;
  private final RetryConfig retryConfig;

  public StageRetryPolicy(String stage, IngestionConfig.Retry settings) {
    this.stage = stage;
    this.retryConfig =
        RetryConfig.custom()
            .maxAttempts(Math.max(1, settings.getMaxAttempts()))
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    settings.getInitialBackoffMs(),
                    settings.getMultiplier(),
                    settings.getMaxBackoffMs()))
            .retryOnException(TransientStageException.class::isInstance)
            .build();
  }

  public String getStage() {
    return stage;
  }

  public int getMaxAttempts() {
    return retryConfig.getMaxAttempts();
  }

  /**
   * Runs {@code action} under this policy.
   *
   * @param remoteId document the action works on, for logging
   * @param action the operation
   * @param listener notified before every retry
   * @return the action's result
   */
  public <T> T execute(String remoteId, Callable<T> action, RetryListener listener) {
    Retry retry = Retry.of(stage + ":" + remoteId, retryConfig);
    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              Throwable cause = event.getLastThrowable();
              log.warn(
                  "[{}] {} attempt {} failed, retrying in {} ms: {}",
                  stage,
                  remoteId,
                  event.getNumberOfRetryAttempts(),
                  event.getWaitInterval().toMillis(),
                  cause != null ? cause.getMessage() : "unknown");
              listener.onRetry(event.getNumberOfRetryAttempts(), cause);
            });
    try {
      return retry.executeCallable(action);
    } catch (RuntimeException e) {
      throw e;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IngestionCancelledException(stage, "Interrupted while processing " + remoteId);
    } catch (Exception e) {
      throw new TransientStageException(
          stage, stage + " failed for " + remoteId + ": " + e.getMessage(), e);
    }
  }
}
