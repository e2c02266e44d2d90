package com.flamingo.ai.deckindex.rendering;

import com.google.common.annotations.VisibleForTesting;
import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/**
 * Process-wide single-slot handle on the {@link RenderEngine}.
 *
 * <p>Rendering requires a {@link RenderLease} obtained from {@link #acquire()}; at most one lease
 * exists at any time and waiters are served in arrival order. The engine session is opened lazily
 * by the first lease and kept open across leases. A lease marked broken discards the session on
 * release, so the next lease starts a fresh one.
 *
 * <p>Overlapping render calls are detected independently of the permit and fail with {@link
 * IllegalStateException}.
 */
@Slf4j
public class ExclusiveRenderResource {

  private static final long SHUTDOWN_WAIT_SECONDS = 30;

  private final RenderEngine engine;
  private final Semaphore slot = new Semaphore(1, true);
  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger peakInFlight = new AtomicInteger();
  private final AtomicInteger sessionsOpened = new AtomicInteger();

  // Guarded by the slot permit
  private boolean sessionOpen;
  private RenderLease currentLease;

  public ExclusiveRenderResource(RenderEngine engine) {
    this.engine = engine;
  }

  /**
   * Waits for the slot and opens the engine session if none is active.
   *
   * @return the lease, to be closed by the caller
   * @throws InterruptedException if interrupted while waiting; no lease is held
   * @throws com.flamingo.ai.deckindex.exception.RenderingResourceException if the session cannot
   *     be opened; no lease is held
   */
  public RenderLease acquire() throws InterruptedException {
    slot.acquire();
    try {
      if (!sessionOpen) {
        engine.open();
        sessionOpen = true;
        sessionsOpened.incrementAndGet();
      }
      currentLease = new RenderLease(this);
      return currentLease;
    } catch (RuntimeException e) {
      slot.release();
      throw e;
    }
  }

  List<Path> render(RenderLease lease, Path source, Path outputDirectory) {
    if (lease != currentLease) {
      throw new IllegalStateException("Render attempted without holding the render slot");
    }
    int current = inFlight.incrementAndGet();
    peakInFlight.accumulateAndGet(current, Math::max);
    try {
      if (current > 1) {
        throw new IllegalStateException(current + " render operations in flight");
      }
      return engine.render(source, outputDirectory);
    } finally {
      inFlight.decrementAndGet();
    }
  }

  void release(RenderLease lease) {
    if (lease != currentLease) {
      throw new IllegalStateException("Releasing a render lease that is not current");
    }
    try {
      if (lease.isBroken()) {
        log.warn("Discarding {} render session after resource fault", engine.name());
        closeSession();
      }
    } finally {
      currentLease = null;
      slot.release();
    }
  }

  private void closeSession() {
    if (!sessionOpen) {
      return;
    }
    sessionOpen = false;
    try {
      engine.close();
    } catch (RuntimeException e) {
      log.warn("Closing {} render session failed: {}", engine.name(), e.getMessage(), e);
    }
  }

  /** Closes the engine session once the current holder, if any, is done. */
  @PreDestroy
  public void shutdown() throws InterruptedException {
    if (!slot.tryAcquire(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
      log.warn("Render slot still held after {}s, closing session anyway", SHUTDOWN_WAIT_SECONDS);
      closeSession();
      return;
    }
    try {
      closeSession();
    } finally {
      slot.release();
    }
  }

  public String engineName() {
    return engine.name();
  }

  /** Highest number of simultaneous render calls observed so far. */
  @VisibleForTesting
  public int peakInFlight() {
    return peakInFlight.get();
  }

  @VisibleForTesting
  public int sessionsOpened() {
    return sessionsOpened.get();
  }

  @VisibleForTesting
  public boolean isHeld() {
    return slot.availablePermits() == 0;
  }
}
