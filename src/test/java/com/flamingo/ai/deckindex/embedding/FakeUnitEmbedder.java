package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Text embedder producing a two-dimensional vector per unit. A call fails when any of its inputs
 * contains a poisoned marker, or while transient failures are scheduled.
 */
public class FakeUnitEmbedder implements UnitEmbedder {

  private final Set<String> poisonMarkers = ConcurrentHashMap.newKeySet();
  private final AtomicInteger pendingFailures = new AtomicInteger();
  private final AtomicInteger calls = new AtomicInteger();
  private final AtomicInteger active = new AtomicInteger();
  private final AtomicInteger maxActive = new AtomicInteger();
  private volatile long callMillis;

  @Override
  public VectorKind kind() {
    return VectorKind.TEXT;
  }

  @Override
  public boolean accepts(EmbeddingInput input) {
    return input.unit().hasContent();
  }

  @Override
  public List<List<Float>> embedBatch(List<EmbeddingInput> inputs) {
    int current = active.incrementAndGet();
    maxActive.accumulateAndGet(current, Math::max);
    try {
      calls.incrementAndGet();
      pause();
      if (pendingFailures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
        throw new TransientStageException("embed", "provider unavailable");
      }
      List<List<Float>> vectors = new ArrayList<>();
      for (EmbeddingInput input : inputs) {
        String text = input.unit().text();
        if (poisonMarkers.stream().anyMatch(text::contains)) {
          throw new TransientStageException("embed", "provider rejected " + text);
        }
        vectors.add(List.of((float) input.unit().unitIndex(), (float) text.length()));
      }
      return vectors;
    } finally {
      active.decrementAndGet();
    }
  }

  private void pause() {
    if (callMillis <= 0) {
      return;
    }
    try {
      Thread.sleep(callMillis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransientStageException("embed", "interrupted");
    }
  }

  /** Fails every call whose inputs contain {@code marker}. */
  public void poison(String marker) {
    poisonMarkers.add(marker);
  }

  /** Fails the next {@code count} calls. */
  public void failNext(int count) {
    pendingFailures.set(count);
  }

  /** Makes every call take {@code millis} so overlapping calls become visible. */
  public void setCallMillis(long millis) {
    this.callMillis = millis;
  }

  public int calls() {
    return calls.get();
  }

  /** Highest number of calls observed in flight at once. */
  public int maxActive() {
    return maxActive.get();
  }
}
