package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.source.RemoteDocumentSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Remote source held in memory. Document content is text whose slides are separated by {@code
 * ---} lines. Fetch failures and a blocking gate can be scripted per document.
 */
public class FakeDocumentSource implements RemoteDocumentSource {

  private final Map<String, String> contents = new ConcurrentHashMap<>();
  private final Map<String, Instant> modifiedTimes = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> pendingFailures = new ConcurrentHashMap<>();
  private final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();
  private final AtomicInteger activeFetches = new AtomicInteger();
  private final AtomicInteger maxActiveFetches = new AtomicInteger();
  private volatile boolean listingUnavailable;
  private volatile String gatedId;
  private volatile CountDownLatch gateEntered = new CountDownLatch(1);
  private volatile CountDownLatch gateRelease = new CountDownLatch(0);

  /** Adds or replaces a document. */
  public void put(String remoteId, Instant modifiedTime, String... slides) {
    contents.put(remoteId, String.join("\n---\n", slides));
    modifiedTimes.put(remoteId, modifiedTime);
  }

  /** Changes only the reported modification time. */
  public void touch(String remoteId, Instant modifiedTime) {
    modifiedTimes.put(remoteId, modifiedTime);
  }

  public void remove(String remoteId) {
    contents.remove(remoteId);
    modifiedTimes.remove(remoteId);
  }

  /** Fails the next {@code count} fetches of {@code remoteId} with a transient error. */
  public void failFetches(String remoteId, int count) {
    pendingFailures.put(remoteId, new AtomicInteger(count));
  }

  /** Blocks fetches of {@code remoteId} until {@link #openGate()}. */
  public void gate(String remoteId) {
    gatedId = remoteId;
    gateEntered = new CountDownLatch(1);
    gateRelease = new CountDownLatch(1);
  }

  public boolean awaitGate() throws InterruptedException {
    return gateEntered.await(10, TimeUnit.SECONDS);
  }

  public void openGate() {
    gateRelease.countDown();
  }

  public void setListingUnavailable(boolean listingUnavailable) {
    this.listingUnavailable = listingUnavailable;
  }

  @Override
  public List<SourceDocument> listDocuments() {
    if (listingUnavailable) {
      throw new TransientStageException("download", "source unreachable");
    }
    List<SourceDocument> documents = new ArrayList<>();
    contents.keySet().stream()
        .sorted()
        .forEach(
            id ->
                documents.add(
                    new SourceDocument(
                        id, id, modifiedTimes.get(id), contents.get(id).length())));
    return documents;
  }

  @Override
  public void fetch(String remoteId, Path target) {
    int active = activeFetches.incrementAndGet();
    maxActiveFetches.accumulateAndGet(active, Math::max);
    try {
      fetches.computeIfAbsent(remoteId, k -> new AtomicInteger()).incrementAndGet();
      if (remoteId.equals(gatedId)) {
        gateEntered.countDown();
        awaitRelease();
      }
      AtomicInteger failures = pendingFailures.get(remoteId);
      if (failures != null && failures.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
        throw new TransientStageException("download", "connection reset");
      }
      String content = contents.get(remoteId);
      if (content == null) {
        throw new ContentProcessingException("download", "Document no longer exists");
      }
      Files.writeString(target, content, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    } finally {
      activeFetches.decrementAndGet();
    }
  }

  private void awaitRelease() {
    try {
      if (!gateRelease.await(10, TimeUnit.SECONDS)) {
        throw new IllegalStateException("gate never opened");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("interrupted at gate", e);
    }
  }

  @Override
  public List<String> allowedExtensions() {
    return List.of(".pptx");
  }

  public int fetchCount(String remoteId) {
    AtomicInteger count = fetches.get(remoteId);
    return count == null ? 0 : count.get();
  }

  public int maxActiveFetches() {
    return maxActiveFetches.get();
  }
}
