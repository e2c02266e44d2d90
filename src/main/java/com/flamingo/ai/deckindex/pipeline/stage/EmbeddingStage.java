package com.flamingo.ai.deckindex.pipeline.stage;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.EmbeddingVector;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.embedding.EmbeddingInput;
import com.flamingo.ai.deckindex.embedding.UnitEmbedder;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.pipeline.RetryListener;
import com.flamingo.ai.deckindex.pipeline.StageRetryPolicy;
import com.flamingo.ai.deckindex.staging.StagingArea;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.Lists;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Computes every configured vector kind for the units of a document and stages the vectors.
 *
 * <p>Units are sent in batches. When a batch still fails after its retries, each unit of the batch
 * is embedded on its own so one bad unit cannot fail its neighbours. Units that still fail are left
 * without that vector kind; the document fails when every attempted unit failed or the failed share
 * exceeds the configured ratio.
 */
@Component
@Slf4j
public class EmbeddingStage {

  private static final String STAGE = "embed";

  private final List<UnitEmbedder> embedders;
  private final StagingArea staging;
  private final MeterRegistry meterRegistry;
  private final StageRetryPolicy retryPolicy;
  private final int batchSize;
  private final double maxFailedUnitRatio;

  @Autowired
  public EmbeddingStage(
      List<UnitEmbedder> embedders,
      StagingArea staging,
      MeterRegistry meterRegistry,
      IngestionConfig ingestionConfig) {
    this(
        embedders,
        staging,
        meterRegistry,
        new StageRetryPolicy(STAGE, ingestionConfig.getEmbedding().getRetry()),
        ingestionConfig.getEmbedding().getBatchSize(),
        ingestionConfig.getEmbedding().getMaxFailedUnitRatio());
  }

  @VisibleForTesting
  public EmbeddingStage(
      List<UnitEmbedder> embedders,
      StagingArea staging,
      MeterRegistry meterRegistry,
      StageRetryPolicy retryPolicy,
      int batchSize,
      double maxFailedUnitRatio) {
    this.embedders = List.copyOf(embedders);
    this.staging = staging;
    this.meterRegistry = meterRegistry;
    this.retryPolicy = retryPolicy;
    this.batchSize = Math.max(1, batchSize);
    this.maxFailedUnitRatio = maxFailedUnitRatio;
  }

  public List<EmbeddingVector> embed(
      String remoteId,
      String stagingKey,
      List<ContentUnit> units,
      List<RenderedAsset> assets,
      RetryListener listener) {
    Map<Integer, RenderedAsset> assetsByUnit = new HashMap<>();
    for (RenderedAsset asset : assets) {
      assetsByUnit.put(asset.unitIndex(), asset);
    }
    List<EmbeddingInput> inputs = new ArrayList<>(units.size());
    for (ContentUnit unit : units) {
      inputs.add(new EmbeddingInput(unit, assetsByUnit.get(unit.unitIndex())));
    }

    List<EmbeddingVector> vectors = new ArrayList<>();
    Set<Integer> attempted = new LinkedHashSet<>();
    Set<Integer> failed = new LinkedHashSet<>();
    for (UnitEmbedder embedder : embedders) {
      List<EmbeddingInput> accepted = inputs.stream().filter(embedder::accepts).toList();
      accepted.forEach(input -> attempted.add(input.unit().unitIndex()));
      for (List<EmbeddingInput> batch : Lists.partition(accepted, batchSize)) {
        embedBatch(remoteId, embedder, batch, listener, vectors, failed);
      }
    }

    checkFailureShare(remoteId, attempted.size(), failed);
    if (attempted.isEmpty()) {
      log.warn("{} has no unit with embeddable content", remoteId);
    }
    staging.writeVectors(stagingKey, vectors);
    return vectors;
  }

  private void embedBatch(
      String remoteId,
      UnitEmbedder embedder,
      List<EmbeddingInput> batch,
      RetryListener listener,
      List<EmbeddingVector> vectors,
      Set<Integer> failed) {
    try {
      List<List<Float>> batchVectors =
          retryPolicy.execute(remoteId, () -> embedder.embedBatch(batch), listener);
      for (int i = 0; i < batch.size(); i++) {
        vectors.add(toVector(embedder, batch.get(i), batchVectors.get(i)));
      }
      return;
    } catch (TransientStageException | ContentProcessingException e) {
      if (batch.size() == 1) {
        recordUnitFailure(remoteId, embedder, batch.get(0), e, failed);
        return;
      }
      log.warn(
          "{} batch of {} units failed for {}, embedding units one by one: {}",
          embedder.kind(),
          batch.size(),
          remoteId,
          e.getMessage());
    }
    for (EmbeddingInput input : batch) {
      try {
        vectors.add(toVector(embedder, input, embedder.embed(input)));
      } catch (TransientStageException | ContentProcessingException e) {
        recordUnitFailure(remoteId, embedder, input, e, failed);
      }
    }
  }

  private void recordUnitFailure(
      String remoteId,
      UnitEmbedder embedder,
      EmbeddingInput input,
      RuntimeException cause,
      Set<Integer> failed) {
    log.warn(
        "{} embedding of unit {} of {} failed: {}",
        embedder.kind(),
        input.unit().unitIndex(),
        remoteId,
        cause.getMessage());
    meterRegistry.counter("embedding.units.failed", "kind", embedder.kind().name()).increment();
    failed.add(input.unit().unitIndex());
  }

  private void checkFailureShare(String remoteId, int attempted, Set<Integer> failed) {
    if (failed.isEmpty()) {
      return;
    }
    double share = (double) failed.size() / attempted;
    if (failed.size() == attempted || share > maxFailedUnitRatio) {
      throw new TransientStageException(
          STAGE,
          String.format(
              "Embedding failed for %d of %d units (units %s)", failed.size(), attempted, failed));
    }
    log.warn(
        "{} indexed without vectors for {} of {} units: {}",
        remoteId,
        failed.size(),
        attempted,
        failed);
  }

  private static EmbeddingVector toVector(
      UnitEmbedder embedder, EmbeddingInput input, List<Float> vector) {
    ContentUnit unit = input.unit();
    return new EmbeddingVector(
        unit.remoteId(), unit.unitIndex(), unit.chunkId(), embedder.kind(), vector);
  }
}
