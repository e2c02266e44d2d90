package com.flamingo.ai.deckindex.pipeline.stage;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.RenderingResourceException;
import com.flamingo.ai.deckindex.pipeline.RetryListener;
import com.flamingo.ai.deckindex.pipeline.StageRetryPolicy;
import com.flamingo.ai.deckindex.rendering.ExclusiveRenderResource;
import com.flamingo.ai.deckindex.rendering.RenderLease;
import com.flamingo.ai.deckindex.staging.StagingArea;
import com.google.common.annotations.VisibleForTesting;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders a staged document to one image per unit through the exclusive render resource.
 *
 * <p>Every attempt holds a lease for exactly one document and releases it on every exit path. A
 * fault of the resource itself marks the lease broken, so the retry runs against a freshly opened
 * session. Content errors are not retried.
 */
@Component
public class RenderingStage {

  private static final String STAGE = "render";

  private final StagingArea staging;
  private final ExclusiveRenderResource renderResource;
  private final StageRetryPolicy retryPolicy;

  @Autowired
  public RenderingStage(
      StagingArea staging,
      ExclusiveRenderResource renderResource,
      IngestionConfig ingestionConfig) {
    this(
        staging,
        renderResource,
        new StageRetryPolicy(STAGE, ingestionConfig.getRendering().getRetry()));
  }

  @VisibleForTesting
  public RenderingStage(
      StagingArea staging, ExclusiveRenderResource renderResource, StageRetryPolicy retryPolicy) {
    this.staging = staging;
    this.renderResource = renderResource;
    this.retryPolicy = retryPolicy;
  }

  /**
   * Renders the document and stages the asset list.
   *
   * @param remoteId the document
   * @param stagingKey its staging key
   * @param contentHash hash of the staged bytes, names the asset directory
   * @param units the extracted units, in order
   * @param listener notified before each retry
   * @return one asset per unit, in unit order
   * @throws ContentProcessingException if the image count differs from the unit count
   */
  public List<RenderedAsset> render(
      String remoteId,
      String stagingKey,
      String contentHash,
      List<ContentUnit> units,
      RetryListener listener) {
    Path source = StagedFiles.sourceFile(staging, remoteId, stagingKey, STAGE);
    List<Path> images =
        retryPolicy.execute(
            remoteId,
            () -> {
              Path outputDirectory = staging.prepareRenderDirectory(stagingKey, contentHash);
              try (RenderLease lease = renderResource.acquire()) {
                try {
                  return lease.render(source, outputDirectory);
                } catch (RenderingResourceException e) {
                  lease.markBroken();
                  throw e;
                }
              }
            },
            listener);

    if (images.size() != units.size()) {
      throw new ContentProcessingException(
          STAGE,
          "Rendered "
              + images.size()
              + " images for "
              + units.size()
              + " units of "
              + remoteId
              + ", slides cannot be matched");
    }
    List<RenderedAsset> assets = new ArrayList<>(units.size());
    for (int i = 0; i < units.size(); i++) {
      ContentUnit unit = units.get(i);
      assets.add(new RenderedAsset(remoteId, unit.unitIndex(), images.get(i).toString()));
    }
    staging.writeAssets(stagingKey, assets);
    return assets;
  }
}
