package com.flamingo.ai.deckindex.pipeline.stage;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.domain.model.StagedDocument;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.pipeline.RetryListener;
import com.flamingo.ai.deckindex.pipeline.StageRetryPolicy;
import com.flamingo.ai.deckindex.source.RemoteDocumentSource;
import com.flamingo.ai.deckindex.staging.StagingArea;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Lists the remote corpus and fetches document bytes into staging. */
@Component
@Slf4j
public class DownloadStage {

  private static final String STAGE = "download";

  private final RemoteDocumentSource source;
  private final StagingArea staging;
  private final StageRetryPolicy retryPolicy;

  @Autowired
  public DownloadStage(
      RemoteDocumentSource source, StagingArea staging, IngestionConfig ingestionConfig) {
    this(source, staging, new StageRetryPolicy(STAGE, ingestionConfig.getDownload().getRetry()));
  }

  @VisibleForTesting
  public DownloadStage(
      RemoteDocumentSource source, StagingArea staging, StageRetryPolicy retryPolicy) {
    this.source = source;
    this.staging = staging;
    this.retryPolicy = retryPolicy;
  }

  /** Lists the remote documents, retrying connectivity failures. */
  public List<SourceDocument> listDocuments() {
    return retryPolicy.execute("listing", source::listDocuments, RetryListener.NONE);
  }

  /**
   * Fetches a document into its staging slot and hashes the bytes.
   *
   * @param document the listed document
   * @param stagingKey the document's staging key
   * @param listener notified before each retry
   * @return the staged bytes with their content hash
   */
  public StagedDocument download(
      SourceDocument document, String stagingKey, RetryListener listener) {
    return retryPolicy.execute(
        document.remoteId(),
        () -> {
          Path target = staging.prepareSourceFile(stagingKey, document.displayName());
          source.fetch(document.remoteId(), target);
          String hash = hash(document, target);
          log.debug("Fetched {} ({}) hash={}", document.remoteId(), document.displayName(), hash);
          return new StagedDocument(
              document.remoteId(), document.displayName(), target, hash, stagingKey);
        },
        listener);
  }

  private static String hash(SourceDocument document, Path file) {
    try {
      return StagingArea.contentHash(file);
    } catch (IOException e) {
      throw new TransientStageException(
          STAGE, "Cannot read fetched bytes of " + document.remoteId(), e);
    }
  }
}
