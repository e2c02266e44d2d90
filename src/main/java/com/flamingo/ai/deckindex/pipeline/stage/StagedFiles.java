package com.flamingo.ai.deckindex.pipeline.stage;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.staging.StagingArea;
import java.nio.file.Path;

final class StagedFiles {

  private StagedFiles() {}

  static Path sourceFile(StagingArea staging, String remoteId, String stagingKey, String stage) {
    return staging
        .findSourceFile(stagingKey)
        .orElseThrow(
            () ->
                new ContentProcessingException(
                    stage, "Staged source of " + remoteId + " is missing, reset required"));
  }
}
