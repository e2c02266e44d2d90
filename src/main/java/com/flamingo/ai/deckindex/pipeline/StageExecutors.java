package com.flamingo.ai.deckindex.pipeline;

import java.util.concurrent.Executor;

/** Worker pools of the pipeline stages, one per stage. */
public record StageExecutors(
    Executor download,
    Executor extraction,
    Executor rendering,
    Executor embedding,
    Executor indexing) {

  public Executor forStage(PipelineStage stage) {
    return switch (stage) {
      case DOWNLOAD -> download;
      case EXTRACT -> extraction;
      case RENDER -> rendering;
      case EMBED -> embedding;
      case INDEX, FINALIZE -> indexing;
    };
  }
}
