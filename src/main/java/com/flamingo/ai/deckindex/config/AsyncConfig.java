package com.flamingo.ai.deckindex.config;

import com.flamingo.ai.deckindex.pipeline.StageExecutors;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools of the pipeline stages. Each stage has its own fixed-size pool so that a document
 * queued for one stage never occupies a worker of another.
 */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  static final int RENDER_WORKERS = 2;

  private final IngestionConfig ingestionConfig;

  @Bean(name = "downloadExecutor")
  public ThreadPoolTaskExecutor downloadExecutor() {
    return stageExecutor(ingestionConfig.getDownload().getConcurrency(), "download-");
  }

  @Bean(name = "extractionExecutor")
  public ThreadPoolTaskExecutor extractionExecutor() {
    return stageExecutor(ingestionConfig.getExtraction().getConcurrency(), "extract-");
  }

  /**
   * Two workers in front of the single render slot. A worker sleeping through a retry backoff has
   * released the slot, and the second worker renders the next document meanwhile. The slot itself
   * still admits one render at a time.
   */
  @Bean(name = "renderingExecutor")
  public ThreadPoolTaskExecutor renderingExecutor() {
    return stageExecutor(RENDER_WORKERS, "render-");
  }

  @Bean(name = "embeddingExecutor")
  public ThreadPoolTaskExecutor embeddingExecutor() {
    return stageExecutor(ingestionConfig.getEmbedding().getConcurrency(), "embed-");
  }

  @Bean(name = "indexingExecutor")
  public ThreadPoolTaskExecutor indexingExecutor() {
    return stageExecutor(ingestionConfig.getIndexing().getConcurrency(), "index-");
  }

  @Bean
  public StageExecutors stageExecutors(
      @Qualifier("downloadExecutor") ThreadPoolTaskExecutor download,
      @Qualifier("extractionExecutor") ThreadPoolTaskExecutor extraction,
      @Qualifier("renderingExecutor") ThreadPoolTaskExecutor rendering,
      @Qualifier("embeddingExecutor") ThreadPoolTaskExecutor embedding,
      @Qualifier("indexingExecutor") ThreadPoolTaskExecutor indexing) {
    return new StageExecutors(download, extraction, rendering, embedding, indexing);
  }

  static ThreadPoolTaskExecutor stageExecutor(int threads, String threadNamePrefix) {
    int size = Math.max(1, threads);
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(size);
    executor.setMaxPoolSize(size);
    // Unbounded queue: documents wait for a free worker instead of being rejected
    executor.setQueueCapacity(Integer.MAX_VALUE);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
