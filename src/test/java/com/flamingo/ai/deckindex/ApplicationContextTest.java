package com.flamingo.ai.deckindex;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.deckindex.ledger.ProcessingLedger;
import com.flamingo.ai.deckindex.pipeline.ChangeDetector;
import com.flamingo.ai.deckindex.pipeline.IngestionOrchestrator;
import com.flamingo.ai.deckindex.pipeline.StageExecutors;
import com.flamingo.ai.deckindex.pipeline.stage.IndexWriter;
import com.flamingo.ai.deckindex.rendering.ExclusiveRenderResource;
import com.flamingo.ai.deckindex.source.LocalDirectoryDocumentSource;
import com.flamingo.ai.deckindex.source.RemoteDocumentSource;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies that the application context wires the pipeline. The embedding model and Elasticsearch
 * are mocked so the test runs without external services.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Pipeline beans should be available")
  void pipelineBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(IngestionOrchestrator.class)).isNotNull();
    assertThat(applicationContext.getBean(ChangeDetector.class)).isNotNull();
    assertThat(applicationContext.getBean(IndexWriter.class)).isNotNull();
    assertThat(applicationContext.getBean(ExclusiveRenderResource.class)).isNotNull();
    assertThat(applicationContext.getBean(StageExecutors.class)).isNotNull();
    assertThat(applicationContext.getBean(ProcessingLedger.class)).isNotNull();
  }

  @Test
  @DisplayName("Local source should be selected by configuration")
  void localSourceShouldBeSelected() {
    assertThat(applicationContext.getBean(RemoteDocumentSource.class))
        .isInstanceOf(LocalDirectoryDocumentSource.class);
  }
}
