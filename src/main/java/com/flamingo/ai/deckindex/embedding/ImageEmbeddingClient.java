package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import java.time.Duration;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for an image embedding server. Posts base64-encoded PNG images to {@code
 * /embed/image} and receives one vector per image.
 */
@Component
@ConditionalOnProperty(name = "ingestion.embedding.visual.enabled", havingValue = "true")
@Slf4j
public class ImageEmbeddingClient {

  private final WebClient webClient;
  private final int readTimeoutMs;

  public ImageEmbeddingClient(IngestionConfig ingestionConfig) {
    IngestionConfig.Embedding.Visual visual = ingestionConfig.getEmbedding().getVisual();
    this.readTimeoutMs = visual.getReadTimeoutMs();
    this.webClient =
        WebClient.builder()
            .baseUrl(visual.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
            .build();
    log.info("Image embedding client initialized: baseUrl={}", visual.getBaseUrl());
  }

  /**
   * Embeds the given images.
   *
   * @param base64Images PNG images, base64-encoded
   * @return one vector per image, in request order
   */
  public List<List<Float>> embedImages(List<String> base64Images) {
    ImageEmbeddingResponse response =
        webClient
            .post()
            .uri("/embed/image")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(new ImageEmbeddingRequest(base64Images))
            .retrieve()
            .bodyToMono(ImageEmbeddingResponse.class)
            .timeout(Duration.ofMillis(readTimeoutMs))
            .block();
    return response == null || response.embeddings() == null ? List.of() : response.embeddings();
  }

  record ImageEmbeddingRequest(List<String> images) {}

  record ImageEmbeddingResponse(List<List<Float>> embeddings) {}
}
