package com.flamingo.ai.deckindex.config;

import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics of the ingestion pipeline. Every meter carries the application name and the configured
 * render engine, so runs with the office engine can be told apart from in-process rendering.
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

  static final String APPLICATION_TAG = "application";
  static final String RENDER_ENGINE_TAG = "render.engine";

  private final IngestionConfig ingestionConfig;

  @Bean
  public MeterRegistryCustomizer<MeterRegistry> ingestionCommonTags(
      @Value("${spring.application.name:deck-index}") String applicationName) {
    String engine = ingestionConfig.getRendering().getEngine();
    return registry ->
        registry.config().commonTags(APPLICATION_TAG, applicationName, RENDER_ENGINE_TAG, engine);
  }

  /** Enables {@code @Timed} on pipeline runs, embedding batches and index operations. */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }
}
