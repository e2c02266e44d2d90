package com.flamingo.ai.deckindex.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MetricsConfig Tests")
class MetricsConfigTest {

  @Test
  @DisplayName("Should tag every meter with the application and the render engine")
  void shouldAddCommonTags_whenRegistryCustomized() {
    // Given
    IngestionConfig ingestionConfig = new IngestionConfig();
    ingestionConfig.getRendering().setEngine("office");
    SimpleMeterRegistry registry = new SimpleMeterRegistry();

    // When
    new MetricsConfig(ingestionConfig).ingestionCommonTags("deck-index").customize(registry);
    Meter.Id id = registry.timer("ingestion.stage.render").getId();

    // Then
    assertThat(id.getTag(MetricsConfig.APPLICATION_TAG)).isEqualTo("deck-index");
    assertThat(id.getTag(MetricsConfig.RENDER_ENGINE_TAG)).isEqualTo("office");
  }
}
