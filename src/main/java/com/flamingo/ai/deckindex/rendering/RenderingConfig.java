package com.flamingo.ai.deckindex.rendering;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the render engine from {@code ingestion.rendering.engine}. */
@Configuration
@Slf4j
public class RenderingConfig {

  @Bean
  public RenderEngine renderEngine(IngestionConfig ingestionConfig) {
    IngestionConfig.Rendering rendering = ingestionConfig.getRendering();
    log.info("Configuring render engine: {} at {} dpi", rendering.getEngine(), rendering.getDpi());
    return switch (rendering.getEngine().toLowerCase(Locale.ROOT)) {
      case "java2d" -> new Java2dRenderEngine(rendering.getDpi());
      case "office" ->
          new OfficeAutomationRenderEngine(
              rendering.getOffice().getCommand(),
              rendering.getOffice().getTimeoutSeconds(),
              rendering.getDpi());
      default ->
          throw new IllegalArgumentException(
              "Unsupported render engine: "
                  + rendering.getEngine()
                  + ". Use 'java2d' or 'office'.");
    };
  }

  @Bean
  public ExclusiveRenderResource exclusiveRenderResource(RenderEngine renderEngine) {
    return new ExclusiveRenderResource(renderEngine);
  }
}
