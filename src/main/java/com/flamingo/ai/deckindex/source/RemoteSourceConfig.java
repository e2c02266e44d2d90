package com.flamingo.ai.deckindex.source;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import java.nio.file.Path;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Selects the remote document source from {@code ingestion.source.type}. */
@Configuration
@Slf4j
public class RemoteSourceConfig {

  @Bean
  public RemoteDocumentSource remoteDocumentSource(IngestionConfig ingestionConfig) {
    IngestionConfig.Source source = ingestionConfig.getSource();
    log.info(
        "Configuring document source: type={}, extensions={}",
        source.getType(),
        source.getExtensions());

    return switch (source.getType().toLowerCase(Locale.ROOT)) {
      case "local" ->
          new LocalDirectoryDocumentSource(
              Path.of(source.getLocal().getDirectory()), source.getExtensions());
      case "graph" -> new GraphDriveDocumentSource(source.getGraph(), source.getExtensions());
      default ->
          throw new IllegalArgumentException(
              "Unsupported source type: " + source.getType() + ". Use 'local' or 'graph'.");
    };
  }
}
