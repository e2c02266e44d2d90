package com.flamingo.ai.deckindex.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;

/**
 * Creates the data directory before any bean starts. The SQLite ledger and the log file live
 * there, and neither creates missing parent directories.
 */
public class DataDirectoryPreparer
    implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

  @Override
  public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
    Path dataDir = Path.of(event.getEnvironment().getProperty("ingestion.data-dir", "./data"));
    try {
      Files.createDirectories(dataDir.resolve("logs"));
    } catch (IOException e) {
      throw new IllegalStateException(
          "Cannot create data directory " + dataDir.toAbsolutePath(), e);
    }
  }
}
