package com.flamingo.ai.deckindex.pipeline;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.enums.RunMode;
import com.flamingo.ai.deckindex.exception.IngestionException;
import com.flamingo.ai.deckindex.exception.IngestionRunInProgressException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Triggers one run once the application is ready, per {@code ingestion.run-on-startup}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class StartupIngestionRunner {

  private final IngestionOrchestrator orchestrator;
  private final IngestionConfig ingestionConfig;

  @EventListener(ApplicationReadyEvent.class)
  public void runOnStartup() {
    String setting = ingestionConfig.getRunOnStartup();
    log.info("Startup run mode: {}", setting);
    if (setting == null || setting.isBlank() || "none".equalsIgnoreCase(setting)) {
      return;
    }
    RunMode mode = RunMode.fromString(setting);
    try {
      BatchReport report = orchestrator.run(mode);
      log.info(
          "Startup {} run finished: {} succeeded, {} failed",
          mode,
          report.getSucceeded(),
          report.getFailed());
    } catch (IngestionException | IngestionRunInProgressException e) {
      log.error("Startup {} run did not complete: {}", mode, e.getMessage(), e);
    }
  }
}
