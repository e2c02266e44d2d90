package com.flamingo.ai.deckindex.alert;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes alerts to the log and counts them. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingAlertSink implements AlertSink {

  private final MeterRegistry meterRegistry;

  @Override
  public void send(Alert alert) {
    if (alert.severity() == AlertSeverity.CRITICAL) {
      log.error(
          "[ALERT {}] {} (failed: {})",
          alert.severity(),
          alert.message(),
          String.join(", ", alert.failedDocuments()));
    } else {
      log.warn(
          "[ALERT {}] {} (failed: {})",
          alert.severity(),
          alert.message(),
          String.join(", ", alert.failedDocuments()));
    }
    meterRegistry.counter("ingestion.alerts", "severity", alert.severity().name()).increment();
  }
}
