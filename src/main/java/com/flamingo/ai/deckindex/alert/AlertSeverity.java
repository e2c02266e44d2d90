package com.flamingo.ai.deckindex.alert;

public enum AlertSeverity {
  WARNING,
  CRITICAL
}
