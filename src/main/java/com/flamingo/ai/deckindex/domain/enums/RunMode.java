package com.flamingo.ai.deckindex.domain.enums;

import java.util.Locale;

/** How the change detector selects candidates for a run. */
public enum RunMode {
  /** Trust the modification-time pre-filter; only documents flagged as changed are fetched. */
  INCREMENTAL,

  /** Ignore the pre-filter and recheck the content hash of every remote document. */
  FULL;

  public static RunMode fromString(String value) {
    return RunMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
