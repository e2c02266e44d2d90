package com.flamingo.ai.deckindex.extraction;

import java.nio.file.Path;
import java.util.List;

/** Reads the units of a presentation document in source order. */
public interface PresentationParser {

  /**
   * Parses a staged document.
   *
   * @param file the staged file
   * @return one entry per slide or page, in source order
   * @throws com.flamingo.ai.deckindex.exception.ContentProcessingException if the document is
   *     malformed
   */
  List<ParsedSlide> parse(Path file);

  /**
   * Checks if this parser handles the given MIME type.
   *
   * @param mimeType the detected MIME type
   * @return true if supported
   */
  boolean supports(String mimeType);

  /** File extensions handled when MIME detection is inconclusive, lowercase with a dot. */
  List<String> extensions();
}
