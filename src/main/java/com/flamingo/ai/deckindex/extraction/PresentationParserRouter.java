package com.flamingo.ai.deckindex.extraction;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.springframework.stereotype.Component;

/** Picks the parser for a staged file from its Tika-detected MIME type, then its extension. */
@Component
@Slf4j
public class PresentationParserRouter {

  private final List<PresentationParser> parsers;
  private final Tika tika = new Tika();

  public PresentationParserRouter(List<PresentationParser> parsers) {
    this.parsers = parsers;
  }

  public PresentationParser select(Path file) {
    String mimeType = detect(file);
    Optional<PresentationParser> byMime =
        parsers.stream().filter(p -> p.supports(mimeType)).findFirst();
    if (byMime.isPresent()) {
      return byMime.get();
    }
    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
    return parsers.stream()
        .filter(p -> p.extensions().stream().anyMatch(name::endsWith))
        .findFirst()
        .orElseThrow(
            () ->
                new ContentProcessingException(
                    "extract",
                    "Unsupported document type " + mimeType + " for " + file.getFileName()));
  }

  private String detect(Path file) {
    try {
      String mimeType = tika.detect(file);
      log.debug("Detected {} as {}", file.getFileName(), mimeType);
      return mimeType;
    } catch (IOException e) {
      throw new ContentProcessingException(
          "extract", "Cannot read " + file.getFileName() + ": " + e.getMessage(), e);
    }
  }
}
