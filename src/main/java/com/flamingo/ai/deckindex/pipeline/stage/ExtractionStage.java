package com.flamingo.ai.deckindex.pipeline.stage;

import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.extraction.ContentCleaner;
import com.flamingo.ai.deckindex.extraction.ParsedSlide;
import com.flamingo.ai.deckindex.extraction.PresentationParser;
import com.flamingo.ai.deckindex.extraction.PresentationParserRouter;
import com.flamingo.ai.deckindex.staging.StagingArea;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parses a staged document into ordered content units and stages them.
 *
 * <p>Units keep the source ordering; unit indexes start at 1. Failures here are content errors and
 * are not retried.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExtractionStage {

  private final StagingArea staging;
  private final PresentationParserRouter parserRouter;
  private final ContentCleaner contentCleaner;

  public List<ContentUnit> extract(String remoteId, String stagingKey) {
    Path file = StagedFiles.sourceFile(staging, remoteId, stagingKey, "extract");
    PresentationParser parser = parserRouter.select(file);
    List<ParsedSlide> slides = contentCleaner.clean(parser.parse(file));
    if (slides.isEmpty()) {
      throw new ContentProcessingException("extract", "Document contains no slides or pages");
    }

    List<ContentUnit> units = new ArrayList<>(slides.size());
    for (int i = 0; i < slides.size(); i++) {
      ParsedSlide slide = slides.get(i);
      units.add(
          new ContentUnit(
              remoteId,
              i + 1,
              ContentUnit.DEFAULT_CHUNK,
              slide.title(),
              slide.text(),
              slide.notes()));
    }
    staging.writeUnits(stagingKey, units);
    log.debug("Extracted {} units from {}", units.size(), remoteId);
    return units;
  }
}
