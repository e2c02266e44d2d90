package com.flamingo.ai.deckindex.extraction;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Normalizes extracted text.
 *
 * <p>Whitespace runs collapse to one space, lines are trimmed and blank lines dropped. When
 * enabled, body lines that appear on every unit of a document (running headers, footers,
 * confidentiality banners) are removed. Notes are never stripped.
 */
@Component
public class ContentCleaner {

  private static final Pattern HORIZONTAL_WHITESPACE = Pattern.compile("[\\h\\x0B\\f]+");

  private final boolean stripRepeatedLines;
  private final int minUnitsForStrip;

  @Autowired
  public ContentCleaner(IngestionConfig ingestionConfig) {
    this(
        ingestionConfig.getExtraction().isStripRepeatedLines(),
        ingestionConfig.getExtraction().getMinUnitsForRepeatedLineStrip());
  }

  @VisibleForTesting
  public ContentCleaner(boolean stripRepeatedLines, int minUnitsForStrip) {
    this.stripRepeatedLines = stripRepeatedLines;
    this.minUnitsForStrip = Math.max(2, minUnitsForStrip);
  }

  public List<ParsedSlide> clean(List<ParsedSlide> slides) {
    List<ParsedSlide> normalized =
        slides.stream()
            .map(
                s ->
                    new ParsedSlide(
                        normalizeLine(s.title()), normalize(s.text()), normalize(s.notes())))
            .toList();
    if (!stripRepeatedLines || normalized.size() < minUnitsForStrip) {
      return normalized;
    }
    Set<String> repeated = linesOnEveryUnit(normalized);
    if (repeated.isEmpty()) {
      return normalized;
    }
    List<ParsedSlide> stripped = new ArrayList<>(normalized.size());
    for (ParsedSlide slide : normalized) {
      String text =
          lines(slide.text()).stream()
              .filter(line -> !repeated.contains(line))
              .collect(Collectors.joining("\n"));
      stripped.add(new ParsedSlide(slide.title(), text, slide.notes()));
    }
    return stripped;
  }

  String normalize(String text) {
    if (text == null) {
      return "";
    }
    return lines(text).stream().collect(Collectors.joining("\n"));
  }

  private static String normalizeLine(String line) {
    if (line == null) {
      return null;
    }
    String collapsed = HORIZONTAL_WHITESPACE.matcher(line).replaceAll(" ").trim();
    return collapsed.isEmpty() ? null : collapsed;
  }

  private static List<String> lines(String text) {
    return Arrays.stream(text.split("\\R"))
        .map(ContentCleaner::normalizeLine)
        .filter(Objects::nonNull)
        .toList();
  }

  private static Set<String> linesOnEveryUnit(List<ParsedSlide> slides) {
    Set<String> common = new LinkedHashSet<>(lines(slides.get(0).text()));
    for (int i = 1; i < slides.size() && !common.isEmpty(); i++) {
      common.retainAll(Set.copyOf(lines(slides.get(i).text())));
    }
    return common;
  }
}
