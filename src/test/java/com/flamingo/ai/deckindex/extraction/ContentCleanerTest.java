package com.flamingo.ai.deckindex.extraction;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ContentCleaner Tests")
class ContentCleanerTest {

  private final ContentCleaner cleaner = new ContentCleaner(true, 3);

  @Test
  @DisplayName("Should collapse whitespace and drop blank lines")
  void shouldNormalizeWhitespace_whenTextIsMessy() {
    List<ParsedSlide> cleaned =
        cleaner.clean(
            List.of(
                new ParsedSlide(
                    "  Quarterly\tReview ", "  Revenue   up \n\n\t\n Costs  down", null)));

    assertThat(cleaned.get(0).title()).isEqualTo("Quarterly Review");
    assertThat(cleaned.get(0).text()).isEqualTo("Revenue up\nCosts down");
    assertThat(cleaned.get(0).notes()).isEmpty();
  }

  @Test
  @DisplayName("Should strip lines repeated on every unit but keep notes")
  void shouldStripRepeatedLines_whenPresentOnEveryUnit() {
    // Given
    List<ParsedSlide> slides =
        List.of(
            new ParsedSlide("One", "Confidential\nIntro", "Confidential"),
            new ParsedSlide("Two", "Agenda\nConfidential", null),
            new ParsedSlide("Three", "Confidential\nSummary", null));

    // When
    List<ParsedSlide> cleaned = cleaner.clean(slides);

    // Then
    assertThat(cleaned)
        .extracting(ParsedSlide::text)
        .containsExactly("Intro", "Agenda", "Summary");
    assertThat(cleaned.get(0).notes()).isEqualTo("Confidential");
  }

  @Test
  @DisplayName("Should keep repeated lines in short documents")
  void shouldKeepRepeatedLines_whenDocumentIsShort() {
    List<ParsedSlide> cleaned =
        cleaner.clean(
            List.of(
                new ParsedSlide(null, "Footer\nA", null),
                new ParsedSlide(null, "Footer\nB", null)));

    assertThat(cleaned).extracting(ParsedSlide::text).containsExactly("Footer\nA", "Footer\nB");
  }

  @Test
  @DisplayName("Should keep repeated lines when stripping is disabled")
  void shouldKeepRepeatedLines_whenStrippingDisabled() {
    ContentCleaner keeping = new ContentCleaner(false, 3);
    List<ParsedSlide> slides =
        List.of(
            new ParsedSlide(null, "Footer\nA", null),
            new ParsedSlide(null, "Footer\nB", null),
            new ParsedSlide(null, "Footer\nC", null));

    assertThat(keeping.clean(slides)).extracting(ParsedSlide::text)
        .containsExactly("Footer\nA", "Footer\nB", "Footer\nC");
  }
}
