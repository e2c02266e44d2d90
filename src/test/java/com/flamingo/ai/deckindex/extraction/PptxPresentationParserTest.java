package com.flamingo.ai.deckindex.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("PptxPresentationParser Tests")
class PptxPresentationParserTest {

  @TempDir Path tempDir;

  private final PptxPresentationParser parser = new PptxPresentationParser();

  @Test
  @DisplayName("Should read titles, body text and notes in slide order")
  void shouldParseSlides_whenPresentationIsValid() throws Exception {
    // Given
    Path file =
        PresentationFixtures.writePptx(
            tempDir.resolve("deck.pptx"), "Mention the Q3 numbers", "Revenue grew", "Next steps");

    // When
    List<ParsedSlide> slides = parser.parse(file);

    // Then
    assertThat(slides).hasSize(2);
    assertThat(slides.get(0).title()).isEqualTo("Slide 1");
    assertThat(slides.get(0).text()).contains("Revenue grew");
    assertThat(slides.get(0).notes()).contains("Mention the Q3 numbers");
    assertThat(slides.get(1).text()).contains("Next steps");
    assertThat(slides.get(1).notes()).isEmpty();
  }

  @Test
  @DisplayName("Should leave hidden slides out of the parsed deck")
  void shouldSkipSlide_whenSlideIsHidden() throws Exception {
    // Given
    Path file =
        PresentationFixtures.writePptx(
            tempDir.resolve("deck.pptx"), null, "Agenda", "Backup material", "Summary");
    PresentationFixtures.hideSlides(file, 2);

    // When
    List<ParsedSlide> slides = parser.parse(file);

    // Then
    assertThat(slides).hasSize(2);
    assertThat(slides).extracting(ParsedSlide::title).containsExactly("Slide 1", "Slide 3");
    assertThat(slides.get(1).text()).contains("Summary");
  }

  @Test
  @DisplayName("Should report a corrupt file as a content error")
  void shouldThrowContentError_whenFileIsCorrupt() throws Exception {
    Path file = Files.writeString(tempDir.resolve("broken.pptx"), "not a zip archive");

    assertThatThrownBy(() -> parser.parse(file))
        .isInstanceOf(ContentProcessingException.class)
        .hasMessageContaining("broken.pptx");
  }

  @Test
  @DisplayName("Should support the OOXML presentation type only")
  void shouldSupportPresentationMime_whenAsked() {
    assertThat(
            parser.supports(
                "application/vnd.openxmlformats-officedocument.presentationml.presentation"))
        .isTrue();
    assertThat(parser.supports("application/pdf")).isFalse();
  }
}
