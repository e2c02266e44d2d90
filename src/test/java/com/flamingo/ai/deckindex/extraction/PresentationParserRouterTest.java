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

@DisplayName("PresentationParserRouter Tests")
class PresentationParserRouterTest {

  @TempDir Path tempDir;

  private final PresentationParserRouter router =
      new PresentationParserRouter(
          List.of(new PptxPresentationParser(), new PdfPresentationParser()));

  @Test
  @DisplayName("Should route PDF files to the page parser")
  void shouldSelectPdfParser_whenFileIsPdf() throws Exception {
    Path file = PresentationFixtures.writePdf(tempDir.resolve("deck.pdf"), "Overview");

    PresentationParser parser = router.select(file);

    assertThat(parser).isInstanceOf(PdfPresentationParser.class);
    List<ParsedSlide> pages = parser.parse(file);
    assertThat(pages).hasSize(1);
    assertThat(pages.get(0).title()).isEqualTo("Overview");
  }

  @Test
  @DisplayName("Should route PowerPoint files to the slide parser")
  void shouldSelectPptxParser_whenFileIsPptx() throws Exception {
    Path file = PresentationFixtures.writePptx(tempDir.resolve("deck.pptx"), null, "Body");

    assertThat(router.select(file)).isInstanceOf(PptxPresentationParser.class);
  }

  @Test
  @DisplayName("Should reject unsupported document types")
  void shouldThrow_whenTypeIsUnsupported() throws Exception {
    Path file = Files.writeString(tempDir.resolve("notes.txt"), "plain text");

    assertThatThrownBy(() -> router.select(file))
        .isInstanceOf(ContentProcessingException.class)
        .hasMessageContaining("Unsupported document type");
  }
}
