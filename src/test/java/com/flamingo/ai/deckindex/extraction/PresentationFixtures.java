package com.flamingo.ai.deckindex.extraction;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.SlideLayout;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFTextShape;

/** Builds small presentation files for parser and pipeline tests. */
public final class PresentationFixtures {

  private PresentationFixtures() {}

  /** One slide per entry of {@code bodies}, titled "Slide n", the first with speaker notes. */
  public static Path writePptx(Path file, String notes, String... bodies) throws IOException {
    try (XMLSlideShow show = new XMLSlideShow()) {
      XSLFSlideLayout layout =
          show.getSlideMasters().get(0).getLayout(SlideLayout.TITLE_AND_CONTENT);
      for (int i = 0; i < bodies.length; i++) {
        XSLFSlide slide = show.createSlide(layout);
        slide.getPlaceholder(0).setText("Slide " + (i + 1));
        slide.getPlaceholder(1).setText(bodies[i]);
        if (i == 0 && notes != null) {
          XSLFNotes notesSlide = show.getNotesSlide(slide);
          for (XSLFTextShape shape : notesSlide.getPlaceholders()) {
            if (shape.getTextType() == Placeholder.BODY) {
              shape.setText(notes);
              break;
            }
          }
        }
      }
      Files.createDirectories(file.getParent());
      try (OutputStream out = Files.newOutputStream(file)) {
        show.write(out);
      }
    }
    return file;
  }

  /** {@code count} slides without any shapes. */
  public static Path writeBlankPptx(Path file, int count) throws IOException {
    try (XMLSlideShow show = new XMLSlideShow()) {
      for (int i = 0; i < count; i++) {
        show.createSlide();
      }
      Files.createDirectories(file.getParent());
      try (OutputStream out = Files.newOutputStream(file)) {
        show.write(out);
      }
    }
    return file;
  }

  /** Marks the slides at the given 1-based positions as hidden, rewriting the file in place. */
  public static Path hideSlides(Path file, int... positions) throws IOException {
    byte[] original = Files.readAllBytes(file);
    try (XMLSlideShow show = new XMLSlideShow(new ByteArrayInputStream(original))) {
      for (int position : positions) {
        show.getSlides().get(position - 1).setHidden(true);
      }
      try (OutputStream out = Files.newOutputStream(file)) {
        show.write(out);
      }
    }
    return file;
  }

  /** One page per entry of {@code pages}, each a single line of text. */
  public static Path writePdf(Path file, String... pages) throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      for (String text : pages) {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(font, 14);
          content.newLineAtOffset(72, 700);
          content.showText(text);
          content.endText();
        }
      }
      Files.createDirectories(file.getParent());
      document.save(file.toFile());
    }
    return file;
  }
}
