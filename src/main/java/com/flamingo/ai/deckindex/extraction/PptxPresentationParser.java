package com.flamingo.ai.deckindex.extraction;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.sl.usermodel.Placeholder;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFGroupShape;
import org.apache.poi.xslf.usermodel.XSLFNotes;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTable;
import org.apache.poi.xslf.usermodel.XSLFTableCell;
import org.apache.poi.xslf.usermodel.XSLFTableRow;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextShape;
import org.springframework.stereotype.Component;

/**
 * {@link PresentationParser} for PowerPoint OOXML files using Apache POI.
 *
 * <p>Slide text is every non-empty paragraph of every text shape, tables and grouped shapes
 * included, in shape order. Notes come from the body placeholder of the notes slide. Hidden
 * slides are skipped, as they are by every render engine.
 */
@Component
@Slf4j
public class PptxPresentationParser implements PresentationParser {

  private static final String PPTX_MIME =
      "application/vnd.openxmlformats-officedocument.presentationml.presentation";

  @Override
  public List<ParsedSlide> parse(Path file) {
    try (InputStream in = Files.newInputStream(file);
        XMLSlideShow show = new XMLSlideShow(in)) {
      List<ParsedSlide> slides = new ArrayList<>();
      for (XSLFSlide slide : show.getSlides()) {
        if (slide.isHidden()) {
          continue;
        }
        List<String> paragraphs = new ArrayList<>();
        collectText(slide.getShapes(), paragraphs);
        slides.add(
            new ParsedSlide(slide.getTitle(), String.join("\n", paragraphs), notesOf(slide)));
      }
      log.debug("Parsed {} slide(s) from {}", slides.size(), file.getFileName());
      return slides;
    } catch (IOException | RuntimeException e) {
      // POI signals malformed packages with unchecked exceptions
      throw new ContentProcessingException(
          "extract", "Malformed presentation " + file.getFileName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return PPTX_MIME.equals(mimeType);
  }

  @Override
  public List<String> extensions() {
    return List.of(".pptx");
  }

  private void collectText(List<XSLFShape> shapes, List<String> paragraphs) {
    for (XSLFShape shape : shapes) {
      if (shape instanceof XSLFGroupShape group) {
        collectText(group.getShapes(), paragraphs);
      } else if (shape instanceof XSLFTable table) {
        for (XSLFTableRow row : table.getRows()) {
          for (XSLFTableCell cell : row.getCells()) {
            collectParagraphs(cell, paragraphs);
          }
        }
      } else if (shape instanceof XSLFTextShape textShape) {
        collectParagraphs(textShape, paragraphs);
      }
    }
  }

  private void collectParagraphs(XSLFTextShape shape, List<String> paragraphs) {
    for (XSLFTextParagraph paragraph : shape.getTextParagraphs()) {
      String text = paragraph.getText();
      if (text != null && !text.trim().isEmpty()) {
        paragraphs.add(text.trim());
      }
    }
  }

  private String notesOf(XSLFSlide slide) {
    XSLFNotes notes = slide.getNotes();
    if (notes == null) {
      return "";
    }
    List<String> paragraphs = new ArrayList<>();
    for (XSLFShape shape : notes.getShapes()) {
      if (shape instanceof XSLFTextShape textShape && textShape.getTextType() == Placeholder.BODY) {
        collectParagraphs(textShape, paragraphs);
      }
    }
    return String.join("\n", paragraphs);
  }
}
