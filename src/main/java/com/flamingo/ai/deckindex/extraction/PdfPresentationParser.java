package com.flamingo.ai.deckindex.extraction;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

/**
 * {@link PresentationParser} for decks exported as PDF, one unit per page. The first non-empty
 * line of a page serves as its title.
 */
@Component
@Slf4j
public class PdfPresentationParser implements PresentationParser {

  @Override
  public List<ParsedSlide> parse(Path file) {
    try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      List<ParsedSlide> pages = new ArrayList<>();
      for (int page = 1; page <= pdf.getNumberOfPages(); page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(pdf).trim();
        pages.add(new ParsedSlide(firstLine(text), text, ""));
      }
      log.debug("Parsed {} page(s) from {}", pages.size(), file.getFileName());
      return pages;
    } catch (IOException e) {
      throw new ContentProcessingException(
          "extract", "Malformed PDF " + file.getFileName() + ": " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supports(String mimeType) {
    return "application/pdf".equals(mimeType);
  }

  @Override
  public List<String> extensions() {
    return List.of(".pdf");
  }

  private static String firstLine(String text) {
    for (String line : text.split("\\R")) {
      if (!line.isBlank()) {
        return line.trim();
      }
    }
    return null;
  }
}
