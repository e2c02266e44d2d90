package com.flamingo.ai.deckindex.rendering;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.imageio.ImageIO;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

/** Renders every page of a PDF to a PNG file. */
public class PdfPageRasterizer {

  private final float dpi;

  public PdfPageRasterizer(float dpi) {
    this.dpi = dpi;
  }

  public List<Path> rasterize(Path pdfFile, Path outputDirectory) {
    try (PDDocument pdf = Loader.loadPDF(pdfFile.toFile())) {
      PDFRenderer renderer = new PDFRenderer(pdf);
      List<Path> assets = new ArrayList<>(pdf.getNumberOfPages());
      for (int page = 0; page < pdf.getNumberOfPages(); page++) {
        BufferedImage image = renderer.renderImageWithDPI(page, dpi, ImageType.RGB);
        Path asset = outputDirectory.resolve(RenderEngine.assetName(page + 1));
        ImageIO.write(image, "png", asset.toFile());
        assets.add(asset);
      }
      return assets;
    } catch (IOException e) {
      throw new ContentProcessingException(
          "render", "Cannot render PDF " + pdfFile.getFileName() + ": " + e.getMessage(), e);
    }
  }
}
