package com.flamingo.ai.deckindex.rendering;

import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

/**
 * In-process engine: PPTX slides are drawn with Apache POI onto Java2D images, PDF pages are
 * rasterized with PDFBox. Hidden slides are not drawn.
 */
@Slf4j
public class Java2dRenderEngine implements RenderEngine {

  private static final float POINTS_PER_INCH = 72f;

  private final float dpi;
  private final PdfPageRasterizer pdfRasterizer;

  public Java2dRenderEngine(float dpi) {
    this.dpi = dpi;
    this.pdfRasterizer = new PdfPageRasterizer(dpi);
  }

  @Override
  public String name() {
    return "java2d";
  }

  @Override
  public void open() {
    System.setProperty("java.awt.headless", "true");
    log.debug("Java2D render session opened ({} dpi)", dpi);
  }

  @Override
  public List<Path> render(Path source, Path outputDirectory) {
    String name = source.getFileName().toString().toLowerCase(Locale.ROOT);
    if (name.endsWith(".pdf")) {
      return pdfRasterizer.rasterize(source, outputDirectory);
    }
    if (name.endsWith(".pptx")) {
      return renderSlides(source, outputDirectory);
    }
    throw new ContentProcessingException("render", "No renderer for " + source.getFileName());
  }

  @Override
  public void close() {
    log.debug("Java2D render session closed");
  }

  private List<Path> renderSlides(Path source, Path outputDirectory) {
    try (InputStream in = Files.newInputStream(source);
        XMLSlideShow show = new XMLSlideShow(in)) {
      Dimension pageSize = show.getPageSize();
      double scale = dpi / POINTS_PER_INCH;
      int width = (int) Math.ceil(pageSize.getWidth() * scale);
      int height = (int) Math.ceil(pageSize.getHeight() * scale);

      List<Path> assets = new ArrayList<>();
      int unitIndex = 1;
      for (XSLFSlide slide : show.getSlides()) {
        if (slide.isHidden()) {
          continue;
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = image.createGraphics();
        try {
          graphics.setRenderingHint(
              RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
          graphics.setRenderingHint(
              RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
          graphics.setPaint(Color.WHITE);
          graphics.fill(new Rectangle2D.Double(0, 0, width, height));
          graphics.scale(scale, scale);
          slide.draw(graphics);
        } finally {
          graphics.dispose();
        }
        Path asset = outputDirectory.resolve(RenderEngine.assetName(unitIndex++));
        ImageIO.write(image, "png", asset.toFile());
        assets.add(asset);
      }
      return assets;
    } catch (IOException | RuntimeException e) {
      throw new ContentProcessingException(
          "render", "Cannot render slides of " + source.getFileName() + ": " + e.getMessage(), e);
    }
  }
}
