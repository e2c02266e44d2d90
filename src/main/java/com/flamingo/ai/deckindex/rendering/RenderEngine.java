package com.flamingo.ai.deckindex.rendering;

import java.nio.file.Path;
import java.util.List;

/**
 * Produces one image per content unit of a staged document.
 *
 * <p>Engines are not reentrant. They are only used through {@link ExclusiveRenderResource}, which
 * opens a session before the first render, serializes all calls and closes the session when it is
 * discarded.
 */
public interface RenderEngine {

  String name();

  /**
   * Starts a rendering session.
   *
   * @throws com.flamingo.ai.deckindex.exception.RenderingResourceException if the engine cannot
   *     be started
   */
  void open();

  /**
   * Renders every unit of {@code source} into {@code outputDirectory}.
   *
   * @param source staged document
   * @param outputDirectory empty directory receiving the images
   * @return asset files in unit order, named by {@link #assetName(int)}
   * @throws com.flamingo.ai.deckindex.exception.RenderingResourceException on a fault of the
   *     engine itself
   * @throws com.flamingo.ai.deckindex.exception.ContentProcessingException if the document
   *     cannot be rendered
   */
  List<Path> render(Path source, Path outputDirectory);

  /** Ends the session and releases everything the engine holds. */
  void close();

  static String assetName(int unitIndex) {
    return String.format("slide_%04d.png", unitIndex);
  }
}
