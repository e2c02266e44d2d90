package com.flamingo.ai.deckindex.rendering;

import java.nio.file.Path;
import java.util.List;

/**
 * Exclusive right to use the render engine, obtained from {@link
 * ExclusiveRenderResource#acquire()}. Use with try-with-resources so the slot is released on every
 * exit path.
 */
public final class RenderLease implements AutoCloseable {

  private final ExclusiveRenderResource owner;
  private boolean broken;
  private boolean released;

  RenderLease(ExclusiveRenderResource owner) {
    this.owner = owner;
  }

  public List<Path> render(Path source, Path outputDirectory) {
    if (released) {
      throw new IllegalStateException("Render lease already released");
    }
    return owner.render(this, source, outputDirectory);
  }

  /** Marks the engine session as unusable; it is discarded when this lease is released. */
  public void markBroken() {
    this.broken = true;
  }

  public boolean isBroken() {
    return broken;
  }

  @Override
  public void close() {
    if (!released) {
      released = true;
      owner.release(this);
    }
  }
}
