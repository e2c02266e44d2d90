package com.flamingo.ai.deckindex.exception;

/**
 * Fault of the rendering resource itself, as opposed to a document that cannot be rendered. The
 * resource session is discarded and reopened before the next attempt.
 */
public class RenderingResourceException extends TransientStageException {

  public RenderingResourceException(String message) {
    super("render", message);
  }

  public RenderingResourceException(String message, Throwable cause) {
    super("render", message, cause);
  }
}
