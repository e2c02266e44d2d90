package com.flamingo.ai.deckindex.source;

import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Remote corpus of presentation documents.
 *
 * <p>Connectivity and authentication problems surface as {@link
 * com.flamingo.ai.deckindex.exception.TransientStageException}; a document that no longer exists
 * surfaces as {@link com.flamingo.ai.deckindex.exception.ContentProcessingException}.
 */
public interface RemoteDocumentSource {

  /** Lists every supported document with its metadata. No bytes are fetched. */
  List<SourceDocument> listDocuments();

  /**
   * Fetches the bytes of a document into {@code target}, replacing it if present.
   *
   * @param remoteId document to fetch
   * @param target local file to write
   */
  void fetch(String remoteId, Path target);

  List<String> allowedExtensions();

  /** Office lock files ({@code ~$name.pptx}) are never listed. */
  default boolean isSupportedFile(String name) {
    if (name.startsWith("~$")) {
      return false;
    }
    String lower = name.toLowerCase(Locale.ROOT);
    return allowedExtensions().stream().anyMatch(lower::endsWith);
  }
}
