package com.flamingo.ai.deckindex.source;

import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;

/** Documents below a local (or mounted) directory. The remote id is the relative path. */
@Slf4j
public class LocalDirectoryDocumentSource implements RemoteDocumentSource {

  private final Path root;
  private final List<String> allowedExtensions;

  public LocalDirectoryDocumentSource(Path root, List<String> allowedExtensions) {
    this.root = root.toAbsolutePath().normalize();
    this.allowedExtensions = List.copyOf(allowedExtensions);
  }

  @Override
  public List<String> allowedExtensions() {
    return allowedExtensions;
  }

  @Override
  public List<SourceDocument> listDocuments() {
    if (!Files.isDirectory(root)) {
      throw new TransientStageException("download", "Source directory not available: " + root);
    }
    List<SourceDocument> result = new ArrayList<>();
    try (Stream<Path> files = Files.walk(root)) {
      List<Path> candidates =
          files
              .filter(Files::isRegularFile)
              .filter(p -> isSupportedFile(p.getFileName().toString()))
              .sorted(Comparator.naturalOrder())
              .toList();
      for (Path file : candidates) {
        BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
        result.add(
            new SourceDocument(
                toRemoteId(file),
                file.getFileName().toString(),
                attributes.lastModifiedTime().toInstant(),
                attributes.size()));
      }
    } catch (IOException e) {
      throw new TransientStageException(
          "download", "Listing failed for " + root + ": " + e.getMessage(), e);
    }
    log.debug("Listed {} document(s) in {}", result.size(), root);
    return result;
  }

  @Override
  public void fetch(String remoteId, Path target) {
    Path source = root.resolve(remoteId).normalize();
    if (!source.startsWith(root)) {
      throw new ContentProcessingException(
          "download", "Remote id escapes source root: " + remoteId);
    }
    try {
      Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
      log.debug("Copied {} to {}", source, target);
    } catch (NoSuchFileException e) {
      throw new ContentProcessingException("download", "Document no longer exists: " + remoteId, e);
    } catch (IOException e) {
      throw new TransientStageException(
          "download", "Copy failed for " + remoteId + ": " + e.getMessage(), e);
    }
  }

  private String toRemoteId(Path file) {
    return root.relativize(file).toString().replace('\\', '/');
  }
}
