package com.flamingo.ai.deckindex.staging;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.domain.model.EmbeddingVector;
import com.flamingo.ai.deckindex.domain.model.RenderedAsset;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.SystemicFailureException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

/**
 * Local working area of the pipeline.
 *
 * <p>Layout:
 *
 * <pre>
 * staging/&lt;key&gt;/source.pptx     fetched bytes
 * staging/&lt;key&gt;/units.json      extracted content units
 * staging/&lt;key&gt;/assets.json     rendered asset handles
 * staging/&lt;key&gt;/vectors.json    embedding vectors
 * rendered/&lt;key&gt;/&lt;hash&gt;/slide_0001.png
 * </pre>
 *
 * <p>Every artifact is written to a temporary file and moved into place, so a stage output is
 * either complete or absent. Stages write their output before the ledger records their status.
 */
@Component
@Slf4j
public class StagingArea {

  private static final String SOURCE_PREFIX = "source";
  private static final String UNITS_FILE = "units.json";
  private static final String ASSETS_FILE = "assets.json";
  private static final String VECTORS_FILE = "vectors.json";
  private static final int HASH_DIRECTORY_LENGTH = 12;

  private final Path stagingRoot;
  private final Path renderedRoot;
  private final ObjectMapper objectMapper;

  @Autowired
  public StagingArea(IngestionConfig ingestionConfig, ObjectMapper objectMapper) {
    this(
        resolve(
            ingestionConfig.getStaging().getDirectory(), ingestionConfig.getDataDir(), "staging"),
        resolve(
            ingestionConfig.getStaging().getRenderedDirectory(),
            ingestionConfig.getDataDir(),
            "rendered"),
        objectMapper);
  }

  @VisibleForTesting
  public StagingArea(Path stagingRoot, Path renderedRoot, ObjectMapper objectMapper) {
    this.stagingRoot = stagingRoot.toAbsolutePath().normalize();
    this.renderedRoot = renderedRoot.toAbsolutePath().normalize();
    this.objectMapper = objectMapper;
  }

  /** Filesystem-safe key derived from the remote id. */
  public String stagingKey(String remoteId) {
    return Hashing.sha256()
        .hashString(remoteId, StandardCharsets.UTF_8)
        .toString()
        .substring(0, 16);
  }

  /** SHA-256 of the file contents as lowercase hex. */
  public static String contentHash(Path file) throws IOException {
    return MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString();
  }

  /**
   * Prepares an empty slot for the source bytes of a document.
   *
   * @param key staging key
   * @param displayName used to keep the original file extension
   * @return path to write the bytes to
   */
  public Path prepareSourceFile(String key, String displayName) {
    Path directory = stagingRoot.resolve(key);
    try {
      Files.createDirectories(directory);
      Optional<Path> previous = findSourceFile(key);
      if (previous.isPresent()) {
        Files.delete(previous.get());
      }
    } catch (IOException e) {
      throw stagingFailure("prepare source slot for " + key, e);
    }
    return directory.resolve(SOURCE_PREFIX + extensionOf(displayName));
  }

  public Optional<Path> findSourceFile(String key) {
    Path directory = stagingRoot.resolve(key);
    if (!Files.isDirectory(directory)) {
      return Optional.empty();
    }
    try (Stream<Path> files = Files.list(directory)) {
      return files
          .filter(p -> p.getFileName().toString().startsWith(SOURCE_PREFIX))
          .filter(p -> !p.getFileName().toString().endsWith(".tmp"))
          .findFirst();
    } catch (IOException e) {
      throw stagingFailure("list " + directory, e);
    }
  }

  public void writeUnits(String key, List<ContentUnit> units) {
    writeJson(key, UNITS_FILE, units);
  }

  public List<ContentUnit> readUnits(String key) {
    return readJson(key, UNITS_FILE, new TypeReference<List<ContentUnit>>() {});
  }

  public void writeAssets(String key, List<RenderedAsset> assets) {
    writeJson(key, ASSETS_FILE, assets);
  }

  public List<RenderedAsset> readAssets(String key) {
    return readJson(key, ASSETS_FILE, new TypeReference<List<RenderedAsset>>() {});
  }

  public void writeVectors(String key, List<EmbeddingVector> vectors) {
    writeJson(key, VECTORS_FILE, vectors);
  }

  public List<EmbeddingVector> readVectors(String key) {
    return readJson(key, VECTORS_FILE, new TypeReference<List<EmbeddingVector>>() {});
  }

  /**
   * Returns an empty directory for the rendered assets of one document version. Leftovers of an
   * earlier, interrupted attempt are removed.
   */
  public Path prepareRenderDirectory(String key, String contentHash) {
    Path directory = renderDirectory(key, contentHash);
    try {
      FileSystemUtils.deleteRecursively(directory);
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw stagingFailure("prepare render directory " + directory, e);
    }
    return directory;
  }

  public Path renderDirectory(String key, String contentHash) {
    return renderedRoot.resolve(key).resolve(contentHash.substring(0, HASH_DIRECTORY_LENGTH));
  }

  /** Removes rendered assets of every version other than {@code keepHash}. */
  public void pruneRenderedAssets(String key, String keepHash) {
    Path documentDirectory = renderedRoot.resolve(key);
    if (!Files.isDirectory(documentDirectory)) {
      return;
    }
    Path keep = renderDirectory(key, keepHash);
    try (Stream<Path> versions = Files.list(documentDirectory)) {
      for (Path version : versions.filter(p -> !p.equals(keep)).toList()) {
        FileSystemUtils.deleteRecursively(version);
        log.debug("Removed superseded assets {}", version);
      }
    } catch (IOException e) {
      throw stagingFailure("prune rendered assets of " + key, e);
    }
  }

  /** Removes the working directory of a document. Rendered assets are kept. */
  public void discard(String key) {
    try {
      FileSystemUtils.deleteRecursively(stagingRoot.resolve(key));
    } catch (IOException e) {
      throw stagingFailure("discard staging of " + key, e);
    }
  }

  /** Removes everything stored for a document, rendered assets included. */
  public void discardAll(String key) {
    discard(key);
    try {
      FileSystemUtils.deleteRecursively(renderedRoot.resolve(key));
    } catch (IOException e) {
      throw stagingFailure("discard rendered assets of " + key, e);
    }
  }

  private void writeJson(String key, String fileName, Object value) {
    Path directory = stagingRoot.resolve(key);
    Path target = directory.resolve(fileName);
    Path temp = directory.resolve(fileName + ".tmp");
    try {
      Files.createDirectories(directory);
      objectMapper.writeValue(temp.toFile(), value);
      Files.move(
          temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw stagingFailure("write " + target, e);
    }
  }

  private <T> T readJson(String key, String fileName, TypeReference<T> type) {
    Path file = stagingRoot.resolve(key).resolve(fileName);
    if (!Files.exists(file)) {
      throw new ContentProcessingException(
          "resume", "Staged artifact missing: " + fileName + " (key " + key + "); reset required");
    }
    try {
      return objectMapper.readValue(file.toFile(), type);
    } catch (IOException e) {
      throw new ContentProcessingException(
          "resume", "Staged artifact unreadable: " + file + ": " + e.getMessage(), e);
    }
  }

  private static SystemicFailureException stagingFailure(String operation, IOException e) {
    return new SystemicFailureException(
        "staging", "Staging area failure: cannot " + operation + ": " + e.getMessage(), e);
  }

  private static String extensionOf(String displayName) {
    int dot = displayName.lastIndexOf('.');
    return dot >= 0 ? displayName.substring(dot).toLowerCase(Locale.ROOT) : "";
  }

  private static Path resolve(String configured, String dataDir, String defaultName) {
    if (configured != null && !configured.isBlank()) {
      return Path.of(configured);
    }
    return Path.of(dataDir).resolve(defaultName);
  }
}
