package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Visual vectors from the rendered image of each unit. */
@Component
@ConditionalOnProperty(name = "ingestion.embedding.visual.enabled", havingValue = "true")
@RequiredArgsConstructor
public class VisualUnitEmbedder implements UnitEmbedder {

  private final ImageEmbeddingClient imageEmbeddingClient;

  @Override
  public VectorKind kind() {
    return VectorKind.VISUAL;
  }

  @Override
  public boolean accepts(EmbeddingInput input) {
    return input.hasImage();
  }

  @Override
  public List<List<Float>> embedBatch(List<EmbeddingInput> inputs) {
    List<String> images = new ArrayList<>(inputs.size());
    for (EmbeddingInput input : inputs) {
      images.add(readImage(Path.of(input.asset().path())));
    }
    List<List<Float>> vectors;
    try {
      vectors = imageEmbeddingClient.embedImages(images);
    } catch (RuntimeException e) {
      throw new TransientStageException("embed", "Image embedding failed: " + e.getMessage(), e);
    }
    if (vectors.size() != inputs.size()) {
      throw new TransientStageException(
          "embed",
          "Image embedding returned "
              + vectors.size()
              + " vectors for "
              + inputs.size()
              + " inputs");
    }
    return vectors;
  }

  private static String readImage(Path path) {
    try {
      return Base64.getEncoder().encodeToString(Files.readAllBytes(path));
    } catch (NoSuchFileException e) {
      throw new ContentProcessingException("embed", "Rendered image missing: " + path, e);
    } catch (IOException e) {
      throw new TransientStageException("embed", "Cannot read rendered image " + path, e);
    }
  }
}
