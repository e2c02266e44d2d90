package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import java.util.List;

/** Produces one kind of vector for content units. */
public interface UnitEmbedder {

  VectorKind kind();

  /** Returns true if the input carries what this embedder needs. */
  boolean accepts(EmbeddingInput input);

  /**
   * Embeds all inputs in one provider call.
   *
   * @return one vector per input, in input order
   * @throws com.flamingo.ai.deckindex.exception.TransientStageException if the provider call
   *     failed and may succeed later
   */
  List<List<Float>> embedBatch(List<EmbeddingInput> inputs);

  default List<Float> embed(EmbeddingInput input) {
    return embedBatch(List.of(input)).get(0);
  }
}
