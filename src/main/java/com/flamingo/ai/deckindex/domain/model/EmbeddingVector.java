package com.flamingo.ai.deckindex.domain.model;

import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import java.util.List;

/** One embedding of a content unit. Several kinds may exist for the same unit. */
public record EmbeddingVector(
    String remoteId, int unitIndex, int chunkId, VectorKind kind, List<Float> vector) {}
