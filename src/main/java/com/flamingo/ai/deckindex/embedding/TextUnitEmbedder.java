package com.flamingo.ai.deckindex.embedding;

import com.flamingo.ai.deckindex.config.IngestionConfig;
import com.flamingo.ai.deckindex.domain.enums.VectorKind;
import com.flamingo.ai.deckindex.domain.model.ContentUnit;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Text vectors from the unit's body text followed by its speaker notes. */
@Component
@Slf4j
public class TextUnitEmbedder implements UnitEmbedder {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final int maxChars;
  private final String passagePrefix;
  private final String queryPrefix;

  public TextUnitEmbedder(
      EmbeddingModel embeddingModel, MeterRegistry meterRegistry, IngestionConfig ingestionConfig) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    IngestionConfig.Embedding embedding = ingestionConfig.getEmbedding();
    this.maxChars = embedding.getMaxChars();
    this.passagePrefix = embedding.getPassagePrefix() == null ? "" : embedding.getPassagePrefix();
    this.queryPrefix = embedding.getQueryPrefix() == null ? "" : embedding.getQueryPrefix();
  }

  @Override
  public VectorKind kind() {
    return VectorKind.TEXT;
  }

  @Override
  public boolean accepts(EmbeddingInput input) {
    return input.unit().hasContent();
  }

  @Override
  @Timed(value = "embedding.text.batch", description = "Time to embed a batch of units")
  public List<List<Float>> embedBatch(List<EmbeddingInput> inputs) {
    List<TextSegment> segments = new ArrayList<>(inputs.size());
    for (EmbeddingInput input : inputs) {
      segments.add(TextSegment.from(truncate(passagePrefix + passageText(input.unit()))));
    }
    Response<List<Embedding>> response;
    try {
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "passage").increment();
      throw new TransientStageException("embed", "Text embedding failed: " + e.getMessage(), e);
    }
    List<Embedding> embeddings = response.content();
    if (embeddings == null || embeddings.size() != inputs.size()) {
      throw new TransientStageException(
          "embed",
          "Embedding provider returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + inputs.size()
              + " inputs");
    }
    meterRegistry.counter("embedding.requests.success", "type", "passage").increment();
    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(embedding.vectorAsList());
    }
    return vectors;
  }

  /** Embeds a search query with the query prefix. */
  public List<Float> embedQuery(String query) {
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(queryPrefix + query));
      meterRegistry.counter("embedding.requests.success", "type", "query").increment();
      return response.content().vectorAsList();
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", "query").increment();
      throw new TransientStageException("search", "Query embedding failed: " + e.getMessage(), e);
    }
  }

  static String passageText(ContentUnit unit) {
    String text = unit.text() == null ? "" : unit.text();
    String notes = unit.notes() == null ? "" : unit.notes();
    if (notes.isBlank()) {
      return text;
    }
    if (text.isBlank()) {
      return notes;
    }
    return text + "\n\n" + notes;
  }

  private String truncate(String input) {
    if (input.length() <= maxChars) {
      return input;
    }
    log.debug("Truncating embedding input from {} to {} chars", input.length(), maxChars);
    return input.substring(0, maxChars);
  }
}
