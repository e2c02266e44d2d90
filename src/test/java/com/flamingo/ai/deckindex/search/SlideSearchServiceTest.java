package com.flamingo.ai.deckindex.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import com.flamingo.ai.deckindex.elasticsearch.VectorIndexOperations;
import com.flamingo.ai.deckindex.embedding.TextUnitEmbedder;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SlideSearchService")
class SlideSearchServiceTest {

  @Mock private TextUnitEmbedder textEmbedder;
  @Mock private VectorIndexOperations<IndexPoint> index;

  private SlideSearchService service;

  @BeforeEach
  void setUp() {
    service = new SlideSearchService(textEmbedder, index);
  }

  @Test
  @DisplayName("Should search the text vector field with the trimmed query embedding")
  void shouldSearchTextField_whenQueryGiven() {
    // Given
    List<Float> vector = List.of(0.1f, 0.2f);
    IndexPoint hit = IndexPoint.builder().id("deck.pptx:0:0").build();
    when(textEmbedder.embedQuery("quarterly revenue")).thenReturn(vector);
    when(index.vectorSearch(Map.of(), "text_vector", vector, 3)).thenReturn(List.of(hit));

    // When
    List<IndexPoint> hits = service.search("  quarterly revenue ", 3);

    // Then
    assertThat(hits).containsExactly(hit);
    verify(textEmbedder).embedQuery("quarterly revenue");
  }

  @Test
  @DisplayName("Should reject a blank query before embedding")
  void shouldThrow_whenQueryBlank() {
    assertThatThrownBy(() -> service.search("   ", 5))
        .isInstanceOf(IllegalArgumentException.class);

    verifyNoInteractions(index);
    verify(textEmbedder, never()).embedQuery(anyString());
  }
}
