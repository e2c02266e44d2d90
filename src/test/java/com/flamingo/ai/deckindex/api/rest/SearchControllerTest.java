package com.flamingo.ai.deckindex.api.rest;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.deckindex.elasticsearch.IndexPoint;
import com.flamingo.ai.deckindex.exception.GlobalExceptionHandler;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.search.SlideSearchService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("SearchController")
class SearchControllerTest {

  @Mock private SlideSearchService searchService;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(new SearchController(searchService))
            .setControllerAdvice(new GlobalExceptionHandler(new SimpleMeterRegistry()))
            .build();
  }

  @Test
  @DisplayName("Should map index points to search hits")
  void shouldReturnHits_whenQueryMatches() throws Exception {
    // Given
    IndexPoint point =
        IndexPoint.builder()
            .id("deck.pptx:2:0")
            .remoteId("deck.pptx")
            .displayName("deck.pptx")
            .unitIndex(2)
            .title("Revenue")
            .text("Revenue grew in every region")
            .assetPath("/data/rendered/abc/slide-3.png")
            .relevanceScore(0.87)
            .build();
    when(searchService.search("revenue", 5)).thenReturn(List.of(point));

    // When / Then
    mockMvc
        .perform(get("/api/search").param("q", "revenue").param("topK", "5"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("deck.pptx:2:0"))
        .andExpect(jsonPath("$[0].unitIndex").value(2))
        .andExpect(jsonPath("$[0].title").value("Revenue"))
        .andExpect(jsonPath("$[0].score").value(0.87));
  }

  @Test
  @DisplayName("Should return 400 when the query parameter is missing")
  void shouldReturnBadRequest_whenQueryMissing() throws Exception {
    mockMvc
        .perform(get("/api/search"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should return 503 when the embedding backend is unavailable")
  void shouldReturnServiceUnavailable_whenEmbeddingFails() throws Exception {
    // Given
    when(searchService.search("revenue", 10))
        .thenThrow(new TransientStageException("search", "embedding backend unavailable"));

    // When / Then
    mockMvc
        .perform(get("/api/search").param("q", "revenue"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("SEARCH_001"));
  }
}
