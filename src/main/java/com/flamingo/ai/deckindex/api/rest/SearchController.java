package com.flamingo.ai.deckindex.api.rest;

import com.flamingo.ai.deckindex.api.dto.response.SearchHitResponse;
import com.flamingo.ai.deckindex.search.SlideSearchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for slide search. */
@RestController
@RequestMapping("/api/search")
@RequiredArgsConstructor
public class SearchController {

  private final SlideSearchService searchService;

  @GetMapping
  public ResponseEntity<List<SearchHitResponse>> search(
      @RequestParam("q") @NotBlank String query,
      @RequestParam(defaultValue = "10") @Min(1) @Max(100) int topK) {
    return ResponseEntity.ok(
        searchService.search(query, topK).stream().map(SearchHitResponse::fromPoint).toList());
  }
}
