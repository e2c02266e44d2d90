package com.flamingo.ai.deckindex.pipeline.stage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.domain.model.StagedDocument;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import com.flamingo.ai.deckindex.pipeline.FakeDocumentSource;
import com.flamingo.ai.deckindex.pipeline.TestRetrySettings;
import com.flamingo.ai.deckindex.staging.StagingArea;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("DownloadStage")
class DownloadStageTest {

  private static final Instant T1 = Instant.parse("2026-03-01T08:00:00Z");

  @TempDir Path tempDir;

  private FakeDocumentSource source;
  private StagingArea staging;

  @BeforeEach
  void setUp() {
    source = new FakeDocumentSource();
    staging =
        new StagingArea(
            tempDir.resolve("staging"), tempDir.resolve("rendered"), new ObjectMapper());
  }

  private DownloadStage stage(int attempts) {
    return new DownloadStage(source, staging, TestRetrySettings.policy("download", attempts));
  }

  @Test
  @DisplayName("Should stage the fetched bytes under the document key with their hash")
  void shouldStageBytesAndHash_whenFetchSucceeds() throws Exception {
    // Given
    source.put("deck.pptx", T1, "Intro", "Numbers");
    SourceDocument document = source.listDocuments().get(0);
    String key = staging.stagingKey("deck.pptx");

    // When
    StagedDocument staged = stage(3).download(document, key, (attempt, cause) -> {});

    // Then
    assertThat(staged.file()).endsWith(Path.of(key, "source.pptx"));
    assertThat(Files.readString(staged.file())).isEqualTo("Intro\n---\nNumbers");
    assertThat(staged.contentHash())
        .hasSize(64)
        .isEqualTo(StagingArea.contentHash(staged.file()));
    assertThat(staged.stagingKey()).isEqualTo(key);
  }

  @Test
  @DisplayName("Should retry transient fetch failures and report each retry")
  void shouldRetry_whenFetchFailsTransiently() {
    // Given
    source.put("deck.pptx", T1, "Intro");
    source.failFetches("deck.pptx", 2);
    List<Integer> retries = new ArrayList<>();

    // When
    StagedDocument staged =
        stage(3)
            .download(
                source.listDocuments().get(0),
                staging.stagingKey("deck.pptx"),
                (attempt, cause) -> retries.add(attempt));

    // Then
    assertThat(staged.contentHash()).isNotBlank();
    assertThat(retries).containsExactly(1, 2);
    assertThat(source.fetchCount("deck.pptx")).isEqualTo(3);
  }

  @Test
  @DisplayName("Should give up after the configured attempts")
  void shouldThrowTransient_whenAttemptsExhausted() {
    // Given
    source.put("deck.pptx", T1, "Intro");
    source.failFetches("deck.pptx", 5);
    SourceDocument document = source.listDocuments().get(0);

    // When / Then
    assertThatThrownBy(() -> stage(2).download(document, "key", (attempt, cause) -> {}))
        .isInstanceOf(TransientStageException.class)
        .hasMessageContaining("connection reset");
    assertThat(source.fetchCount("deck.pptx")).isEqualTo(2);
  }

  @Test
  @DisplayName("Should surface a listing failure once retries are spent")
  void shouldThrow_whenListingUnavailable() {
    // Given
    source.setListingUnavailable(true);

    // When / Then
    assertThatThrownBy(() -> stage(2).listDocuments())
        .isInstanceOf(TransientStageException.class)
        .hasMessageContaining("source unreachable");
  }
}
