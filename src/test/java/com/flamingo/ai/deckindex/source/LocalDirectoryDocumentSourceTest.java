package com.flamingo.ai.deckindex.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.deckindex.domain.model.SourceDocument;
import com.flamingo.ai.deckindex.exception.ContentProcessingException;
import com.flamingo.ai.deckindex.exception.TransientStageException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("LocalDirectoryDocumentSource Tests")
class LocalDirectoryDocumentSourceTest {

  @TempDir Path tempDir;

  private Path root;
  private LocalDirectoryDocumentSource source;

  @BeforeEach
  void setUp() throws Exception {
    root = Files.createDirectories(tempDir.resolve("documents"));
    source = new LocalDirectoryDocumentSource(root, List.of(".pptx", ".pdf"));
  }

  @Test
  @DisplayName("Should list supported files recursively with relative ids")
  void shouldListSupportedFiles_whenDirectoryHasMixedContent() throws Exception {
    // Given
    Files.createDirectories(root.resolve("sales"));
    Files.write(root.resolve("sales/q1.pptx"), new byte[] {1, 2, 3});
    Files.write(root.resolve("intro.PDF"), new byte[] {1});
    Files.write(root.resolve("~$q1.pptx"), new byte[] {1});
    Files.write(root.resolve("readme.txt"), new byte[] {1});

    // When
    List<SourceDocument> documents = source.listDocuments();

    // Then
    assertThat(documents).extracting(SourceDocument::remoteId)
        .containsExactly("intro.PDF", "sales/q1.pptx");
    SourceDocument q1 = documents.get(1);
    assertThat(q1.displayName()).isEqualTo("q1.pptx");
    assertThat(q1.size()).isEqualTo(3);
    assertThat(q1.modifiedTime()).isNotNull();
  }

  @Test
  @DisplayName("Should report a missing root as a transient failure")
  void shouldThrowTransient_whenRootMissing() {
    LocalDirectoryDocumentSource missing =
        new LocalDirectoryDocumentSource(tempDir.resolve("unmounted"), List.of(".pptx"));

    assertThatThrownBy(missing::listDocuments).isInstanceOf(TransientStageException.class);
  }

  @Test
  @DisplayName("Should copy document bytes into the target")
  void shouldCopyBytes_whenFetching() throws Exception {
    Files.writeString(root.resolve("deck.pptx"), "content");
    Path target = tempDir.resolve("staged.pptx");

    source.fetch("deck.pptx", target);

    assertThat(target).hasContent("content");
  }

  @Test
  @DisplayName("Should report a vanished document as a content error")
  void shouldThrowContentError_whenDocumentVanished() {
    assertThatThrownBy(() -> source.fetch("gone.pptx", tempDir.resolve("staged.pptx")))
        .isInstanceOf(ContentProcessingException.class)
        .hasMessageContaining("no longer exists");
  }

  @Test
  @DisplayName("Should refuse ids that escape the source root")
  void shouldThrow_whenIdEscapesRoot() {
    assertThatThrownBy(() -> source.fetch("../secret.pptx", tempDir.resolve("staged.pptx")))
        .isInstanceOf(ContentProcessingException.class);
  }
}
