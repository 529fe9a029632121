package com.flamingo.ai.knowledgebase.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("EmbeddingContent Tests")
class EmbeddingContentTest {

  @Test
  @DisplayName("Should embed only the description of an image chunk")
  void shouldEmbedOnlyImageDescription() {
    String text =
        EmbeddingContent.select(
            ChunkType.IMAGE_CAPTION, "http://blob/a.png\nA bar chart of latency", 2048);

    assertThat(text).isEqualTo("A bar chart of latency");
  }

  @Test
  @DisplayName("Should return empty text for an image chunk holding only a url")
  void shouldReturnEmptyForUrlOnlyImage() {
    assertThat(EmbeddingContent.select(ChunkType.IMAGE_CAPTION, "http://blob/a.png", 2048))
        .isEmpty();
  }

  @Test
  @DisplayName("Should keep short text unchanged")
  void shouldKeepShortTextUnchanged() {
    assertThat(EmbeddingContent.select(ChunkType.TEXT, "short text", 2048))
        .isEqualTo("short text");
  }

  @Test
  @DisplayName("Should truncate long text and mark it")
  void shouldTruncateLongText() {
    String content = "a".repeat(10_000);

    String text = EmbeddingContent.select(ChunkType.TABLE, content, 100);

    assertThat(text).endsWith(EmbeddingContent.TRUNCATION_MARKER);
    assertThat(text.length()).isLessThan(content.length());
  }

  @Test
  @DisplayName("Should handle null content")
  void shouldHandleNullContent() {
    assertThat(EmbeddingContent.select(ChunkType.TEXT, null, 2048)).isEmpty();
  }
}
