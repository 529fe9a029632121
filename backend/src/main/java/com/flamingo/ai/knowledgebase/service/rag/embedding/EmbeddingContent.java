package com.flamingo.ai.knowledgebase.service.rag.embedding;

import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.service.rag.chunking.TokenEstimator;

/**
 * Selects the text that represents a chunk in vector space. The stored content is never changed;
 * search results always return the full chunk.
 */
public final class EmbeddingContent {

  static final String TRUNCATION_MARKER = "\n\n[... content truncated ...]";

  private EmbeddingContent() {}

  /**
   * Returns the text to embed for a chunk.
   *
   * <p>Image chunks are stored as {@code url + "\n" + description}; only the description is
   * embedded, and a chunk holding just a URL or placeholder yields an empty string. Other content
   * above {@code maxTokens} is cut and marked.
   *
   * @param type chunk type
   * @param content stored chunk content
   * @param maxTokens embedding budget
   * @return embedding text, possibly empty
   */
  public static String select(ChunkType type, String content, int maxTokens) {
    if (content == null || content.isEmpty()) {
      return "";
    }
    String text = content;
    if (type == ChunkType.IMAGE_CAPTION) {
      int newline = text.indexOf('\n');
      text = newline < 0 ? "" : text.substring(newline + 1).strip();
    }
    if (text.isEmpty() || TokenEstimator.estimate(text) <= maxTokens) {
      return text;
    }
    int maxChars = maxTokens * TokenEstimator.APPROX_CHARS_PER_TOKEN - 20;
    return text.substring(0, Math.min(maxChars, text.length())).stripTrailing()
        + TRUNCATION_MARKER;
  }
}
