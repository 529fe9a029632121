package com.flamingo.ai.knowledgebase.service.rag.chunking;

/**
 * Approximate token counts without a tokenizer: about 1.5 characters per CJK ideograph and 4
 * characters per token for everything else.
 */
public final class TokenEstimator {

  /** Characters per token assumed when converting a token budget back into characters. */
  public static final int APPROX_CHARS_PER_TOKEN = 3;

  private TokenEstimator() {}

  public static int estimate(String text) {
    if (text == null || text.isEmpty()) {
      return 0;
    }
    int cjk = 0;
    for (int i = 0; i < text.length(); i++) {
      if (isCjk(text.charAt(i))) {
        cjk++;
      }
    }
    int other = text.length() - cjk;
    return (int) (cjk / 1.5 + other / 4.0) + 1;
  }

  /**
   * Cuts text to roughly {@code maxTokens} and appends {@code suffix}. Text within the budget is
   * returned unchanged.
   */
  public static String truncate(String text, int maxTokens, String suffix) {
    if (text == null || estimate(text) <= maxTokens) {
      return text;
    }
    int maxChars = Math.max(0, maxTokens * APPROX_CHARS_PER_TOKEN - suffix.length());
    return text.substring(0, Math.min(maxChars, text.length())).stripTrailing() + suffix;
  }

  static boolean isCjk(char c) {
    return c >= '一' && c <= '鿿';
  }
}
