package com.flamingo.ai.knowledgebase.service.rag.chunking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits oversized text on progressively finer separators, then falls back to fixed character
 * windows with overlap.
 */
final class RecursiveTextSplitter {

  static final List<String> SEPARATORS =
      List.of("\n\n", "\n", "。", ". ", "；", "; ", "，", ", ");

  static final int OVERLAP_TOKENS = 64;

  private RecursiveTextSplitter() {}

  static List<String> split(String text, int maxTokens) {
    if (TokenEstimator.estimate(text) <= maxTokens) {
      return List.of(text);
    }
    List<String> parts = splitBySeparators(text, SEPARATORS);
    if (parts.size() <= 1) {
      return forceSplit(text, maxTokens, OVERLAP_TOKENS);
    }

    List<String> result = new ArrayList<>();
    String buffer = "";
    for (String part : parts) {
      String candidate = buffer.isEmpty() ? part : (buffer + "\n\n" + part).strip();
      if (TokenEstimator.estimate(candidate) <= maxTokens) {
        buffer = candidate;
        continue;
      }
      if (!buffer.isEmpty()) {
        result.add(buffer);
      }
      if (TokenEstimator.estimate(part) > maxTokens) {
        result.addAll(split(part, maxTokens));
        buffer = "";
      } else {
        buffer = part;
      }
    }
    if (!buffer.isEmpty()) {
      result.add(buffer);
    }
    return result;
  }

  private static List<String> splitBySeparators(String text, List<String> separators) {
    if (separators.isEmpty()) {
      return List.of(text);
    }
    String separator = separators.get(0);
    List<String> parts =
        Arrays.stream(text.split(Pattern.quote(separator)))
            .filter(p -> !p.isBlank())
            .toList();
    if (parts.size() <= 1 && separators.size() > 1) {
      return splitBySeparators(text, separators.subList(1, separators.size()));
    }
    return parts;
  }

  static List<String> forceSplit(String text, int maxTokens, int overlapTokens) {
    int size = Math.max(1, maxTokens * TokenEstimator.APPROX_CHARS_PER_TOKEN);
    int overlap = Math.min(size - 1, overlapTokens * TokenEstimator.APPROX_CHARS_PER_TOKEN);
    List<String> result = new ArrayList<>();
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(start + size, text.length());
      result.add(text.substring(start, end));
      start = end < text.length() ? end - overlap : end;
    }
    return result;
  }
}
