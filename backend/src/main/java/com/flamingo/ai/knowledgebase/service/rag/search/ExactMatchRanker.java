package com.flamingo.ai.knowledgebase.service.rag.search;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Lexical scoring of exact-recall candidates.
 *
 * <p>A chunk matches when it contains the whole query or every query term. Whole-query hits rank
 * first; within each group chunks with more term occurrences rank higher.
 */
final class ExactMatchRanker {

  /** Occurrences of one term that still raise the score. */
  static final int MAX_COUNTED_OCCURRENCES = 3;

  private ExactMatchRanker() {}

  /** Escapes LIKE wildcards so the value matches literally under {@code ESCAPE '\'}. */
  static String escapeLike(String value) {
    return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  /** The longest term. Every chunk holding all terms contains it, so it bounds the candidates. */
  static String anchorTerm(List<String> terms) {
    return terms.stream().max(Comparator.comparingInt(String::length)).orElse("");
  }

  /**
   * Scores one chunk.
   *
   * @return a score in [0, 2), or a negative value when the chunk does not match
   */
  static double score(String content, String phrase, List<String> terms) {
    String text = content == null ? "" : content.toLowerCase(Locale.ROOT);
    boolean phraseHit = !phrase.isEmpty() && text.contains(phrase);
    if (terms.isEmpty()) {
      return phraseHit ? 1.0 : -1.0;
    }
    int counted = 0;
    for (String term : terms) {
      int occurrences = occurrences(text, term);
      if (occurrences == 0 && !phraseHit) {
        return -1.0;
      }
      counted += Math.min(occurrences, MAX_COUNTED_OCCURRENCES);
    }
    double coverage = counted / (double) (MAX_COUNTED_OCCURRENCES * terms.size());
    return (phraseHit ? 1.0 : 0.0) + coverage * 0.999;
  }

  /**
   * Keeps matching chunks, best first. Ties keep candidate order.
   *
   * @param candidates chunks from the LIKE lookups, in storage order
   * @param query the raw query text
   * @param terms distinct lowercase query terms
   * @param limit maximum number of chunks returned
   */
  static List<Chunk> rank(
      Collection<Chunk> candidates, String query, List<String> terms, int limit) {
    String phrase = query.strip().toLowerCase(Locale.ROOT);
    record Scored(Chunk chunk, double score) {}
    return candidates.stream()
        .map(c -> new Scored(c, score(c.getContent(), phrase, terms)))
        .filter(s -> s.score() >= 0)
        .sorted(Comparator.comparingDouble(Scored::score).reversed())
        .limit(limit)
        .map(Scored::chunk)
        .toList();
  }

  private static int occurrences(String text, String term) {
    int count = 0;
    for (int i = text.indexOf(term); i >= 0; i = text.indexOf(term, i + term.length())) {
      count++;
    }
    return count;
  }
}
