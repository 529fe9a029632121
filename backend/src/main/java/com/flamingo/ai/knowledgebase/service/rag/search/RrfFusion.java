package com.flamingo.ai.knowledgebase.service.rag.search;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Reciprocal Rank Fusion.
 *
 * <p>Each ranked list adds {@code 1 / (k + rank + 1)} to a candidate, rank being 0-based. Scores
 * from the individual retrievers are ignored, so lists on different scales fuse cleanly.
 */
public final class RrfFusion {

  private RrfFusion() {}

  /** A fused candidate with the recall paths that returned it, sorted by name. */
  public record Fused(UUID chunkId, double score, List<String> sources) {}

  /**
   * Fuses ranked id lists.
   *
   * @param rankedBySource ranked chunk ids keyed by recall path name
   * @param k smoothing constant
   * @return candidates by descending fused score; ties keep first-seen order
   */
  public static List<Fused> fuse(Map<String, List<UUID>> rankedBySource, int k) {
    Map<UUID, Double> scores = new LinkedHashMap<>();
    Map<UUID, TreeSet<String>> sources = new LinkedHashMap<>();

    rankedBySource.forEach(
        (source, ids) -> {
          for (int rank = 0; rank < ids.size(); rank++) {
            UUID id = ids.get(rank);
            scores.merge(id, 1.0 / (k + rank + 1), Double::sum);
            sources.computeIfAbsent(id, x -> new TreeSet<>()).add(source);
          }
        });

    List<Fused> fused = new ArrayList<>(scores.size());
    scores.forEach((id, score) -> fused.add(new Fused(id, score, List.copyOf(sources.get(id)))));
    fused.sort(Comparator.comparingDouble(Fused::score).reversed());
    return fused;
  }
}
