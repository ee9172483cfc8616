package com.gentoro.knowledge.search;

import com.gentoro.knowledge.exception.ValidationException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reciprocal Rank Fusion: {@code score(d) = sum over lists of 1 / (k + rank(d))} with 1-based
 * ranks; a list that does not contain {@code d} contributes nothing.
 */
public final class ReciprocalRankFusion {
  public static final int DEFAULT_K = 60;

  private ReciprocalRankFusion() {}

  /**
   * Fuse ranked lists by id. The returned hits carry their fused score. Equal scores keep the
   * order in which ids were first seen, scanning the lists in order; when an id appears in several
   * lists the hit from the last one is kept.
   */
  public static List<SearchResult> fuse(List<List<SearchResult>> rankedLists, int k) {
    if (k < 0) {
      throw new ValidationException("RRF k must be >= 0, got " + k);
    }
    if (rankedLists == null || rankedLists.isEmpty()) return List.of();

    Map<String, Double> scores = new LinkedHashMap<>();
    Map<String, SearchResult> hits = new LinkedHashMap<>();
    for (List<SearchResult> list : rankedLists) {
      if (list == null) continue;
      Set<String> seenInList = new HashSet<>();
      int rank = 0;
      for (SearchResult hit : list) {
        if (hit == null || hit.id() == null) continue;
        rank++;
        if (!seenInList.add(hit.id())) continue;
        scores.merge(hit.id(), 1.0 / (k + rank), Double::sum);
        hits.put(hit.id(), hit);
      }
    }

    List<SearchResult> fused = new ArrayList<>(scores.size());
    for (Map.Entry<String, Double> e : scores.entrySet()) {
      fused.add(hits.get(e.getKey()).withScore(e.getValue()));
    }
    fused.sort((a, b) -> Double.compare(b.score(), a.score()));
    return fused;
  }
}
