package com.gentoro.knowledge.search;

import java.util.List;
import java.util.Map;

/**
 * Embedding-backed similarity search, provided by the vector store integration.
 *
 * <p>Implementations return at most {@code nResults} hits ordered by descending score, with scores
 * roughly in [0, 1]. Failures are reported by throwing; callers decide how to surface them.
 */
@FunctionalInterface
public interface SemanticSearcher {
  List<SearchResult> search(String query, int nResults, Map<String, Object> filters);
}
