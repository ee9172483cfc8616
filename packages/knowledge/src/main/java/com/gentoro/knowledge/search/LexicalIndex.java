package com.gentoro.knowledge.search;

import java.util.List;
import java.util.Map;

/** Keyword index searched alongside semantic retrieval. */
public interface LexicalIndex {

  /** Replace the index contents. Concurrent searches see either the old or the new corpus. */
  void buildIndex(List<LexicalDocument> documents);

  default List<SearchResult> search(String query, int nResults) {
    return search(query, nResults, Map.of());
  }

  /**
   * @param filters metadata key/value pairs a hit must match exactly; null or empty for none
   * @throws com.gentoro.knowledge.exception.IndexNotReadyException if no index was built yet
   */
  List<SearchResult> search(String query, int nResults, Map<String, Object> filters);

  boolean isIndexed();

  int documentCount();
}
