package com.gentoro.knowledge.chunk;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A token-bounded piece of a document produced by a {@link Chunker}.
 *
 * @param clauseNumber standards numbering such as {@code 6.4.2}; null when none was found
 * @param pageNumbers pages of every merged source element, first-seen order, no duplicates
 * @param hasOverlap content begins with text carried over from the previous chunk
 */
public record ChunkResult(
    String content,
    int tokenCount,
    List<String> sectionHierarchy,
    String clauseNumber,
    List<Integer> pageNumbers,
    ChunkType chunkType,
    boolean hasOverlap,
    Map<String, Object> metadata) {

  public ChunkResult {
    content = content == null ? "" : content;
    tokenCount = Math.max(0, tokenCount);
    sectionHierarchy = sectionHierarchy == null ? List.of() : List.copyOf(sectionHierarchy);
    pageNumbers = pageNumbers == null ? List.of() : List.copyOf(pageNumbers);
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public Optional<String> clause() {
    return Optional.ofNullable(clauseNumber);
  }

  /** Innermost section heading, or an empty string at document level. */
  public String sectionTitle() {
    return sectionHierarchy.isEmpty() ? "" : sectionHierarchy.get(sectionHierarchy.size() - 1);
  }
}
