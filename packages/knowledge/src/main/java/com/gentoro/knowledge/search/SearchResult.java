package com.gentoro.knowledge.search;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A ranked hit with the citation fields flattened out of its payload.
 *
 * <p>Instances are immutable; {@link #withScore(double)} is the only way to re-score a hit.
 *
 * @param score similarity or fusion score, higher is better
 * @param normative {@code true}/{@code false}, or {@code null} when unknown
 * @param metadata the full payload the hit was built from
 */
public record SearchResult(
    String id,
    String content,
    double score,
    String documentId,
    String documentTitle,
    String documentType,
    String sectionTitle,
    List<String> sectionHierarchy,
    String clauseNumber,
    List<Integer> pageNumbers,
    Boolean normative,
    String chunkType,
    Map<String, Object> metadata) {

  public static final String DOCUMENT_ID = "document_id";
  public static final String DOCUMENT_TITLE = "document_title";
  public static final String DOCUMENT_TYPE = "document_type";
  public static final String SECTION_TITLE = "section_title";
  public static final String SECTION_HIERARCHY = "section_hierarchy";
  public static final String CLAUSE_NUMBER = "clause_number";
  public static final String PAGE_NUMBERS = "page_numbers";
  public static final String NORMATIVE = "normative";
  public static final String CHUNK_TYPE = "chunk_type";

  private static final String HIERARCHY_SEPARATOR = " > ";

  public SearchResult {
    content = content == null ? "" : content;
    documentId = nullToEmpty(documentId);
    documentTitle = nullToEmpty(documentTitle);
    documentType = nullToEmpty(documentType);
    sectionTitle = nullToEmpty(sectionTitle);
    chunkType = nullToEmpty(chunkType);
    sectionHierarchy = sectionHierarchy == null ? List.of() : List.copyOf(sectionHierarchy);
    pageNumbers = pageNumbers == null ? List.of() : List.copyOf(pageNumbers);
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static SearchResult of(String id, String content, double score) {
    return fromMetadata(id, content, score, Map.of());
  }

  /**
   * Build a hit from a stored payload, reading the well-known keys ({@value #DOCUMENT_ID}, {@value
   * #CLAUSE_NUMBER}, ...). Missing or mistyped values fall back to empty.
   */
  public static SearchResult fromMetadata(
      String id, String content, double score, Map<String, ?> metadata) {
    Map<String, Object> meta =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    String clause = text(meta.get(CLAUSE_NUMBER));
    return new SearchResult(
        id,
        content,
        score,
        text(meta.get(DOCUMENT_ID)),
        text(meta.get(DOCUMENT_TITLE)),
        text(meta.get(DOCUMENT_TYPE)),
        text(meta.get(SECTION_TITLE)),
        hierarchy(meta.get(SECTION_HIERARCHY)),
        clause.isEmpty() ? null : clause,
        pages(meta.get(PAGE_NUMBERS)),
        normative(meta.get(NORMATIVE)),
        text(meta.get(CHUNK_TYPE)),
        meta);
  }

  /** Copy with the score replaced. */
  public SearchResult withScore(double newScore) {
    return new SearchResult(
        id,
        content,
        newScore,
        documentId,
        documentTitle,
        documentType,
        sectionTitle,
        sectionHierarchy,
        clauseNumber,
        pageNumbers,
        normative,
        chunkType,
        metadata);
  }

  private static String nullToEmpty(String s) {
    return s == null ? "" : s;
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString();
  }

  private static List<String> hierarchy(Object value) {
    if (value instanceof List<?> list) {
      List<String> out = new ArrayList<>();
      for (Object o : list) if (o != null) out.add(o.toString());
      return out;
    }
    if (value instanceof String s && !s.isBlank()) {
      return Arrays.asList(s.split(HIERARCHY_SEPARATOR));
    }
    return List.of();
  }

  private static List<Integer> pages(Object value) {
    if (!(value instanceof List<?> list)) return List.of();
    List<Integer> out = new ArrayList<>();
    for (Object o : list) {
      if (o instanceof Number n) {
        out.add(n.intValue());
      } else if (o instanceof String s && s.trim().matches("\\d+")) {
        out.add(Integer.parseInt(s.trim()));
      }
    }
    return out;
  }

  private static Boolean normative(Object value) {
    if (value instanceof Boolean b) return b;
    if (value instanceof String s) {
      if ("true".equalsIgnoreCase(s.trim())) return Boolean.TRUE;
      if ("false".equalsIgnoreCase(s.trim())) return Boolean.FALSE;
    }
    return null;
  }
}
