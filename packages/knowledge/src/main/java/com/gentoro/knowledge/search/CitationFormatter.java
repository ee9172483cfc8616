package com.gentoro.knowledge.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Formats hits as standards-style references, e.g. {@code ISO/IEC/IEEE 12207:2017, Clause 6.4.2
 * (Verification), p.23}. Missing parts are omitted.
 */
public class CitationFormatter {
  private final boolean includeRelevance;

  public CitationFormatter() {
    this(true);
  }

  public CitationFormatter(boolean includeRelevance) {
    this.includeRelevance = includeRelevance;
  }

  /**
   * @param clauseNumber prefixed with "Clause " unless it already starts with "Clause" or "Section"
   * @param sectionTitle shown in parentheses after the clause; ignored without a clause
   * @param pageNumbers a single page renders as {@code p.N}, several as {@code pp.min-max}
   */
  public static String formatCitation(
      String documentTitle, String clauseNumber, List<Integer> pageNumbers, String sectionTitle) {
    List<String> parts = new ArrayList<>();
    parts.add(documentTitle == null ? "" : documentTitle);

    if (clauseNumber != null && !clauseNumber.isBlank()) {
      String lower = clauseNumber.toLowerCase(Locale.ROOT);
      String clause =
          lower.startsWith("clause") || lower.startsWith("section")
              ? clauseNumber
              : "Clause " + clauseNumber;
      if (sectionTitle != null && !sectionTitle.isBlank()) {
        clause = clause + " (" + sectionTitle + ")";
      }
      parts.add(clause);
    }

    if (pageNumbers != null && !pageNumbers.isEmpty()) {
      if (pageNumbers.size() == 1) {
        parts.add("p." + pageNumbers.get(0));
      } else {
        parts.add("pp." + Collections.min(pageNumbers) + "-" + Collections.max(pageNumbers));
      }
    }
    return String.join(", ", parts);
  }

  public String format(SearchResult result) {
    return includeRelevance ? formatWithRelevance(result) : formatBase(result);
  }

  /** Always appends {@code (NN% relevant)}, the score truncated to a whole percentage. */
  public String formatWithRelevance(SearchResult result) {
    int percent = (int) (result.score() * 100);
    return formatBase(result) + " (" + percent + "% relevant)";
  }

  private static String formatBase(SearchResult result) {
    return formatCitation(
        result.documentTitle(),
        result.clauseNumber(),
        result.pageNumbers(),
        result.sectionTitle());
  }
}
