package com.gentoro.knowledge.search;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lowercases and splits on anything other than letters, digits and dots, then trims dots from
 * both ends, so clause numbers like {@code 6.4.2} stay single terms while a sentence-final period
 * is dropped.
 */
final class TextAnalyzer {
  private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}.]+");

  private TextAnalyzer() {}

  static List<String> analyze(String text) {
    List<String> terms = new ArrayList<>();
    if (text == null || text.isBlank()) return terms;
    for (String raw : SEPARATORS.split(text.toLowerCase(Locale.ROOT))) {
      String term = stripDots(raw);
      if (!term.isEmpty()) terms.add(term);
    }
    return terms;
  }

  /** Query terms in first-seen order without repeats. */
  static List<String> analyzeQuery(String query) {
    return new ArrayList<>(new LinkedHashSet<>(analyze(query)));
  }

  private static String stripDots(String term) {
    int start = 0;
    int end = term.length();
    while (start < end && term.charAt(start) == '.') start++;
    while (end > start && term.charAt(end - 1) == '.') end--;
    return term.substring(start, end);
  }
}
