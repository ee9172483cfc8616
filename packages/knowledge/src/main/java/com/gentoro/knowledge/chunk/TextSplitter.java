package com.gentoro.knowledge.chunk;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits oversized prose into pieces that fit a token budget, trying paragraph, then sentence,
 * then word boundaries. Splitting scans characters instead of using regular expressions, which
 * overflow the stack on very long inputs.
 */
final class TextSplitter {
  private static final int MAX_DEPTH = 10;

  private final TokenCounter tokens;
  private final int maxTokens;

  TextSplitter(TokenCounter tokens, int maxTokens) {
    this.tokens = tokens;
    this.maxTokens = Math.max(1, maxTokens);
  }

  List<String> split(String text) {
    List<String> out = new ArrayList<>();
    if (text == null || text.isBlank()) return out;
    split(text.trim(), 0, out);
    return out;
  }

  private void split(String text, int depth, List<String> out) {
    if (tokens.count(text) <= maxTokens) {
      out.add(text);
      return;
    }
    if (depth > MAX_DEPTH) {
      splitByWords(text, out);
      return;
    }
    List<String> paragraphs = splitByParagraphs(text);
    if (paragraphs.size() > 1) {
      for (String packed : pack(paragraphs, "\n\n")) split(packed, depth + 1, out);
      return;
    }
    List<String> sentences = splitBySentences(text);
    if (sentences.size() > 1) {
      for (String packed : pack(sentences, " ")) split(packed, depth + 1, out);
      return;
    }
    splitByWords(text, out);
  }

  // Greedily joins consecutive parts while the result stays within budget.
  private List<String> pack(List<String> parts, String separator) {
    List<String> packed = new ArrayList<>();
    StringBuilder collector = new StringBuilder();
    for (String part : parts) {
      if (collector.length() == 0) {
        collector.append(part);
        continue;
      }
      String candidate = collector + separator + part;
      if (tokens.count(candidate) > maxTokens) {
        packed.add(collector.toString());
        collector = new StringBuilder(part);
      } else {
        collector = new StringBuilder(candidate);
      }
    }
    if (collector.length() > 0) packed.add(collector.toString());
    return packed;
  }

  private void splitByWords(String text, List<String> out) {
    StringBuilder collector = new StringBuilder();
    for (String word : text.split("\\s+")) {
      if (word.isEmpty()) continue;
      if (tokens.count(word) > maxTokens) {
        if (collector.length() > 0) {
          out.add(collector.toString());
          collector = new StringBuilder();
        }
        forceSplitBySize(word, out);
        continue;
      }
      if (collector.length() == 0) {
        collector.append(word);
      } else if (tokens.count(collector + " " + word) > maxTokens) {
        out.add(collector.toString());
        collector = new StringBuilder(word);
      } else {
        collector.append(' ').append(word);
      }
    }
    if (collector.length() > 0) out.add(collector.toString());
  }

  // Last resort for a single run of characters longer than the budget.
  private void forceSplitBySize(String text, List<String> out) {
    int start = 0;
    while (start < text.length()) {
      int end = Math.min(text.length(), start + Math.max(1, maxTokens * 4));
      while (end > start + 1 && tokens.count(text.substring(start, end)) > maxTokens) {
        end = start + (end - start) * 3 / 4;
      }
      out.add(text.substring(start, end));
      start = end;
    }
  }

  /** A paragraph boundary is a newline, optional spaces, and another newline. */
  static List<String> splitByParagraphs(String text) {
    List<String> paragraphs = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int len = text.length();
    int i = 0;
    while (i < len) {
      char c = text.charAt(i);
      if (c == '\n') {
        int j = i + 1;
        while (j < len && Character.isWhitespace(text.charAt(j)) && text.charAt(j) != '\n') {
          j++;
        }
        if (j < len && text.charAt(j) == '\n') {
          addTrimmed(current, paragraphs);
          current = new StringBuilder();
          i = j + 1;
          continue;
        }
      }
      current.append(c);
      i++;
    }
    addTrimmed(current, paragraphs);
    return paragraphs;
  }

  /**
   * Splits after '.', '!' or '?' followed by whitespace. Abbreviations and decimals may split
   * early; the pieces are still meaningful for retrieval.
   */
  static List<String> splitBySentences(String text) {
    List<String> sentences = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    int len = text.length();
    for (int i = 0; i < len; i++) {
      char c = text.charAt(i);
      current.append(c);
      if ((c == '.' || c == '!' || c == '?')
          && i < len - 1
          && Character.isWhitespace(text.charAt(i + 1))) {
        addTrimmed(current, sentences);
        current = new StringBuilder();
        while (i + 1 < len && Character.isWhitespace(text.charAt(i + 1))) i++;
      }
    }
    addTrimmed(current, sentences);
    return sentences;
  }

  private static void addTrimmed(StringBuilder sb, List<String> out) {
    String s = sb.toString().trim();
    if (!s.isEmpty()) out.add(s);
  }
}
