package com.gentoro.knowledge.chunk;

/** Approximates one token per four characters; no vocabulary needed. */
public class HeuristicTokenCounter implements TokenCounter {

  @Override
  public int count(String text) {
    if (text == null || text.isEmpty()) return 0;
    return Math.max(1, text.length() / 4);
  }

  @Override
  public String tail(String text, int tokens) {
    if (text == null || tokens <= 0) return "";
    int totalTokens = count(text);
    if (tokens >= totalTokens) return text.trim();
    double fraction = (double) tokens / (double) totalTokens;
    int charLen = text.length();
    int cut = Math.max(0, charLen - (int) Math.ceil(charLen * fraction));
    // start on a word boundary
    if (cut > 0 && cut < charLen) {
      int nextSpace = text.indexOf(' ', cut);
      if (nextSpace > cut) cut = nextSpace;
    }
    return text.substring(cut).trim();
  }
}
