package com.gentoro.knowledge.chunk;

import com.gentoro.knowledge.exception.ConfigException;
import java.util.Locale;

/** Counts tokens the way the downstream embedding model would. */
public interface TokenCounter {

  /** Number of tokens in {@code text}; 0 for null or empty text. */
  int count(String text);

  /** The trailing part of {@code text} holding roughly its last {@code tokens} tokens. */
  String tail(String text, int tokens);

  /**
   * Look up an implementation by its configuration name.
   *
   * @param name {@code cl100k} or {@code heuristic}
   */
  static TokenCounter named(String name) {
    String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
    return switch (key) {
      case "", "cl100k", "cl100k_base" -> new Cl100kTokenCounter();
      case "heuristic" -> new HeuristicTokenCounter();
      default -> throw new ConfigException("Unknown tokenizer '%s'".formatted(name));
    };
  }
}
