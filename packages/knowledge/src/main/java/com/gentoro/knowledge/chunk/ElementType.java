package com.gentoro.knowledge.chunk;

import java.util.Locale;
import java.util.Optional;

/** Kinds of parsed document elements the chunker understands. */
public enum ElementType {
  HEADING,
  PARAGRAPH,
  TABLE,
  LIST,
  CODE,
  FIGURE;

  /**
   * Resolve a parser's wire name ({@code heading}, {@code paragraph}, ...). Parsers that emit
   * {@code text} for plain prose are mapped to {@link #PARAGRAPH}.
   */
  public static Optional<ElementType> fromWireName(String name) {
    if (name == null || name.isBlank()) return Optional.empty();
    String normalized = name.trim().toLowerCase(Locale.ROOT);
    if ("text".equals(normalized)) return Optional.of(PARAGRAPH);
    for (ElementType type : values()) {
      if (type.wireName().equals(normalized)) return Optional.of(type);
    }
    return Optional.empty();
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
