package com.gentoro.knowledge.search;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A document as handed to a {@link LexicalIndex}; {@code metadata} is returned with each hit. */
public record LexicalDocument(String id, String content, Map<String, Object> metadata) {
  public LexicalDocument {
    content = content == null ? "" : content;
    metadata =
        metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public LexicalDocument(String id, String content) {
    this(id, content, Map.of());
  }
}
