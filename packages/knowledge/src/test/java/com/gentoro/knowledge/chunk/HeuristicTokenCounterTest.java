package com.gentoro.knowledge.chunk;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class HeuristicTokenCounterTest {

  private final HeuristicTokenCounter tokens = new HeuristicTokenCounter();

  @Test
  @DisplayName("count handles null/empty and basic lengths")
  void countBasic() {
    assertEquals(0, tokens.count(null));
    assertEquals(0, tokens.count(""));
    assertEquals(1, tokens.count("a"));
    assertEquals(1, tokens.count("abcd"));
    assertEquals(2, tokens.count("abcdefgh"));
    assertEquals(3, tokens.count("abcdefghijkl"));
  }

  @Test
  @DisplayName("tail returns the full text when asked for at least its size")
  void tailFull() {
    String text = "The quick brown fox jumps over the lazy dog";
    int total = tokens.count(text);
    assertEquals(text, tokens.tail(text, total));
    assertEquals(text, tokens.tail(text, total + 10));
    assertEquals("", tokens.tail(text, 0));
  }

  @Test
  @DisplayName("tail returns a suffix starting at a word boundary")
  void tailSuffix() {
    String text = "one two three four five six seven eight nine ten";
    String suffix = tokens.tail(text, Math.max(1, tokens.count(text) / 2));

    assertTrue(text.endsWith(suffix));
    assertFalse(suffix.isEmpty());
    assertTrue(suffix.length() < text.length());
    assertFalse(suffix.startsWith(" "));
  }
}
