package com.gentoro.knowledge.chunk;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class Cl100kTokenCounterTest {

  private final Cl100kTokenCounter tokens = new Cl100kTokenCounter();

  @Test
  @DisplayName("counts byte-pair tokens")
  void counts() {
    assertEquals(0, tokens.count(null));
    assertEquals(0, tokens.count(""));
    assertEquals(2, tokens.count("hello world"));
  }

  @Test
  @DisplayName("tail decodes the last n tokens")
  void tail() {
    assertEquals("four five", tokens.tail("one two three four five", 2));
    assertEquals("one two", tokens.tail("one two", 10));
    assertEquals("", tokens.tail("one two", 0));
  }

  @Test
  @DisplayName("implementations are looked up by configuration name")
  void named() {
    assertInstanceOf(Cl100kTokenCounter.class, TokenCounter.named("cl100k"));
    assertInstanceOf(Cl100kTokenCounter.class, TokenCounter.named(null));
    assertInstanceOf(HeuristicTokenCounter.class, TokenCounter.named("Heuristic"));
    assertThrows(ConfigException.class, () -> TokenCounter.named("word-piece"));
  }
}
