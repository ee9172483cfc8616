package com.gentoro.knowledge.ingest;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void knownDigest() {
    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        ContentHasher.sha256("abc"));
  }

  @Test
  void ignoresSurroundingWhitespaceAndLineEndings() {
    assertEquals(ContentHasher.sha256("a\nb"), ContentHasher.sha256("  a\r\nb \n"));
    assertNotEquals(ContentHasher.sha256("a b"), ContentHasher.sha256("a  b"));
    assertEquals(ContentHasher.sha256(""), ContentHasher.sha256(null));
  }
}
