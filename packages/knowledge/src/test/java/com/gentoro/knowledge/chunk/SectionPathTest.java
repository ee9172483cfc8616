package com.gentoro.knowledge.chunk;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SectionPathTest {

  @Test
  @DisplayName("push and truncate return new paths and leave the original untouched")
  void immutable() {
    SectionPath ab = SectionPath.root().push("A").push("B");
    SectionPath a = ab.truncate(1);
    SectionPath ac = a.push("C");

    assertEquals(List.of("A", "B"), ab.asList());
    assertEquals(List.of("A"), a.asList());
    assertEquals(List.of("A", "C"), ac.asList());
    assertEquals("A > B", ab.toString());
  }

  @Test
  @DisplayName("truncate beyond the depth keeps everything, to zero gives the root")
  void truncateBounds() {
    SectionPath path = SectionPath.of(List.of("A", "B"));
    assertSame(path, path.truncate(5));
    assertEquals(SectionPath.root(), path.truncate(0));
    assertTrue(SectionPath.root().innermost().isEmpty());
    assertEquals("B", path.innermost().orElseThrow());
  }
}
