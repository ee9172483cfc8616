package com.gentoro.knowledge.ingest;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.chunk.ElementType;
import com.gentoro.knowledge.chunk.ParsedElement;
import com.gentoro.knowledge.exception.IoException;
import com.gentoro.knowledge.exception.KnowledgeErrorCode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MarkdownElementParserTest {

  private static final String DOCUMENT =
      """
      # 1 Scope

      This document specifies requirements.

      ## 1.1 Terms

      - item one
      - item two

      ```
      code
      ```

      | Term | Meaning |
      | --- | --- |
      | ASIL | Level |

      ![Fault tree](ft.png)

      ---

      # 2 Normative references
      """;

  private final MarkdownElementParser parser = new MarkdownElementParser();

  @Test
  @DisplayName("Block nodes map to element types in document order")
  void elementTypes() {
    List<ParsedElement> elements = parser.parse(DOCUMENT);

    assertEquals(
        List.of(
            ElementType.HEADING,
            ElementType.PARAGRAPH,
            ElementType.HEADING,
            ElementType.LIST,
            ElementType.CODE,
            ElementType.TABLE,
            ElementType.FIGURE,
            ElementType.HEADING),
        elements.stream().map(e -> e.type().orElseThrow()).collect(Collectors.toList()));
    assertEquals("code", elements.get(4).content());
  }

  @Test
  @DisplayName("Headings carry their level and ancestor path")
  void headings() {
    List<ParsedElement> elements = parser.parse(DOCUMENT);

    ParsedElement terms = elements.get(2);
    assertEquals("1.1 Terms", terms.headingText());
    assertEquals(Optional.of(2), terms.level());
    assertEquals(List.of("1 Scope"), terms.sectionHierarchy());
    assertEquals(List.of("1 Scope", "1.1 Terms"), elements.get(3).sectionHierarchy());
    assertEquals(List.of(), elements.get(7).sectionHierarchy());
  }

  @Test
  @DisplayName("Tables keep their rows and figures their alt text")
  void tablesAndFigures() {
    List<ParsedElement> elements = parser.parse(DOCUMENT);

    assertEquals(
        List.of(List.of("Term", "Meaning"), List.of("ASIL", "Level")),
        elements.get(5).tableRows());
    assertEquals(Optional.of("Fault tree"), elements.get(6).caption());
  }

  @Test
  @DisplayName("Files are read as UTF-8 markdown; missing files fail with IO_ERROR")
  void files(@TempDir Path dir) throws IOException {
    Path file = dir.resolve("doc.md");
    Files.writeString(file, "# Überblick\n\nText.\n");

    assertEquals(2, parser.parse(file).size());
    assertTrue(parser.parse("  \n").isEmpty());

    IoException missing =
        assertThrows(IoException.class, () -> parser.parse(dir.resolve("absent.md")));
    assertEquals(KnowledgeErrorCode.IO_ERROR, missing.getCode());
  }
}
