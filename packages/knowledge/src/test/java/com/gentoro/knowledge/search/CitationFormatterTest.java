package com.gentoro.knowledge.search;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CitationFormatterTest {

  @Test
  @DisplayName("Full citation with clause, section title and single page")
  void fullCitation() {
    assertEquals(
        "ISO/IEC/IEEE 12207:2017, Clause 6.4.2 (Verification), p.23",
        CitationFormatter.formatCitation(
            "ISO/IEC/IEEE 12207:2017", "6.4.2", List.of(23), "Verification"));
  }

  @Test
  @DisplayName("Page ranges use min and max regardless of order")
  void pageRange() {
    assertEquals(
        "IEEE 1012-2016, Clause 5.3, pp.45-47",
        CitationFormatter.formatCitation("IEEE 1012-2016", "5.3", List.of(47, 45, 46), null));
  }

  @Test
  @DisplayName("Existing Clause or Section prefixes are kept")
  void prefixes() {
    assertEquals(
        "INCOSE Handbook, Section 4.2",
        CitationFormatter.formatCitation("INCOSE Handbook", "Section 4.2", List.of(), ""));
    assertEquals(
        "Doc, Clause 7", CitationFormatter.formatCitation("Doc", "Clause 7", null, null));
  }

  @Test
  @DisplayName("Missing parts are omitted and section title needs a clause")
  void omissions() {
    assertEquals(
        "MIL-STD-882E", CitationFormatter.formatCitation("MIL-STD-882E", null, null, "Scope"));
    assertEquals(
        "MIL-STD-882E, p.3",
        CitationFormatter.formatCitation("MIL-STD-882E", " ", List.of(3), null));
  }

  @Test
  @DisplayName("Relevance is the score truncated to a whole percentage")
  void relevance() {
    SearchResult result =
        SearchResult.fromMetadata(
            "c1",
            "text",
            0.876,
            Map.of(
                SearchResult.DOCUMENT_TITLE, "ISO 26262:2018",
                SearchResult.CLAUSE_NUMBER, "6.4",
                SearchResult.PAGE_NUMBERS, List.of(12)));

    assertEquals(
        "ISO 26262:2018, Clause 6.4, p.12 (87% relevant)", new CitationFormatter().format(result));
    assertEquals("ISO 26262:2018, Clause 6.4, p.12", new CitationFormatter(false).format(result));
  }
}
