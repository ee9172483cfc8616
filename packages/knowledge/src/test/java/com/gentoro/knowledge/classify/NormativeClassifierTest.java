package com.gentoro.knowledge.classify;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class NormativeClassifierTest {

  private final NormativeClassifier classifier = new NormativeClassifier();

  @Test
  @DisplayName("Section markers override keywords")
  void markersWin() {
    assertEquals(
        NormativeIndicator.INFORMATIVE,
        classifier.classify("Annex (informative): The system SHALL do X"));
    assertEquals(
        NormativeIndicator.NORMATIVE,
        classifier.classify("NOTE: examples follow", "Annex A (Normative) > A.1"));
    assertEquals(
        NormativeIndicator.INFORMATIVE,
        classifier.classify("The supplier must comply.", "Annex B (informative)"));
  }

  @Test
  @DisplayName("Requirement keywords are checked before guidance keywords")
  void normativeBeforeInformative() {
    assertEquals(
        NormativeIndicator.NORMATIVE,
        classifier.classify("NOTE The organization shall retain records."));
    assertEquals(NormativeIndicator.NORMATIVE, classifier.classify("Testing is RECOMMENDED."));
    assertEquals(NormativeIndicator.INFORMATIVE, classifier.classify("The team may skip this."));
    assertEquals(NormativeIndicator.INFORMATIVE, classifier.classify("EXAMPLE 2 A fault tree."));
  }

  @Test
  @DisplayName("Keywords only match whole words")
  void wholeWords() {
    assertEquals(NormativeIndicator.UNKNOWN, classifier.classify("Marshall the mustard"));
    assertEquals(NormativeIndicator.UNKNOWN, classifier.classify("Maybe a cannery"));
  }

  @Test
  @DisplayName("Blank or unmarked text is unknown")
  void unknown() {
    assertEquals(NormativeIndicator.UNKNOWN, classifier.classify(null));
    assertEquals(NormativeIndicator.UNKNOWN, classifier.classify("   "));
    assertEquals(NormativeIndicator.UNKNOWN, classifier.classify("Scope of this document"));
  }

  @Test
  @DisplayName("Indicators map to tri-state flags")
  void flags() {
    assertEquals(Boolean.TRUE, NormativeIndicator.NORMATIVE.toNormativeFlag());
    assertEquals(Boolean.FALSE, NormativeIndicator.INFORMATIVE.toNormativeFlag());
    assertNull(NormativeIndicator.UNKNOWN.toNormativeFlag());
  }
}
