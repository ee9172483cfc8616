package com.gentoro.knowledge.search;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.exception.ValidationException;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReciprocalRankFusionTest {

  private static SearchResult hit(String id, double score) {
    return SearchResult.of(id, "content " + id, score);
  }

  private static List<String> ids(List<SearchResult> results) {
    return results.stream().map(SearchResult::id).collect(Collectors.toList());
  }

  @Test
  @DisplayName("A document ranked first in two lists scores 2/61")
  void firstTwice() {
    List<SearchResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(List.of(hit("a", 0.9)), List.of(hit("a", 12.5))),
            ReciprocalRankFusion.DEFAULT_K);

    assertEquals(1, fused.size());
    assertEquals(2.0 / 61.0, fused.get(0).score(), 1e-12);
  }

  @Test
  @DisplayName("Ranks are 1-based and a missing document contributes nothing")
  void ranks() {
    List<SearchResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(List.of(hit("a", 1), hit("b", 1), hit("c", 1)), List.of(hit("c", 1))), 60);

    assertEquals(List.of("c", "a", "b"), ids(fused));
    assertEquals(1.0 / 63 + 1.0 / 61, fused.get(0).score(), 1e-12);
    assertEquals(1.0 / 62, fused.get(2).score(), 1e-12);
  }

  @Test
  @DisplayName("Ties keep first-seen order across lists")
  void ties() {
    assertEquals(
        List.of("a", "b"),
        ids(ReciprocalRankFusion.fuse(List.of(List.of(hit("a", 1)), List.of(hit("b", 1))), 60)));
    assertEquals(
        List.of("a", "b"),
        ids(
            ReciprocalRankFusion.fuse(
                List.of(List.of(hit("a", 1), hit("b", 1)), List.of(hit("b", 1), hit("a", 1))),
                60)));
  }

  @Test
  @DisplayName("Fusing the same input twice gives the same output")
  void deterministic() {
    List<List<SearchResult>> input =
        List.of(
            List.of(hit("a", 0.9), hit("b", 0.8), hit("c", 0.7)),
            List.of(hit("d", 5), hit("b", 4), hit("a", 3)));
    assertEquals(ReciprocalRankFusion.fuse(input, 60), ReciprocalRankFusion.fuse(input, 60));
  }

  @Test
  @DisplayName("Metadata comes from the last list containing the document")
  void lastWriterWins() {
    SearchResult semantic =
        SearchResult.fromMetadata("a", "x", 0.9, Map.of(SearchResult.DOCUMENT_TITLE, "first"));
    SearchResult lexical =
        SearchResult.fromMetadata("a", "x", 7.1, Map.of(SearchResult.DOCUMENT_TITLE, "second"));

    SearchResult fused =
        ReciprocalRankFusion.fuse(List.of(List.of(semantic), List.of(lexical)), 60).get(0);
    assertEquals("second", fused.documentTitle());
    assertEquals(0.9, semantic.score(), "inputs are not modified");
  }

  @Test
  @DisplayName("Empty input fuses to nothing; negative k is rejected")
  void edges() {
    assertTrue(ReciprocalRankFusion.fuse(List.of(), 60).isEmpty());
    assertTrue(ReciprocalRankFusion.fuse(Arrays.asList(null, List.of()), 60).isEmpty());
    assertThrows(ValidationException.class, () -> ReciprocalRankFusion.fuse(List.of(), -1));
  }
}
