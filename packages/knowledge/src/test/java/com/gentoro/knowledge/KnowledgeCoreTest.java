package com.gentoro.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.knowledge.chunk.DocumentMetadata;
import com.gentoro.knowledge.chunk.ParsedElement;
import com.gentoro.knowledge.coverage.CoveragePriority;
import com.gentoro.knowledge.coverage.CoverageReport;
import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.ingest.KnowledgeChunk;
import com.gentoro.knowledge.search.SearchResult;
import com.gentoro.knowledge.search.SemanticSearcher;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KnowledgeCoreTest {

  private static final DocumentMetadata DOC =
      new DocumentMetadata("iso-9001-2015", "ISO 9001:2015", "standard");

  private KnowledgeCore core;

  @BeforeEach
  void setUp() {
    // a fixed semantic ranking: one strong hit on document control, nothing else
    SemanticSearcher semantic =
        (query, n, filters) ->
            query.contains("documented")
                ? List.of(
                    SearchResult.fromMetadata(
                        "sem-1",
                        "Documented information shall be controlled.",
                        0.91,
                        Map.of(SearchResult.DOCUMENT_TITLE, "ISO 9001:2015")))
                : List.of();
    core = new KnowledgeCore(new ConfigurationProvider("classpath:test-config.yaml"), semantic);
  }

  @AfterEach
  void tearDown() {
    core.close();
  }

  @Test
  @DisplayName("Configuration from YAML reaches the chunker")
  void configured() {
    assertEquals(60, core.chunker().config().chunkSizeMax());
    assertEquals(10, core.chunker().config().chunkOverlap());
    assertFalse(core.lexicalIndex().isIndexed());
  }

  @Test
  @DisplayName("Ingestion builds the lexical index used by hybrid search")
  void ingestThenSearch() {
    List<KnowledgeChunk> chunks =
        core.ingest(
            List.of(
                ParsedElement.heading("7.5 Documented information", 2),
                ParsedElement.paragraph("The organization shall retain documented information.")
                    .withPages(12),
                ParsedElement.heading("8 Operation", 1),
                ParsedElement.paragraph("Operational planning and control.")),
            DOC);

    assertEquals(2, chunks.size());
    assertTrue(core.lexicalIndex().isIndexed());
    assertEquals(2, core.lexicalIndex().documentCount());

    List<SearchResult> results = core.search("documented information", 2);
    assertEquals(2, results.size());
    assertEquals(chunks.get(0).id(), results.get(1).id());
    assertEquals("sem-1", results.get(0).id());

    // fused scores are small: 1 / 61 truncates to 1%
    assertEquals(
        "ISO 9001:2015, Clause 7.5 (7.5 Documented information), p.12 (1% relevant)",
        core.cite(results.get(1)));
  }

  @Test
  @DisplayName("Coverage uses the configured threshold and result count")
  void coverage() {
    CoverageReport report = core.assessCoverage(List.of("documented information", "calibration"));

    assertEquals(1, report.covered().size());
    assertEquals("calibration", report.gaps().get(0).area());
    assertEquals(CoveragePriority.LOW, report.overallPriority());
  }

  @Test
  @DisplayName("Invalid pool sizes are configuration errors")
  void invalidPool() {
    BaseConfiguration cfg = new BaseConfiguration();
    cfg.addProperty("workers.pool-size", 0);
    SemanticSearcher none = (q, n, f) -> List.of();

    assertThrows(ConfigException.class, () -> new KnowledgeCore(cfg, none));
  }
}
