package com.gentoro.knowledge;

import com.gentoro.knowledge.chunk.ChunkConfig;
import com.gentoro.knowledge.chunk.DocumentMetadata;
import com.gentoro.knowledge.chunk.HierarchicalChunker;
import com.gentoro.knowledge.chunk.ParsedElement;
import com.gentoro.knowledge.chunk.TokenCounter;
import com.gentoro.knowledge.classify.NormativeClassifier;
import com.gentoro.knowledge.coverage.CoverageAssessor;
import com.gentoro.knowledge.coverage.CoverageConfig;
import com.gentoro.knowledge.coverage.CoverageReport;
import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.ingest.IngestionPipeline;
import com.gentoro.knowledge.ingest.KnowledgeChunk;
import com.gentoro.knowledge.ingest.StandardMetadataExtractor;
import com.gentoro.knowledge.logging.LoggingService;
import com.gentoro.knowledge.search.Bm25Index;
import com.gentoro.knowledge.search.CitationFormatter;
import com.gentoro.knowledge.search.HybridSearcher;
import com.gentoro.knowledge.search.LexicalIndex;
import com.gentoro.knowledge.search.SearchResult;
import com.gentoro.knowledge.search.SemanticSearcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Wires chunking, enrichment, hybrid search and coverage assessment from one configuration.
 *
 * <p>The semantic searcher is supplied by the embedding/vector-store integration. Every ingested
 * document is added to the lexical corpus and the BM25 index is rebuilt, so hybrid search becomes
 * available after the first ingestion.
 */
public class KnowledgeCore implements AutoCloseable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(KnowledgeCore.class);

  private final Configuration configuration;
  private final WorkerPool workers;
  private final HierarchicalChunker chunker;
  private final IngestionPipeline pipeline;
  private final LexicalIndex lexicalIndex;
  private final HybridSearcher searcher;
  private final CoverageAssessor coverage;
  private final CitationFormatter citations = new CitationFormatter();
  private final List<KnowledgeChunk> corpus = new ArrayList<>();

  public KnowledgeCore(ConfigurationProvider provider, SemanticSearcher semantic) {
    this(provider.config(), semantic);
  }

  public KnowledgeCore(Configuration configuration, SemanticSearcher semantic) {
    if (configuration == null || semantic == null) {
      throw new ValidationException("configuration and semantic searcher are required");
    }
    this.configuration = configuration;
    LoggingService.applyConfiguration(configuration);

    int poolSize = intSetting("workers.pool-size", WorkerPool.defaultSize());
    int multiplier =
        intSetting(
            "search.hybrid.candidate-multiplier", HybridSearcher.DEFAULT_CANDIDATE_MULTIPLIER);
    ChunkConfig chunkConfig = ChunkConfig.fromConfiguration(configuration);
    CoverageConfig coverageConfig = CoverageConfig.fromConfiguration(configuration);
    TokenCounter tokens = TokenCounter.named(configuration.getString("chunking.tokenizer", null));
    if (poolSize < 1 || multiplier < 1) {
      throw new ConfigException(
          "workers.pool-size and search.hybrid.candidate-multiplier must be >= 1");
    }

    this.workers = new WorkerPool(poolSize);
    this.chunker = new HierarchicalChunker(chunkConfig, tokens);
    this.pipeline =
        new IngestionPipeline(chunker, new NormativeClassifier(), new StandardMetadataExtractor());
    this.lexicalIndex = new Bm25Index();
    this.searcher = new HybridSearcher(semantic, lexicalIndex, workers.executor(), multiplier);
    this.coverage = new CoverageAssessor(semantic, coverageConfig, workers.executor());
    log.info(
        "Knowledge core ready: chunk {}..{} tokens (overlap {}), {} workers",
        chunkConfig.chunkSizeMin(),
        chunkConfig.chunkSizeMax(),
        chunkConfig.chunkOverlap(),
        poolSize);
  }

  /** Chunk and enrich a document, then add it to the lexical corpus. */
  public List<KnowledgeChunk> ingest(List<ParsedElement> elements, DocumentMetadata document) {
    List<KnowledgeChunk> chunks = pipeline.process(elements, document);
    synchronized (corpus) {
      corpus.addAll(chunks);
      lexicalIndex.buildIndex(IngestionPipeline.toLexicalDocuments(corpus));
    }
    return chunks;
  }

  public List<SearchResult> search(String query, int nResults) {
    return searcher.search(query, nResults);
  }

  public List<SearchResult> search(String query, int nResults, Map<String, Object> filters) {
    return searcher.search(query, nResults, filters);
  }

  public CoverageReport assessCoverage(List<String> areas) {
    return coverage.assess(areas);
  }

  public String cite(SearchResult result) {
    return citations.format(result);
  }

  public Configuration configuration() {
    return configuration;
  }

  public HierarchicalChunker chunker() {
    return chunker;
  }

  public LexicalIndex lexicalIndex() {
    return lexicalIndex;
  }

  @Override
  public void close() {
    workers.close();
  }

  private int intSetting(String key, int defaultValue) {
    try {
      return configuration.getInt(key, defaultValue);
    } catch (ConversionException e) {
      throw new ConfigException("Invalid value for " + key, e);
    }
  }
}
