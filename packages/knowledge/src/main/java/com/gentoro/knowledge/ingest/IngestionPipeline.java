package com.gentoro.knowledge.ingest;

import com.gentoro.knowledge.chunk.ChunkResult;
import com.gentoro.knowledge.chunk.Chunker;
import com.gentoro.knowledge.chunk.ChunkingReport;
import com.gentoro.knowledge.chunk.DocumentMetadata;
import com.gentoro.knowledge.chunk.ParsedElement;
import com.gentoro.knowledge.classify.NormativeClassifier;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.search.LexicalDocument;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Chunks a parsed document and enriches every chunk with an id, a content hash, its normative
 * status and what the document id says about the standard.
 */
public class IngestionPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(IngestionPipeline.class);

  private final Chunker chunker;
  private final NormativeClassifier classifier;
  private final StandardMetadataExtractor extractor;
  private final Supplier<String> ids;

  public IngestionPipeline(
      Chunker chunker, NormativeClassifier classifier, StandardMetadataExtractor extractor) {
    this(chunker, classifier, extractor, () -> UUID.randomUUID().toString());
  }

  IngestionPipeline(
      Chunker chunker,
      NormativeClassifier classifier,
      StandardMetadataExtractor extractor,
      Supplier<String> ids) {
    if (chunker == null || classifier == null || extractor == null || ids == null) {
      throw new ValidationException("chunker, classifier and extractor are required");
    }
    this.chunker = chunker;
    this.classifier = classifier;
    this.extractor = extractor;
    this.ids = ids;
  }

  public List<KnowledgeChunk> process(List<ParsedElement> elements, DocumentMetadata document) {
    DocumentMetadata doc = document == null ? new DocumentMetadata(null, null, null) : document;
    ChunkingReport report = chunker.chunkWithReport(elements, doc);
    StandardMetadata standard = extractor.extract(doc.documentId());

    List<KnowledgeChunk> out = new ArrayList<>(report.chunks().size());
    int normative = 0;
    int informative = 0;
    for (ChunkResult chunk : report.chunks()) {
      Boolean flag =
          classifier
              .classify(chunk.content(), String.join(" > ", chunk.sectionHierarchy()))
              .toNormativeFlag();
      if (Boolean.TRUE.equals(flag)) normative++;
      if (Boolean.FALSE.equals(flag)) informative++;
      out.add(
          new KnowledgeChunk(
              ids.get(), chunk, ContentHasher.sha256(chunk.content()), doc, flag, standard));
    }
    log.info(
        "Ingested document '{}': {} chunks ({} normative, {} informative), {} elements skipped",
        doc.documentId(),
        out.size(),
        normative,
        informative,
        report.skippedElements());
    return out;
  }

  /** Corpus for {@link com.gentoro.knowledge.search.LexicalIndex#buildIndex}. */
  public static List<LexicalDocument> toLexicalDocuments(List<KnowledgeChunk> chunks) {
    List<LexicalDocument> docs = new ArrayList<>(chunks == null ? 0 : chunks.size());
    if (chunks == null) return docs;
    for (KnowledgeChunk chunk : chunks) docs.add(chunk.toLexicalDocument());
    return docs;
  }
}
