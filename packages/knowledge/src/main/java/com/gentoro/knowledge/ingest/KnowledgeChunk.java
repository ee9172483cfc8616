package com.gentoro.knowledge.ingest;

import com.gentoro.knowledge.chunk.ChunkResult;
import com.gentoro.knowledge.chunk.DocumentMetadata;
import com.gentoro.knowledge.search.LexicalDocument;
import com.gentoro.knowledge.search.SearchResult;
import com.gentoro.knowledge.utility.JacksonUtility;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * A chunk ready for embedding and storage: the chunker output plus identity and enrichment.
 *
 * <p>The wrapped {@link ChunkResult} is kept as produced; enrichment lives beside it.
 *
 * @param normative {@code true}/{@code false}, or {@code null} when the text gives no indication
 */
public record KnowledgeChunk(
    String id,
    ChunkResult chunk,
    String contentHash,
    DocumentMetadata document,
    Boolean normative,
    StandardMetadata standard) {

  public KnowledgeChunk {
    document = document == null ? new DocumentMetadata(null, null, null) : document;
    standard = standard == null ? StandardMetadata.NONE : standard;
  }

  public String content() {
    return chunk.content();
  }

  public String sectionTitle() {
    return chunk.sectionTitle();
  }

  /**
   * Flat payload for vector stores and the lexical index. Keys match those read back by {@link
   * SearchResult#fromMetadata}; absent clause numbers are stored as empty strings and unknown
   * values are left out.
   */
  public Map<String, Object> toMetadata() {
    Map<String, Object> meta = new LinkedHashMap<>(chunk.metadata());
    meta.put(SearchResult.DOCUMENT_ID, document.documentId());
    meta.put(SearchResult.DOCUMENT_TITLE, document.documentTitle());
    meta.put(SearchResult.DOCUMENT_TYPE, document.documentType());
    meta.put(SearchResult.SECTION_TITLE, chunk.sectionTitle());
    meta.put(SearchResult.SECTION_HIERARCHY, chunk.sectionHierarchy());
    meta.put(SearchResult.CLAUSE_NUMBER, chunk.clause().orElse(""));
    meta.put(SearchResult.PAGE_NUMBERS, chunk.pageNumbers());
    meta.put(SearchResult.CHUNK_TYPE, chunk.chunkType().name().toLowerCase(Locale.ROOT));
    if (normative != null) meta.put(SearchResult.NORMATIVE, normative);
    meta.put("token_count", chunk.tokenCount());
    meta.put("has_overlap", chunk.hasOverlap());
    meta.put("content_hash", contentHash);
    putIfPresent(meta, "standard", standard.standard());
    putIfPresent(meta, "domain", standard.domain());
    putIfPresent(meta, "version", standard.version());
    putIfPresent(meta, "standard_family", standard.standardFamily());
    return meta;
  }

  public LexicalDocument toLexicalDocument() {
    return new LexicalDocument(id, chunk.content(), toMetadata());
  }

  public String toJson() {
    Map<String, Object> json = new LinkedHashMap<>();
    json.put("id", id);
    json.put("content", chunk.content());
    json.putAll(toMetadata());
    json.put(SearchResult.NORMATIVE, normative);
    json.put(SearchResult.CLAUSE_NUMBER, chunk.clauseNumber());
    return JacksonUtility.toJson(json);
  }

  private static void putIfPresent(Map<String, Object> meta, String key, String value) {
    if (value != null) meta.put(key, value);
  }
}
