package com.gentoro.knowledge.chunk;

import java.util.List;

/** Turns parsed document elements into retrieval-sized chunks. */
public interface Chunker {

  ChunkingReport chunkWithReport(List<ParsedElement> elements, DocumentMetadata document);

  default List<ChunkResult> chunk(List<ParsedElement> elements, DocumentMetadata document) {
    return chunkWithReport(elements, document).chunks();
  }
}
