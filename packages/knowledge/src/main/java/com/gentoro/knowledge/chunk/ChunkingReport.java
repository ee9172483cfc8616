package com.gentoro.knowledge.chunk;

import java.util.List;

/** Chunks plus the number of input elements that were skipped as unrecognised. */
public record ChunkingReport(List<ChunkResult> chunks, int skippedElements) {
  public ChunkingReport {
    chunks = chunks == null ? List.of() : List.copyOf(chunks);
  }
}
