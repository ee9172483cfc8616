package com.gentoro.knowledge.coverage;

/** A knowledge area with at least one sufficiently similar chunk. */
public record CoveredArea(
    String area, int chunkCount, double avgSimilarity, String bestMatchTitle) {}
