package com.gentoro.knowledge.coverage;

/**
 * A knowledge area the corpus does not answer well.
 *
 * @param confidence how certain the assessment is that this is a real gap, in [0, 1]
 * @param suggestedQuery search to run when acquiring content; null when none applies
 */
public record CoverageGap(
    String area,
    CoveragePriority priority,
    double confidence,
    String reason,
    double maxSimilarity,
    int resultCount,
    String suggestedQuery) {}
