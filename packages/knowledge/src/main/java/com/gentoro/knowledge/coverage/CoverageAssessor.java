package com.gentoro.knowledge.coverage;

import com.gentoro.knowledge.exception.CollaboratorException;
import com.gentoro.knowledge.exception.ErrorDetails;
import com.gentoro.knowledge.exception.ExceptionUtil;
import com.gentoro.knowledge.exception.ValidationException;
import com.gentoro.knowledge.search.SearchResult;
import com.gentoro.knowledge.search.SemanticSearcher;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Probes the corpus with one semantic query per knowledge area and reports where content is
 * missing or weak.
 *
 * <p>An area is a gap when its best hit scores below {@code similarityThreshold}. Gap confidence
 * combines how far below the threshold the best hit is, the normalised Shannon entropy of the hit
 * scores (flat score distributions mean no clear answer), and how few hits came back:
 *
 * <pre>
 * confidence = min(1, 0.5 * sim + w * entropy + (0.5 - w) * count)
 * </pre>
 *
 * Areas are assessed concurrently on the shared worker pool, at most {@code maxConcurrency} at a
 * time. A failing query turns into a MEDIUM gap for that area only.
 */
public class CoverageAssessor {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(CoverageAssessor.class);

  static final String NO_CONTENT = "No content found";

  private final SemanticSearcher searcher;
  private final CoverageConfig config;
  private final ExecutorService executor;

  public CoverageAssessor(SemanticSearcher searcher, ExecutorService executor) {
    this(searcher, CoverageConfig.defaults(), executor);
  }

  public CoverageAssessor(
      SemanticSearcher searcher, CoverageConfig config, ExecutorService executor) {
    if (searcher == null || executor == null) {
      throw new ValidationException("searcher and executor are required");
    }
    this.searcher = searcher;
    this.config = config == null ? CoverageConfig.defaults() : config;
    this.executor = executor;
  }

  public CoverageReport assess(List<String> areas) {
    if (areas == null) {
      throw new ValidationException("areas must not be null");
    }
    if (areas.isEmpty()) {
      return CoverageReport.empty();
    }
    for (String area : areas) {
      if (area == null) throw new ValidationException("areas must not contain null");
    }

    List<AreaOutcome> outcomes = dispatch(areas);
    List<CoverageGap> gaps = new ArrayList<>();
    List<CoveredArea> covered = new ArrayList<>();
    for (AreaOutcome outcome : outcomes) {
      if (outcome.gap() != null) gaps.add(outcome.gap());
      if (outcome.covered() != null) covered.add(outcome.covered());
    }

    int total = areas.size();
    long highGaps = gaps.stream().filter(g -> g.priority() == CoveragePriority.HIGH).count();
    CoveragePriority overall;
    if (highGaps > total * 0.5) {
      overall = CoveragePriority.HIGH;
    } else if (gaps.size() > covered.size()) {
      overall = CoveragePriority.MEDIUM;
    } else if (!gaps.isEmpty()) {
      overall = CoveragePriority.LOW;
    } else {
      overall = CoveragePriority.SUFFICIENT;
    }
    log.info(
        "Coverage assessed for {} areas: {} covered, {} gaps, overall {}",
        total,
        covered.size(),
        gaps.size(),
        overall);
    return new CoverageReport(gaps, covered, total, (double) covered.size() / total, overall);
  }

  private List<AreaOutcome> dispatch(List<String> areas) {
    Semaphore permits = new Semaphore(config.maxConcurrency());
    List<Future<AreaOutcome>> futures = new ArrayList<>(areas.size());
    try {
      for (String area : areas) {
        permits.acquire();
        try {
          futures.add(
              executor.submit(
                  () -> {
                    try {
                      return assessArea(area);
                    } finally {
                      permits.release();
                    }
                  }));
        } catch (RejectedExecutionException e) {
          permits.release();
          throw new CollaboratorException(
              "worker-pool", "Worker pool rejected coverage assessment", e);
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      futures.forEach(f -> f.cancel(true));
      throw new CollaboratorException("worker-pool", "Interrupted dispatching coverage queries", e);
    }

    List<AreaOutcome> outcomes = new ArrayList<>(areas.size());
    for (int i = 0; i < futures.size(); i++) {
      try {
        outcomes.add(futures.get(i).get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        throw new CollaboratorException("worker-pool", "Interrupted waiting for coverage", e);
      } catch (ExecutionException e) {
        outcomes.add(failed(areas.get(i), ExceptionUtil.unwrap(e)));
      }
    }
    return outcomes;
  }

  /** Assess one area; never throws for collaborator failures. */
  AreaOutcome assessArea(String area) {
    List<SearchResult> results;
    try {
      results = searcher.search(area, config.nResults(), Map.of());
    } catch (RuntimeException e) {
      return failed(area, e);
    }
    if (results == null || results.isEmpty()) {
      return AreaOutcome.ofGap(
          new CoverageGap(
              area,
              CoveragePriority.HIGH,
              1.0,
              NO_CONTENT,
              0.0,
              0,
              "'%s' documentation OR tutorial OR guide".formatted(area)));
    }

    double[] scores = results.stream().mapToDouble(SearchResult::score).toArray();
    double maxSim = Double.NEGATIVE_INFINITY;
    double sum = 0.0;
    for (double s : scores) {
      maxSim = Math.max(maxSim, s);
      sum += s;
    }
    double avgSim = sum / scores.length;

    if (maxSim < config.similarityThreshold()) {
      double confidence = gapConfidence(maxSim, entropy(scores), scores.length);
      CoverageGap gap =
          new CoverageGap(
              area,
              priority(maxSim, confidence),
              confidence,
              String.format(Locale.ROOT, "Low relevance scores (max: %.2f)", maxSim),
              maxSim,
              scores.length,
              "'%s' best practices OR standards".formatted(area));
      log.debug("Area '{}' is a gap: max={} confidence={}", area, maxSim, confidence);
      return AreaOutcome.ofGap(gap);
    }
    return AreaOutcome.ofCovered(
        new CoveredArea(area, scores.length, avgSim, results.get(0).documentTitle()));
  }

  /**
   * Shannon entropy of the scores normalised to [0, 1]; 0 below two hits, 1 when none is
   * positive.
   */
  static double entropy(double[] scores) {
    if (scores.length < 2) return 0.0;
    // negative similarities carry no probability mass
    double[] mass = new double[scores.length];
    double total = 0.0;
    for (int i = 0; i < scores.length; i++) {
      mass[i] = Math.max(0.0, scores[i]);
      total += mass[i];
    }
    if (total == 0.0) return 1.0;
    double h = 0.0;
    for (double s : mass) {
      double p = s / total;
      if (p > 0) h -= p * (Math.log(p) / Math.log(2));
    }
    double maxEntropy = Math.log(scores.length) / Math.log(2);
    return maxEntropy > 0 ? h / maxEntropy : 0.0;
  }

  double gapConfidence(double maxSim, double entropy, int resultCount) {
    double sim = clamp(1.0 - maxSim / config.similarityThreshold());
    double count = clamp(1.0 - (double) resultCount / config.nResults());
    double w = config.entropyWeight();
    return clamp(0.5 * sim + w * entropy + (0.5 - w) * count);
  }

  private CoveragePriority priority(double maxSim, double confidence) {
    if (maxSim < config.highConfidenceThreshold() || confidence > 0.7) {
      return CoveragePriority.HIGH;
    }
    return confidence > 0.4 ? CoveragePriority.MEDIUM : CoveragePriority.LOW;
  }

  private static AreaOutcome failed(String area, Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(t);
    log.warn(
        "Coverage query failed for area '{}' ({} {}): {}",
        area,
        details.type,
        details.code,
        ExceptionUtil.describe(t));
    if (log.isDebugEnabled()) {
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(t));
    }
    return AreaOutcome.ofGap(
        new CoverageGap(
            area, CoveragePriority.MEDIUM, 0.5, ExceptionUtil.describe(t), 0.0, 0, null));
  }

  private static double clamp(double v) {
    return Math.max(0.0, Math.min(1.0, v));
  }

  /** Exactly one of {@code gap} and {@code covered} is set. */
  record AreaOutcome(CoverageGap gap, CoveredArea covered) {
    static AreaOutcome ofGap(CoverageGap gap) {
      return new AreaOutcome(gap, null);
    }

    static AreaOutcome ofCovered(CoveredArea covered) {
      return new AreaOutcome(null, covered);
    }
  }
}
