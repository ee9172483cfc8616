package com.gentoro.knowledge.coverage;

import com.gentoro.knowledge.exception.ConfigException;
import com.gentoro.knowledge.exception.ValidationException;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;

/**
 * Thresholds for {@link CoverageAssessor}.
 *
 * @param similarityThreshold best-hit score below which an area is a gap
 * @param highConfidenceThreshold best-hit score below which a gap is always HIGH priority
 * @param nResults hits requested per area
 * @param entropyWeight share of gap confidence taken by score entropy, in [0, 0.5]
 * @param maxConcurrency areas assessed at the same time
 */
public record CoverageConfig(
    double similarityThreshold,
    double highConfidenceThreshold,
    int nResults,
    double entropyWeight,
    int maxConcurrency) {

  public CoverageConfig {
    if (!(similarityThreshold > 0.0)) {
      throw new ValidationException("similarityThreshold must be > 0");
    }
    if (highConfidenceThreshold < 0.0) {
      throw new ValidationException("highConfidenceThreshold must be >= 0");
    }
    if (nResults < 1) {
      throw new ValidationException("nResults must be >= 1");
    }
    if (entropyWeight < 0.0 || entropyWeight > 0.5) {
      throw new ValidationException("entropyWeight must be within [0, 0.5]");
    }
    if (maxConcurrency < 1) {
      throw new ValidationException("maxConcurrency must be >= 1");
    }
  }

  public static CoverageConfig defaults() {
    return new CoverageConfig(0.5, 0.3, 10, 0.3, 4);
  }

  public static CoverageConfig fromConfiguration(Configuration cfg) {
    CoverageConfig d = defaults();
    if (cfg == null) return d;
    try {
      return new CoverageConfig(
          cfg.getDouble("coverage.similarity-threshold", d.similarityThreshold()),
          cfg.getDouble("coverage.high-confidence-threshold", d.highConfidenceThreshold()),
          cfg.getInt("coverage.n-results", d.nResults()),
          cfg.getDouble("coverage.entropy-weight", d.entropyWeight()),
          cfg.getInt("coverage.max-concurrency", d.maxConcurrency()));
    } catch (ConversionException | ValidationException e) {
      throw new ConfigException("Invalid coverage configuration: " + e.getMessage(), e);
    }
  }
}
