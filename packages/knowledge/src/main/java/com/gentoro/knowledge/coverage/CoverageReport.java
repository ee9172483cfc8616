package com.gentoro.knowledge.coverage;

import com.gentoro.knowledge.utility.JacksonUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Result of assessing a set of knowledge areas. Gaps and covered areas keep input order. */
public record CoverageReport(
    List<CoverageGap> gaps,
    List<CoveredArea> covered,
    int totalAreas,
    double coverageRatio,
    CoveragePriority overallPriority) {

  public CoverageReport {
    gaps = gaps == null ? List.of() : List.copyOf(gaps);
    covered = covered == null ? List.of() : List.copyOf(covered);
  }

  public static CoverageReport empty() {
    return new CoverageReport(List.of(), List.of(), 0, 0.0, CoveragePriority.SUFFICIENT);
  }

  /** Report as nested maps with snake_case keys and ratios rounded to 3 decimals. */
  public Map<String, Object> toMap() {
    List<Map<String, Object>> gapList = new ArrayList<>();
    for (CoverageGap g : gaps) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("area", g.area());
      m.put("priority", g.priority().value());
      m.put("confidence", round3(g.confidence()));
      m.put("reason", g.reason());
      m.put("max_similarity", round3(g.maxSimilarity()));
      m.put("result_count", g.resultCount());
      m.put("suggested_query", g.suggestedQuery());
      gapList.add(m);
    }
    List<Map<String, Object>> coveredList = new ArrayList<>();
    for (CoveredArea c : covered) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("area", c.area());
      m.put("chunk_count", c.chunkCount());
      m.put("avg_similarity", round3(c.avgSimilarity()));
      m.put("best_match_title", c.bestMatchTitle());
      coveredList.add(m);
    }
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("total_areas", totalAreas);
    summary.put("coverage_ratio", round3(coverageRatio));
    summary.put("gaps_count", gaps.size());
    summary.put("covered_count", covered.size());
    summary.put("overall_priority", overallPriority.value());

    Map<String, Object> out = new LinkedHashMap<>();
    out.put("gaps", gapList);
    out.put("covered", coveredList);
    out.put("summary", summary);
    return out;
  }

  public String toJson() {
    return JacksonUtility.toJson(toMap());
  }

  static double round3(double value) {
    return Math.round(value * 1000.0) / 1000.0;
  }
}
