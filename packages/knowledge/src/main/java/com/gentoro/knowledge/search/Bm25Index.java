package com.gentoro.knowledge.search;

import com.gentoro.knowledge.exception.IndexNotReadyException;
import com.gentoro.knowledge.exception.ValidationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory Okapi BM25 index over chunk text.
 *
 * <p>Scoring uses {@code k1 = 1.2}, {@code b = 0.75} and the non-negative idf {@code ln(1 + (N -
 * df + 0.5) / (df + 0.5))}. Each build produces an immutable snapshot published through a volatile
 * field, so searches never block and never observe a half-built index.
 */
public class Bm25Index implements LexicalIndex {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(Bm25Index.class);

  static final double K1 = 1.2;
  static final double B = 0.75;

  private volatile Snapshot snapshot;

  @Override
  public void buildIndex(List<LexicalDocument> documents) {
    if (documents == null) {
      throw new ValidationException("documents must not be null");
    }
    long start = System.currentTimeMillis();
    List<LexicalDocument> docs = new ArrayList<>(documents.size());
    Set<String> seen = new HashSet<>();
    for (LexicalDocument doc : documents) {
      if (doc == null || doc.id() == null) {
        throw new ValidationException("Lexical documents require a non-null id");
      }
      if (!seen.add(doc.id())) {
        log.warn("Duplicate document id '{}' ignored; keeping first occurrence", doc.id());
        continue;
      }
      docs.add(doc);
    }

    Map<String, List<Posting>> postings = new HashMap<>();
    int[] lengths = new int[docs.size()];
    long totalLength = 0;
    for (int i = 0; i < docs.size(); i++) {
      List<String> terms = TextAnalyzer.analyze(docs.get(i).content());
      lengths[i] = terms.size();
      totalLength += terms.size();
      Map<String, Integer> tf = new HashMap<>();
      for (String term : terms) tf.merge(term, 1, Integer::sum);
      for (Map.Entry<String, Integer> e : tf.entrySet()) {
        postings
            .computeIfAbsent(e.getKey(), k -> new ArrayList<>())
            .add(new Posting(i, e.getValue()));
      }
    }
    double avgDl = docs.isEmpty() ? 0.0 : (double) totalLength / docs.size();

    this.snapshot =
        new Snapshot(Collections.unmodifiableList(docs), lengths, postings, avgDl);
    log.info(
        "Built BM25 index: {} documents, {} terms in {} ms",
        docs.size(),
        postings.size(),
        System.currentTimeMillis() - start);
  }

  @Override
  public List<SearchResult> search(String query, int nResults, Map<String, Object> filters) {
    Snapshot current = this.snapshot;
    if (current == null) {
      throw new IndexNotReadyException("BM25 index has not been built");
    }
    if (nResults < 0) {
      throw new ValidationException("nResults must be >= 0, got " + nResults);
    }
    List<String> terms = TextAnalyzer.analyzeQuery(query);
    if (nResults == 0 || terms.isEmpty() || current.documents().isEmpty()) {
      return List.of();
    }

    int n = current.documents().size();
    double[] scores = new double[n];
    for (String term : terms) {
      List<Posting> list = current.postings().get(term);
      if (list == null) continue;
      int df = list.size();
      double idf = Math.log(1.0 + (n - df + 0.5) / (df + 0.5));
      for (Posting p : list) {
        double norm = 1.0 - B + B * current.lengths()[p.doc()] / current.avgDl();
        scores[p.doc()] += idf * (p.tf() * (K1 + 1.0)) / (p.tf() + K1 * norm);
      }
    }

    List<Integer> hits = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (scores[i] > 0.0 && matches(current.documents().get(i), filters)) hits.add(i);
    }
    // stable: equal scores keep index order
    hits.sort((a, b) -> Double.compare(scores[b], scores[a]));

    List<SearchResult> out = new ArrayList<>(Math.min(nResults, hits.size()));
    for (int i = 0; i < hits.size() && out.size() < nResults; i++) {
      int doc = hits.get(i);
      LexicalDocument d = current.documents().get(doc);
      out.add(SearchResult.fromMetadata(d.id(), d.content(), scores[doc], d.metadata()));
    }
    log.debug(
        "BM25 query '{}': {} terms, {} matching documents, returning {}",
        query,
        terms.size(),
        hits.size(),
        out.size());
    return out;
  }

  @Override
  public boolean isIndexed() {
    return snapshot != null;
  }

  @Override
  public int documentCount() {
    Snapshot current = this.snapshot;
    return current == null ? 0 : current.documents().size();
  }

  private static boolean matches(LexicalDocument doc, Map<String, Object> filters) {
    if (filters == null || filters.isEmpty()) return true;
    for (Map.Entry<String, Object> f : filters.entrySet()) {
      if (!doc.metadata().containsKey(f.getKey())
          || !Objects.equals(doc.metadata().get(f.getKey()), f.getValue())) {
        return false;
      }
    }
    return true;
  }

  private record Posting(int doc, int tf) {}

  private record Snapshot(
      List<LexicalDocument> documents,
      int[] lengths,
      Map<String, List<Posting>> postings,
      double avgDl) {}
}
