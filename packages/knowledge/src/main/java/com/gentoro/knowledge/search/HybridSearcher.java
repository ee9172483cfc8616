package com.gentoro.knowledge.search;

import com.gentoro.knowledge.exception.CollaboratorException;
import com.gentoro.knowledge.exception.ExceptionUtil;
import com.gentoro.knowledge.exception.ValidationException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Combines semantic and BM25 retrieval with Reciprocal Rank Fusion.
 *
 * <p>Both retrievers are asked for {@code candidateMultiplier * nResults} candidates; the semantic
 * call runs on the worker pool while the lexical index is queried on the caller thread. Until the
 * lexical index is built, semantic results are returned as they come.
 */
public class HybridSearcher {
  private static final org.slf4j.Logger log =
      com.gentoro.knowledge.logging.LoggingService.getLogger(HybridSearcher.class);

  public static final int DEFAULT_CANDIDATE_MULTIPLIER = 2;
  static final String SEMANTIC = "semantic-search";

  private final SemanticSearcher semantic;
  private final LexicalIndex lexical;
  private final ExecutorService executor;
  private final int candidateMultiplier;

  public HybridSearcher(SemanticSearcher semantic, LexicalIndex lexical, ExecutorService executor) {
    this(semantic, lexical, executor, DEFAULT_CANDIDATE_MULTIPLIER);
  }

  public HybridSearcher(
      SemanticSearcher semantic,
      LexicalIndex lexical,
      ExecutorService executor,
      int candidateMultiplier) {
    if (semantic == null || lexical == null || executor == null) {
      throw new ValidationException("semantic, lexical and executor are required");
    }
    if (candidateMultiplier < 1) {
      throw new ValidationException(
          "candidateMultiplier must be >= 1, got " + candidateMultiplier);
    }
    this.semantic = semantic;
    this.lexical = lexical;
    this.executor = executor;
    this.candidateMultiplier = candidateMultiplier;
  }

  public List<SearchResult> search(String query, int nResults) {
    return search(query, nResults, Map.of());
  }

  public List<SearchResult> search(String query, int nResults, Map<String, Object> filters) {
    if (nResults < 0) {
      throw new ValidationException("nResults must be >= 0, got " + nResults);
    }
    if (query == null || query.isBlank() || nResults == 0) {
      return List.of();
    }
    Map<String, Object> effectiveFilters = filters == null ? Map.of() : filters;

    if (!lexical.isIndexed()) {
      log.warn("Lexical index not built; serving semantic results only for '{}'", query);
      List<SearchResult> results = callSemantic(query, nResults, effectiveFilters);
      return results.size() > nResults ? results.subList(0, nResults) : results;
    }

    int candidates = (int) Math.min(Integer.MAX_VALUE, (long) nResults * candidateMultiplier);
    Future<List<SearchResult>> semanticFuture;
    try {
      semanticFuture =
          executor.submit(() -> semantic.search(query, candidates, effectiveFilters));
    } catch (RejectedExecutionException e) {
      throw new CollaboratorException(SEMANTIC, "Worker pool rejected semantic search", e);
    }

    List<SearchResult> lexicalResults;
    try {
      lexicalResults = lexical.search(query, candidates, effectiveFilters);
    } catch (RuntimeException e) {
      semanticFuture.cancel(true);
      throw e;
    }
    List<SearchResult> semanticResults = await(semanticFuture);

    List<SearchResult> fused =
        ReciprocalRankFusion.fuse(
            List.of(semanticResults, lexicalResults), ReciprocalRankFusion.DEFAULT_K);
    log.debug(
        "Hybrid search '{}': {} semantic + {} lexical -> {} fused",
        query,
        semanticResults.size(),
        lexicalResults.size(),
        fused.size());
    return fused.size() > nResults ? List.copyOf(fused.subList(0, nResults)) : fused;
  }

  private List<SearchResult> callSemantic(
      String query, int nResults, Map<String, Object> filters) {
    try {
      List<SearchResult> results = semantic.search(query, nResults, filters);
      return results == null ? List.of() : results;
    } catch (RuntimeException e) {
      throw new CollaboratorException(
          SEMANTIC, "Semantic search failed: " + ExceptionUtil.describe(e), e);
    }
  }

  private static List<SearchResult> await(Future<List<SearchResult>> future) {
    try {
      List<SearchResult> results = future.get();
      return results == null ? List.of() : results;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new CollaboratorException(SEMANTIC, "Interrupted waiting for semantic search", e);
    } catch (ExecutionException e) {
      Throwable cause = ExceptionUtil.unwrap(e);
      throw new CollaboratorException(
          SEMANTIC, "Semantic search failed: " + ExceptionUtil.describe(cause), cause);
    }
  }
}
