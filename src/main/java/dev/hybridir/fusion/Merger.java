package dev.hybridir.fusion;

import dev.hybridir.run.FusedDocument;
import dev.hybridir.run.FusionResult;
import dev.hybridir.run.RankedList;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Fuses the ranked lists of a single query into a final, truncated ranking.
 *
 * <p>Steps:
 *
 * <ol>
 *   <li>Build the candidate set as the union of document ids over all lists
 *   <li>Score every candidate with the configured {@link FusionStrategy}
 *   <li>Sort by combined score descending; equal scores are ordered by document id ascending
 *   <li>Assign ranks {@code 1..N} in sorted order
 *   <li>Keep the first {@code topK}
 * </ol>
 *
 * <p>Truncation happens only after the full sort. The result does not depend on the order of the
 * input lists' documents or on which system introduced a document first.
 *
 * <p>Merger holds no mutable state and can be shared by concurrent workers.
 */
public final class Merger {

  /** Combined score descending, then document id ascending. */
  static final Comparator<Map.Entry<String, Double>> FUSED_ORDER =
      Comparator.<Map.Entry<String, Double>>comparingDouble(Map.Entry::getValue)
          .reversed()
          .thenComparing(Map.Entry::getKey);

  private final FusionConfig config;
  private final FusionStrategy strategy;

  public Merger(FusionConfig config) {
    this.config = config;
    this.strategy = config.strategy();
  }

  public FusionConfig config() {
    return config;
  }

  /**
   * Fuses one query.
   *
   * @param queryId the query
   * @param lists one list per system, in run order; a system without results for the query passes
   *     an empty list
   * @return the fused ranking, at most {@code topK} long
   */
  public FusionResult merge(String queryId, List<RankedList> lists) {
    return merge(CandidatePool.of(queryId, lists));
  }

  public FusionResult merge(CandidatePool pool) {
    Map<String, Double> scores = strategy.fuse(pool);

    List<Map.Entry<String, Double>> sorted = new ArrayList<>(scores.entrySet());
    sorted.sort(FUSED_ORDER);

    int limit = Math.min(config.topK(), sorted.size());
    List<FusedDocument> documents = new ArrayList<>(limit);
    for (int i = 0; i < limit; i++) {
      Map.Entry<String, Double> entry = sorted.get(i);
      documents.add(new FusedDocument(entry.getKey(), entry.getValue(), i + 1));
    }
    return new FusionResult(pool.queryId(), documents);
  }
}
