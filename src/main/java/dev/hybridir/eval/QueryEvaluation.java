package dev.hybridir.eval;

import java.util.List;

/**
 * Metrics of one query of a run at every configured cutoff.
 *
 * @param queryId the evaluated query
 * @param retrieved number of documents the run returned for the query
 * @param relevant number of documents judged relevant for the query
 * @param cutoffs metrics per cutoff, in ascending cutoff order
 */
public record QueryEvaluation(
    String queryId, int retrieved, int relevant, List<CutoffMetrics> cutoffs) {

  public QueryEvaluation {
    cutoffs = List.copyOf(cutoffs);
  }

  /**
   * Metrics computed over the top {@code k} documents.
   *
   * @param k the cutoff depth
   * @param metrics the metric values at that depth
   */
  public record CutoffMetrics(int k, RetrievalMetrics.MetricsResult metrics) {}
}
