package dev.hybridir.eval;

import java.util.List;

/**
 * Mean metrics of a run over the evaluated queries.
 *
 * @param runId the evaluated run
 * @param evaluatedQueries number of queries that are both in the run and in the qrels
 * @param means mean metrics per cutoff, in ascending cutoff order
 * @param unretrievedQueries judged queries the run has no results for; not part of the means
 * @param unjudgedQueries queries of the run without judgments; not part of the means
 */
public record EvaluationSummary(
    String runId,
    int evaluatedQueries,
    List<QueryEvaluation.CutoffMetrics> means,
    List<String> unretrievedQueries,
    List<String> unjudgedQueries) {

  public EvaluationSummary {
    means = List.copyOf(means);
    unretrievedQueries = List.copyOf(unretrievedQueries);
    unjudgedQueries = List.copyOf(unjudgedQueries);
  }
}
