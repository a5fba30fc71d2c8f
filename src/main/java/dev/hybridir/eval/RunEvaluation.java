package dev.hybridir.eval;

import java.util.List;

/**
 * Evaluation of one run: the summary plus the per-query breakdown it was averaged from.
 *
 * @param summary mean metrics and coverage
 * @param queries per-query metrics in query order
 */
public record RunEvaluation(EvaluationSummary summary, List<QueryEvaluation> queries) {

  public RunEvaluation {
    queries = List.copyOf(queries);
  }
}
