package dev.hybridir.eval;

import dev.hybridir.run.FusionResult;
import dev.hybridir.run.RankedDocument;
import dev.hybridir.run.Run;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.ToDoubleFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores runs against relevance judgments at the configured cutoffs.
 *
 * <p>Only queries present in both the run and the qrels are averaged. Judged queries the run
 * returned nothing for, and run queries without judgments, are listed in the summary and logged.
 */
@Service
public class RunEvaluator {

  private static final Logger log = LoggerFactory.getLogger(RunEvaluator.class);

  private final List<Integer> cutoffs;

  public RunEvaluator(EvaluationProperties properties) {
    this.cutoffs = List.copyOf(new TreeSet<>(properties.getCutoffs()));
  }

  public List<Integer> cutoffs() {
    return cutoffs;
  }

  /** Evaluates a fused run. */
  public RunEvaluation evaluate(String runId, List<FusionResult> results, Qrels qrels) {
    Map<String, List<String>> rankings = new LinkedHashMap<>();
    for (FusionResult result : results) {
      rankings.put(result.queryId(), result.docIds());
    }
    return evaluate(runId, rankings, qrels);
  }

  /** Evaluates an input run, named after its system. */
  public RunEvaluation evaluate(Run run, Qrels qrels) {
    Map<String, List<String>> rankings = new LinkedHashMap<>();
    for (String queryId : run.queryIds()) {
      rankings.put(
          queryId,
          run.list(queryId).orElseThrow().documents().stream()
              .map(RankedDocument::docId)
              .toList());
    }
    return evaluate(run.system(), rankings, qrels);
  }

  /**
   * Evaluates rankings given as document ids in rank order, by query.
   *
   * @param runId name of the evaluated run
   * @param rankings ranked document ids per query
   * @param qrels the relevance judgments
   */
  public RunEvaluation evaluate(String runId, Map<String, List<String>> rankings, Qrels qrels) {
    SortedMap<String, List<String>> ordered = new TreeMap<>(rankings);
    List<QueryEvaluation> queries = new ArrayList<>();
    List<String> unjudged = new ArrayList<>();

    for (Map.Entry<String, List<String>> entry : ordered.entrySet()) {
      String queryId = entry.getKey();
      if (!qrels.isJudged(queryId)) {
        unjudged.add(queryId);
        continue;
      }
      queries.add(evaluateQuery(queryId, entry.getValue(), qrels));
    }

    List<String> unretrieved =
        qrels.queryIds().stream().filter(q -> !ordered.containsKey(q)).toList();
    if (!unretrieved.isEmpty()) {
      log.warn(
          "Run {} has no results for {} judged queries: {}",
          runId,
          unretrieved.size(),
          unretrieved);
    }
    if (!unjudged.isEmpty()) {
      log.warn("Run {} has {} queries without judgments: {}", runId, unjudged.size(), unjudged);
    }

    EvaluationSummary summary =
        new EvaluationSummary(runId, queries.size(), means(queries), unretrieved, unjudged);
    log.info("Evaluated run {} on {} queries", runId, queries.size());
    return new RunEvaluation(summary, queries);
  }

  private QueryEvaluation evaluateQuery(String queryId, List<String> ranking, Qrels qrels) {
    List<RelevanceJudgment> judgments = qrels.judgments(queryId);
    List<QueryEvaluation.CutoffMetrics> byCutoff = new ArrayList<>(cutoffs.size());
    for (int k : cutoffs) {
      byCutoff.add(
          new QueryEvaluation.CutoffMetrics(k, RetrievalMetrics.computeAll(ranking, judgments, k)));
    }
    log.debug("Evaluated query {} ({} retrieved)", queryId, ranking.size());
    return new QueryEvaluation(queryId, ranking.size(), qrels.relevantCount(queryId), byCutoff);
  }

  private List<QueryEvaluation.CutoffMetrics> means(List<QueryEvaluation> queries) {
    List<QueryEvaluation.CutoffMetrics> means = new ArrayList<>(cutoffs.size());
    for (int i = 0; i < cutoffs.size(); i++) {
      int index = i;
      List<RetrievalMetrics.MetricsResult> atCutoff =
          queries.stream().map(q -> q.cutoffs().get(index).metrics()).toList();
      means.add(
          new QueryEvaluation.CutoffMetrics(
              cutoffs.get(i),
              new RetrievalMetrics.MetricsResult(
                  avg(atCutoff, RetrievalMetrics.MetricsResult::recallAtK),
                  avg(atCutoff, RetrievalMetrics.MetricsResult::precisionAtK),
                  avg(atCutoff, RetrievalMetrics.MetricsResult::mrr),
                  avg(atCutoff, RetrievalMetrics.MetricsResult::ndcgAtK),
                  avg(atCutoff, RetrievalMetrics.MetricsResult::averagePrecision),
                  avg(atCutoff, RetrievalMetrics.MetricsResult::hitRate))));
    }
    return means;
  }

  private static double avg(
      List<RetrievalMetrics.MetricsResult> results,
      ToDoubleFunction<RetrievalMetrics.MetricsResult> fn) {
    return results.stream().mapToDouble(fn).average().orElse(0.0);
  }
}
