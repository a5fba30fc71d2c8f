package dev.hybridir.eval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Standard IR metrics for one query's ranking.
 *
 * <p>All methods are pure functions over the retrieved document ids (in rank order) and the
 * query's relevance judgments. A document is relevant if its grade is at least 1; unjudged
 * documents count as grade 0. Gains for nDCG are the grades themselves, negative grades clamped to
 * 0.
 *
 * <p>Cutoff semantics follow trec_eval's {@code P_k} and {@code ndcg_cut_k}: a ranking shorter than
 * k is padded with non-relevant documents, so precision divides by k and the ideal DCG is cut at k.
 */
public final class RetrievalMetrics {

  private RetrievalMetrics() {}

  /** All six metrics at one cutoff. */
  public record MetricsResult(
      double recallAtK,
      double precisionAtK,
      double mrr,
      double ndcgAtK,
      double averagePrecision,
      double hitRate) {

    static final MetricsResult ZERO = new MetricsResult(0.0, 0.0, 0.0, 0.0, 0.0, 0.0);
  }

  /** Recall@k: fraction of relevant documents found in the top k. */
  public static double recallAtK(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).recallAtK();
  }

  /** Precision@k: relevant documents in the top k divided by k, even when fewer were returned. */
  public static double precisionAtK(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).precisionAtK();
  }

  /** Reciprocal rank of the first relevant document within the top k. */
  public static double mrr(List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).mrr();
  }

  /** nDCG@k with graded gains and a log2 discount. */
  public static double ndcgAtK(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).ndcgAtK();
  }

  /** Average precision over the top k, divided by the total number of relevant documents. */
  public static double averagePrecision(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).averagePrecision();
  }

  /** 1.0 if any relevant document is in the top k, else 0.0. */
  public static double hitRate(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    return computeAll(retrievedIds, judgments, k).hitRate();
  }

  /** Computes all six metrics in one pass over the top k. */
  public static MetricsResult computeAll(
      List<String> retrievedIds, List<RelevanceJudgment> judgments, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be positive but was " + k);
    }
    Map<String, Integer> gradeMap = toGradeMap(judgments);
    Set<String> relevantIds = relevantIds(gradeMap);
    List<String> topK = retrievedIds.subList(0, Math.min(k, retrievedIds.size()));
    if (topK.isEmpty()) {
      return MetricsResult.ZERO;
    }

    int relevantFound = 0;
    double firstRelevantRr = 0.0;
    double sumPrecision = 0.0;
    double dcg = 0.0;
    for (int i = 0; i < topK.size(); i++) {
      String docId = topK.get(i);
      dcg += gain(gradeMap.getOrDefault(docId, 0)) / log2(i + 2);
      if (relevantIds.contains(docId)) {
        relevantFound++;
        sumPrecision += (double) relevantFound / (i + 1);
        if (firstRelevantRr == 0.0) {
          firstRelevantRr = 1.0 / (i + 1);
        }
      }
    }

    double recall = relevantIds.isEmpty() ? 0.0 : (double) relevantFound / relevantIds.size();
    double precision = (double) relevantFound / k;
    double idcg = computeIdcg(gradeMap, k);
    double ndcg = idcg == 0.0 ? 0.0 : dcg / idcg;
    double ap = relevantIds.isEmpty() ? 0.0 : sumPrecision / relevantIds.size();
    double hit = relevantFound > 0 ? 1.0 : 0.0;

    return new MetricsResult(recall, precision, firstRelevantRr, ndcg, ap, hit);
  }

  // --- Internal helpers ---

  private static Map<String, Integer> toGradeMap(List<RelevanceJudgment> judgments) {
    return judgments.stream()
        .collect(
            Collectors.toMap(RelevanceJudgment::docId, RelevanceJudgment::grade, Math::max));
  }

  private static Set<String> relevantIds(Map<String, Integer> gradeMap) {
    return gradeMap.entrySet().stream()
        .filter(e -> e.getValue() >= 1)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
  }

  private static double computeIdcg(Map<String, Integer> gradeMap, int k) {
    List<Integer> sortedGrades = new ArrayList<>(gradeMap.values());
    sortedGrades.sort(Comparator.reverseOrder());
    double idcg = 0.0;
    int limit = Math.min(k, sortedGrades.size());
    for (int i = 0; i < limit; i++) {
      idcg += gain(sortedGrades.get(i)) / log2(i + 2);
    }
    return idcg;
  }

  private static double gain(int grade) {
    return Math.max(grade, 0);
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}
