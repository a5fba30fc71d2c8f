package dev.hybridir.fusion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CombSUM: unweighted sum of min-max normalised scores, absent systems contributing 0.
 *
 * <p>Orders documents like equal-weight {@link LinearCombination} but without dividing by the
 * number of systems.
 */
public final class CombSum implements FusionStrategy {

  @Override
  public Map<String, Double> fuse(CandidatePool pool) {
    Map<String, Double> scores = new LinkedHashMap<>();
    for (String docId : pool.docIds()) {
      scores.put(docId, sum(pool, docId));
    }
    return scores;
  }

  static double sum(CandidatePool pool, String docId) {
    double sum = 0.0;
    for (int system = 0; system < pool.systemCount(); system++) {
      sum += pool.normalizedScore(system, docId).orElse(0.0);
    }
    return sum;
  }

  @Override
  public FusionMethod method() {
    return FusionMethod.COMBSUM;
  }
}
