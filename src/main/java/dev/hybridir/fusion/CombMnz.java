package dev.hybridir.fusion;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CombMNZ: the CombSUM score multiplied by the number of systems that retrieved the document.
 *
 * <p>The multiplier counts presence, not non-zero normalised scores: the lowest-scored document of
 * a system normalises to 0.0 but still counts as retrieved.
 */
public final class CombMnz implements FusionStrategy {

  @Override
  public Map<String, Double> fuse(CandidatePool pool) {
    Map<String, Double> scores = new LinkedHashMap<>();
    for (String docId : pool.docIds()) {
      scores.put(docId, CombSum.sum(pool, docId) * pool.presenceCount(docId));
    }
    return scores;
  }

  @Override
  public FusionMethod method() {
    return FusionMethod.COMBMNZ;
  }
}
