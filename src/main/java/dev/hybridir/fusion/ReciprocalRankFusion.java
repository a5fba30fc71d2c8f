package dev.hybridir.fusion;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Reciprocal Rank Fusion: {@code score(d) = sum over systems retrieving d of 1 / (k + rank)}.
 *
 * <p>Only ranks are used, so systems with incomparable score scales can be combined. A system that
 * did not retrieve a document adds nothing for it.
 */
public final class ReciprocalRankFusion implements FusionStrategy {

  public static final int DEFAULT_K = 60;

  private final int k;

  public ReciprocalRankFusion() {
    this(DEFAULT_K);
  }

  public ReciprocalRankFusion(int k) {
    if (k <= 0) {
      throw new FusionConfigurationException("RRF k must be positive but was " + k);
    }
    this.k = k;
  }

  public int k() {
    return k;
  }

  @Override
  public Map<String, Double> fuse(CandidatePool pool) {
    Map<String, Double> scores = new LinkedHashMap<>();
    for (String docId : pool.docIds()) {
      double score = 0.0;
      for (int system = 0; system < pool.systemCount(); system++) {
        OptionalInt rank = pool.rank(system, docId);
        if (rank.isPresent()) {
          score += 1.0 / ((double) k + rank.getAsInt());
        }
      }
      scores.put(docId, score);
    }
    return scores;
  }

  @Override
  public FusionMethod method() {
    return FusionMethod.RRF;
  }
}
