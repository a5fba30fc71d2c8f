package dev.hybridir.fusion;

import java.util.Map;

/** Combines the ranked lists of one query into one score per candidate document. */
public interface FusionStrategy {

  /**
   * Scores every candidate of the pool.
   *
   * @param pool the candidates of one query
   * @return combined score for each id in {@link CandidatePool#docIds()}
   */
  Map<String, Double> fuse(CandidatePool pool);

  /** The method this strategy implements. */
  FusionMethod method();
}
