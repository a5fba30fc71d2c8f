package dev.hybridir.fusion;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Weighted sum of min-max normalised scores: {@code score(d) = sum_s weight_s * norm_s(d)}, where a
 * system that did not retrieve {@code d} contributes 0.
 *
 * <p>Weights are given per system in input order and must sum to 1 within {@link
 * #WEIGHT_SUM_TOLERANCE}; they are never renormalised. Without explicit weights every system gets
 * {@code 1 / N}, which makes the score the mean normalised score.
 */
public final class LinearCombination implements FusionStrategy {

  static final double WEIGHT_SUM_TOLERANCE = 1e-6;

  private final @Nullable List<Double> weights;

  /** Equal weights, resolved from the number of systems at fusion time. */
  public LinearCombination() {
    this.weights = null;
  }

  public LinearCombination(List<Double> weights) {
    this.weights = validateWeights(weights);
  }

  static List<Double> validateWeights(List<Double> weights) {
    if (weights.isEmpty()) {
      throw new FusionConfigurationException("Weights must not be empty");
    }
    double sum = 0.0;
    for (Double weight : weights) {
      if (weight == null || !Double.isFinite(weight)) {
        throw new FusionConfigurationException("Weights must be finite numbers: " + weights);
      }
      sum += weight;
    }
    if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
      throw new FusionConfigurationException(
          "Weights must sum to 1.0 but sum to %s: %s".formatted(sum, weights));
    }
    return List.copyOf(weights);
  }

  /** The explicit weights, or an empty list when equal weights are used. */
  public List<Double> weights() {
    return weights == null ? List.of() : weights;
  }

  /**
   * Checks that the weights fit the number of systems being fused.
   *
   * @throws FusionConfigurationException on a count mismatch
   */
  void checkSystemCount(int systemCount) {
    if (weights != null && weights.size() != systemCount) {
      throw new FusionConfigurationException(
          "Got %d weights for %d runs".formatted(weights.size(), systemCount));
    }
  }

  private List<Double> resolveWeights(int systemCount) {
    checkSystemCount(systemCount);
    if (weights != null) {
      return weights;
    }
    return Collections.nCopies(systemCount, 1.0 / systemCount);
  }

  @Override
  public Map<String, Double> fuse(CandidatePool pool) {
    List<Double> resolved = resolveWeights(pool.systemCount());
    Map<String, Double> scores = new LinkedHashMap<>();
    for (String docId : pool.docIds()) {
      double score = 0.0;
      for (int system = 0; system < pool.systemCount(); system++) {
        score += resolved.get(system) * pool.normalizedScore(system, docId).orElse(0.0);
      }
      scores.put(docId, score);
    }
    return scores;
  }

  @Override
  public FusionMethod method() {
    return FusionMethod.LINEAR;
  }
}
