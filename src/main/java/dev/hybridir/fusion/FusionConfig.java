package dev.hybridir.fusion;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Immutable fusion settings handed to a {@link Merger}. All values are validated on construction so
 * a bad configuration fails before any query is fused.
 *
 * @param method the fusion method
 * @param rrfK the RRF constant; must be positive
 * @param weights per-run weights for {@link FusionMethod#LINEAR}; empty means equal weights
 * @param alpha weight of the first run for {@link FusionMethod#WEIGHTED}, in [0, 1]
 * @param topK maximum number of documents kept per query; must be positive
 * @param runId run id written to the output, a single token; null or blank derives one from the
 *     input runs
 */
public record FusionConfig(
    FusionMethod method,
    int rrfK,
    List<Double> weights,
    double alpha,
    int topK,
    @Nullable String runId) {

  public static final int DEFAULT_TOP_K = 1000;
  public static final double DEFAULT_ALPHA = 0.5;

  public FusionConfig {
    if (method == null) {
      throw new FusionConfigurationException("Fusion method must be set");
    }
    if (rrfK <= 0) {
      throw new FusionConfigurationException("rrf-k must be positive but was " + rrfK);
    }
    if (!(alpha >= 0.0 && alpha <= 1.0)) {
      throw new FusionConfigurationException("alpha must be in [0.0, 1.0] but was " + alpha);
    }
    if (topK <= 0) {
      throw new FusionConfigurationException("top-k must be positive but was " + topK);
    }
    weights =
        weights == null || weights.isEmpty()
            ? List.of()
            : LinearCombination.validateWeights(weights);
    if (runId != null && runId.isBlank()) {
      runId = null;
    }
    if (runId != null && RunIds.containsWhitespace(runId)) {
      throw new FusionConfigurationException(
          "run-id must be a single token without whitespace but was '" + runId + "'");
    }
  }

  /** Defaults for the given method: k = 60, equal weights, alpha = 0.5, top 1000, derived id. */
  public static FusionConfig of(FusionMethod method) {
    return new FusionConfig(
        method, ReciprocalRankFusion.DEFAULT_K, List.of(), DEFAULT_ALPHA, DEFAULT_TOP_K, null);
  }

  public FusionConfig withRrfK(int k) {
    return new FusionConfig(method, k, weights, alpha, topK, runId);
  }

  public FusionConfig withWeights(List<Double> newWeights) {
    return new FusionConfig(method, rrfK, newWeights, alpha, topK, runId);
  }

  public FusionConfig withAlpha(double newAlpha) {
    return new FusionConfig(method, rrfK, weights, newAlpha, topK, runId);
  }

  public FusionConfig withTopK(int newTopK) {
    return new FusionConfig(method, rrfK, weights, alpha, newTopK, runId);
  }

  public FusionConfig withRunId(@Nullable String newRunId) {
    return new FusionConfig(method, rrfK, weights, alpha, topK, newRunId);
  }

  /** Creates the strategy for {@link #method()}. */
  public FusionStrategy strategy() {
    return switch (method) {
      case RRF -> new ReciprocalRankFusion(rrfK);
      case LINEAR -> weights.isEmpty() ? new LinearCombination() : new LinearCombination(weights);
      case WEIGHTED -> new WeightedCombination(alpha);
      case COMBSUM -> new CombSum();
      case COMBMNZ -> new CombMnz();
    };
  }

  /**
   * Checks that this configuration can fuse the given number of runs.
   *
   * @throws FusionConfigurationException when there are no runs, when linear weights do not match
   *     the run count, or when weighted fusion is not given exactly two runs
   */
  public void checkRunCount(int runCount) {
    if (runCount < 1) {
      throw new FusionConfigurationException("At least one run is required");
    }
    FusionStrategy strategy = strategy();
    if (strategy instanceof LinearCombination linear) {
      linear.checkSystemCount(runCount);
    } else if (strategy instanceof WeightedCombination weighted) {
      weighted.checkSystemCount(runCount);
    }
  }
}
