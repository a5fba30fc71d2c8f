package dev.hybridir.fusion;

import java.util.List;
import java.util.Map;

/**
 * Two-system linear combination with a single knob: the first run gets {@code alpha}, the second
 * {@code 1 - alpha}. Typically lexical first, neural second.
 */
public final class WeightedCombination implements FusionStrategy {

  private final double alpha;
  private final LinearCombination linear;

  public WeightedCombination(double alpha) {
    if (!(alpha >= 0.0 && alpha <= 1.0)) {
      throw new FusionConfigurationException("alpha must be in [0.0, 1.0] but was " + alpha);
    }
    this.alpha = alpha;
    this.linear = new LinearCombination(List.of(alpha, 1.0 - alpha));
  }

  public double alpha() {
    return alpha;
  }

  void checkSystemCount(int systemCount) {
    if (systemCount != 2) {
      throw new FusionConfigurationException(
          "Weighted fusion combines exactly 2 runs but got " + systemCount);
    }
  }

  @Override
  public Map<String, Double> fuse(CandidatePool pool) {
    checkSystemCount(pool.systemCount());
    return linear.fuse(pool);
  }

  @Override
  public FusionMethod method() {
    return FusionMethod.WEIGHTED;
  }
}
