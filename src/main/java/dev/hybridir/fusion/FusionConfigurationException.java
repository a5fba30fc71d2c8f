package dev.hybridir.fusion;

/**
 * Raised for an unusable fusion configuration: unknown method, weights that do not sum to one or
 * do not match the number of runs, non-positive {@code k}, {@code alpha} outside {@code [0, 1]}.
 * Always thrown before any query is fused.
 */
public class FusionConfigurationException extends IllegalArgumentException {

  public FusionConfigurationException(String message) {
    super(message);
  }
}
