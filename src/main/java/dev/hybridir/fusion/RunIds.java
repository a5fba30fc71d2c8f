package dev.hybridir.fusion;

import java.util.List;
import java.util.Locale;

/** Derives run ids for fused runs from the input run names and the fusion settings. */
public final class RunIds {

  private RunIds() {}

  /**
   * Returns the configured run id, or {@code <system1>_<system2>..._hybrid_<method>} when none is
   * configured, e.g. {@code bm25_fas_mdpr_fas_hybrid_rrf_k60} or {@code bm25_dense_hybrid_w0.70}.
   *
   * @throws FusionConfigurationException if the id derived from the system names is not a single
   *     token
   */
  public static String resolve(List<String> systems, FusionConfig config) {
    if (config.runId() != null) {
      return config.runId();
    }
    String derived = String.join("_", systems) + suffix(config);
    if (containsWhitespace(derived)) {
      throw new FusionConfigurationException(
          "Run id '%s' derived from the run names contains whitespace; set run-id explicitly"
              .formatted(derived));
    }
    return derived;
  }

  static boolean containsWhitespace(String runId) {
    return runId.chars().anyMatch(Character::isWhitespace);
  }

  static String suffix(FusionConfig config) {
    return switch (config.method()) {
      case RRF -> "_hybrid_rrf_k" + config.rrfK();
      case LINEAR -> "_hybrid_linear";
      case WEIGHTED -> String.format(Locale.ROOT, "_hybrid_w%.2f", config.alpha());
      case COMBSUM -> "_hybrid_combsum";
      case COMBMNZ -> "_hybrid_combmnz";
    };
  }
}
