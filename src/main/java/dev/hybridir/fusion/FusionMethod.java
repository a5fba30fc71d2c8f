package dev.hybridir.fusion;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** The supported fusion methods, by configuration name. */
public enum FusionMethod {
  RRF("rrf"),
  LINEAR("linear"),
  WEIGHTED("weighted"),
  COMBSUM("combsum"),
  COMBMNZ("combmnz");

  private final String configName;

  FusionMethod(String configName) {
    this.configName = configName;
  }

  public String configName() {
    return configName;
  }

  /**
   * Resolves a method by its configuration name, ignoring case and surrounding whitespace.
   *
   * @throws FusionConfigurationException for an unknown name
   */
  public static FusionMethod fromName(String name) {
    if (name != null) {
      String wanted = name.strip().toLowerCase(Locale.ROOT);
      for (FusionMethod method : values()) {
        if (method.configName.equals(wanted)) {
          return method;
        }
      }
    }
    throw new FusionConfigurationException(
        "Unknown fusion method '%s', expected one of: %s"
            .formatted(
                name,
                Arrays.stream(values())
                    .map(FusionMethod::configName)
                    .collect(Collectors.joining(", "))));
  }
}
