package dev.hybridir.eval;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for run evaluation, bound from {@code hybridir.eval.*}.
 *
 * <ul>
 *   <li>{@code cutoffs} - depths at which metrics are computed (default 10, 20, 100, 1000)
 *   <li>{@code output-dir} - directory for exported CSV and JSON files (default {@code eval})
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "hybridir.eval")
public class EvaluationProperties {

  private List<Integer> cutoffs = new ArrayList<>(List.of(10, 20, 100, 1000));
  private String outputDir = "eval";

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    if (cutoffs.isEmpty()) {
      throw new IllegalStateException("hybridir.eval.cutoffs must not be empty");
    }
    for (Integer cutoff : cutoffs) {
      if (cutoff == null || cutoff < 1) {
        throw new IllegalStateException(
            "hybridir.eval.cutoffs must be positive, got: " + cutoffs);
      }
    }
    if (outputDir == null || outputDir.isBlank()) {
      throw new IllegalStateException("hybridir.eval.output-dir must not be blank");
    }
  }

  public List<Integer> getCutoffs() {
    return cutoffs;
  }

  public void setCutoffs(List<Integer> cutoffs) {
    this.cutoffs = cutoffs;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }
}
