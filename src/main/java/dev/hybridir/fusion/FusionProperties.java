package dev.hybridir.fusion;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised fusion configuration, bound from {@code hybridir.fusion.*}.
 *
 * <ul>
 *   <li>{@code method} - one of rrf, linear, weighted, combsum, combmnz (default rrf)
 *   <li>{@code rrf-k} - RRF constant (default 60)
 *   <li>{@code weights} - per-run weights for linear fusion, summing to 1 (default equal weights)
 *   <li>{@code alpha} - weight of the first run for weighted fusion (default 0.5)
 *   <li>{@code top-k} - documents kept per query (default 1000)
 *   <li>{@code run-id} - run id of the fused output (default derived from the input runs)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start on an invalid
 * combination. The worker count is read separately from {@code hybridir.fusion.parallelism}.
 */
@Configuration
@ConfigurationProperties(prefix = "hybridir.fusion")
public class FusionProperties {

  private String method = FusionMethod.RRF.configName();
  private int rrfK = ReciprocalRankFusion.DEFAULT_K;
  private List<Double> weights = new ArrayList<>();
  private double alpha = FusionConfig.DEFAULT_ALPHA;
  private int topK = FusionConfig.DEFAULT_TOP_K;
  private String runId = "";

  /** Validates configuration at startup. Throws if the settings cannot form a fusion config. */
  @PostConstruct
  void validate() {
    try {
      toFusionConfig();
    } catch (FusionConfigurationException e) {
      throw new IllegalStateException(
          "Invalid hybridir.fusion configuration: " + e.getMessage(), e);
    }
  }

  /**
   * Converts the bound properties into an immutable fusion config.
   *
   * @throws FusionConfigurationException if a value is invalid
   */
  public FusionConfig toFusionConfig() {
    return new FusionConfig(FusionMethod.fromName(method), rrfK, weights, alpha, topK, runId);
  }

  public String getMethod() {
    return method;
  }

  public void setMethod(String method) {
    this.method = method;
  }

  public int getRrfK() {
    return rrfK;
  }

  public void setRrfK(int rrfK) {
    this.rrfK = rrfK;
  }

  public List<Double> getWeights() {
    return weights;
  }

  public void setWeights(List<Double> weights) {
    this.weights = weights;
  }

  public double getAlpha() {
    return alpha;
  }

  public void setAlpha(double alpha) {
    this.alpha = alpha;
  }

  public int getTopK() {
    return topK;
  }

  public void setTopK(int topK) {
    this.topK = topK;
  }

  public String getRunId() {
    return runId;
  }

  public void setRunId(String runId) {
    this.runId = runId;
  }
}
