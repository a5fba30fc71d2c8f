package dev.hybridir.job;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration of the fusion job, bound from {@code hybridir.job.*}.
 *
 * <ul>
 *   <li>{@code enabled} - run the job at startup (default false)
 *   <li>{@code runs} - run files to fuse, in weight order
 *   <li>{@code output-dir} - directory the fused run is written to (default runs/hybrid)
 *   <li>{@code qrels} - optional qrels file; when set the fused run is evaluated
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "hybridir.job")
public class JobProperties {

  private boolean enabled;
  private List<String> runs = new ArrayList<>();
  private String outputDir = "runs/hybrid";
  private String qrels = "";

  /** Validates configuration at startup. Only checked when the job is enabled. */
  @PostConstruct
  void validate() {
    if (!enabled) {
      return;
    }
    if (runs.isEmpty()) {
      throw new IllegalStateException("hybridir.job.runs must list at least one run file");
    }
    if (outputDir == null || outputDir.isBlank()) {
      throw new IllegalStateException("hybridir.job.output-dir must not be blank");
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public List<String> getRuns() {
    return runs;
  }

  public void setRuns(List<String> runs) {
    this.runs = runs;
  }

  public String getOutputDir() {
    return outputDir;
  }

  public void setOutputDir(String outputDir) {
    this.outputDir = outputDir;
  }

  public String getQrels() {
    return qrels;
  }

  public void setQrels(String qrels) {
    this.qrels = qrels;
  }
}
