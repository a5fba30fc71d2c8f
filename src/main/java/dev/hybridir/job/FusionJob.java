package dev.hybridir.job;

import dev.hybridir.eval.EvaluationExporter;
import dev.hybridir.eval.Qrels;
import dev.hybridir.eval.QrelsReader;
import dev.hybridir.eval.QueryEvaluation;
import dev.hybridir.eval.RunEvaluation;
import dev.hybridir.eval.RunEvaluator;
import dev.hybridir.fusion.BatchFusionResult;
import dev.hybridir.fusion.BatchFusionService;
import dev.hybridir.fusion.FusionConfig;
import dev.hybridir.fusion.FusionProperties;
import dev.hybridir.fusion.RunIds;
import dev.hybridir.run.Run;
import dev.hybridir.run.RunEmitter;
import dev.hybridir.run.RunReader;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Batch job that fuses the configured run files, writes the fused run and, when qrels are
 * configured, evaluates it.
 *
 * <p>Pipeline: read every run (format errors abort before fusing) -> resolve the fusion config and
 * run id -> fuse all queries -> write {@code <output-dir>/<run-id>.run} -> evaluate and export.
 *
 * <p>Closing the application context while the job runs stops new queries from being scheduled;
 * queries already being fused complete and are written whole.
 */
@Component
@ConditionalOnProperty(prefix = "hybridir.job", name = "enabled", havingValue = "true")
public class FusionJob implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(FusionJob.class);

  private final JobProperties jobProperties;
  private final FusionProperties fusionProperties;
  private final BatchFusionService batchFusionService;
  private final RunEvaluator runEvaluator;
  private final EvaluationExporter evaluationExporter;
  private final AtomicBoolean cancelRequested = new AtomicBoolean();

  public FusionJob(
      JobProperties jobProperties,
      FusionProperties fusionProperties,
      BatchFusionService batchFusionService,
      RunEvaluator runEvaluator,
      EvaluationExporter evaluationExporter) {
    this.jobProperties = jobProperties;
    this.fusionProperties = fusionProperties;
    this.batchFusionService = batchFusionService;
    this.runEvaluator = runEvaluator;
    this.evaluationExporter = evaluationExporter;
  }

  @Override
  public void run(ApplicationArguments args) throws IOException {
    execute();
  }

  /**
   * Runs the job once.
   *
   * @return what was written and computed
   * @throws IOException if a run or qrels file cannot be read or parsed, or the output cannot be
   *     written
   */
  public JobReport execute() throws IOException {
    FusionConfig config = fusionProperties.toFusionConfig();
    List<Run> runs = loadRuns(jobProperties.getRuns());
    String runId = RunIds.resolve(runs.stream().map(Run::system).toList(), config);
    RunEmitter emitter = new RunEmitter(runId);

    BatchFusionResult fusion = batchFusionService.fuse(runs, config, cancelRequested::get);

    Path outputPath = Path.of(jobProperties.getOutputDir()).resolve(runId + ".run");
    emitter.emit(fusion.results(), outputPath);
    log.info("Fused run {} saved to {}", runId, outputPath);

    RunEvaluation evaluation = evaluate(runId, fusion);
    return new JobReport(runId, outputPath, fusion, evaluation);
  }

  /** Requests cancellation; in-flight queries still complete. */
  @PreDestroy
  public void cancel() {
    if (!cancelRequested.getAndSet(true)) {
      log.info("Fusion job cancellation requested");
    }
  }

  private static List<Run> loadRuns(List<String> paths) throws IOException {
    List<Run> runs = new ArrayList<>(paths.size());
    for (String path : paths) {
      Run run = RunReader.read(Path.of(path));
      log.info("Loaded run {} with {} queries from {}", run.system(), run.queryCount(), path);
      runs.add(run);
    }
    return runs;
  }

  private @Nullable RunEvaluation evaluate(String runId, BatchFusionResult fusion)
      throws IOException {
    String qrelsPath = jobProperties.getQrels();
    if (qrelsPath == null || qrelsPath.isBlank()) {
      return null;
    }
    Qrels qrels = QrelsReader.read(Path.of(qrelsPath));
    RunEvaluation evaluation = runEvaluator.evaluate(runId, fusion.results(), qrels);
    List<Path> exported = evaluationExporter.export(evaluation);
    for (QueryEvaluation.CutoffMetrics mean : evaluation.summary().means()) {
      log.info(
          "{} @{}: ndcg={}, map={}, recall={}, mrr={}",
          runId,
          mean.k(),
          String.format(Locale.ROOT, "%.4f", mean.metrics().ndcgAtK()),
          String.format(Locale.ROOT, "%.4f", mean.metrics().averagePrecision()),
          String.format(Locale.ROOT, "%.4f", mean.metrics().recallAtK()),
          String.format(Locale.ROOT, "%.4f", mean.metrics().mrr()));
    }
    log.info("Evaluation exported to {}", exported);
    return evaluation;
  }
}
