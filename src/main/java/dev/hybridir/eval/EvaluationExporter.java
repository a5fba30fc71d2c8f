package dev.hybridir.eval;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Exports run evaluations for tracking metric trends across experiments.
 *
 * <p>Produces three files per export: an aggregate CSV with mean metrics per cutoff, a detailed CSV
 * with per-query metrics, and a JSON summary.
 */
@Service
public class EvaluationExporter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

  private static final String METRIC_COLUMNS = "recall,precision,mrr,ndcg,map,hit_rate";

  private static final String AGGREGATE_HEADER = "run_id,cutoff,queries," + METRIC_COLUMNS;

  private static final String DETAILED_HEADER =
      "query_id,cutoff,retrieved,relevant," + METRIC_COLUMNS;

  private final Path outputDir;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  public EvaluationExporter(
      EvaluationProperties properties, Clock clock, ObjectMapper objectMapper) {
    this.outputDir = Path.of(properties.getOutputDir());
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  /**
   * Writes the evaluation of a run.
   *
   * @param evaluation the run evaluation
   * @return paths of the aggregate CSV, the detailed CSV and the JSON summary, in that order
   * @throws IOException if file writing fails
   */
  public List<Path> export(RunEvaluation evaluation) throws IOException {
    Files.createDirectories(outputDir);

    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    String runId = evaluation.summary().runId();
    Path aggregatePath = outputDir.resolve("eval-aggregate-%s-%s.csv".formatted(timestamp, runId));
    Path detailedPath = outputDir.resolve("eval-detailed-%s-%s.csv".formatted(timestamp, runId));
    Path summaryPath = outputDir.resolve("eval-summary-%s-%s.json".formatted(timestamp, runId));

    writeAggregateCsv(evaluation.summary(), aggregatePath);
    writeDetailedCsv(evaluation.queries(), detailedPath);
    writeSummaryJson(evaluation.summary(), timestamp, summaryPath);

    return List.of(aggregatePath, detailedPath, summaryPath);
  }

  private void writeAggregateCsv(EvaluationSummary summary, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(AGGREGATE_HEADER);
      writer.newLine();
      for (QueryEvaluation.CutoffMetrics mean : summary.means()) {
        writer.write(
            String.format(
                Locale.US,
                "%s,%d,%d,%s",
                escapeCsv(summary.runId()),
                mean.k(),
                summary.evaluatedQueries(),
                formatMetrics(mean.metrics())));
        writer.newLine();
      }
    }
  }

  private void writeDetailedCsv(List<QueryEvaluation> queries, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(DETAILED_HEADER);
      writer.newLine();
      for (QueryEvaluation query : queries) {
        for (QueryEvaluation.CutoffMetrics cutoff : query.cutoffs()) {
          writer.write(
              String.format(
                  Locale.US,
                  "%s,%d,%d,%d,%s",
                  escapeCsv(query.queryId()),
                  cutoff.k(),
                  query.retrieved(),
                  query.relevant(),
                  formatMetrics(cutoff.metrics())));
          writer.newLine();
        }
      }
    }
  }

  private void writeSummaryJson(EvaluationSummary summary, String timestamp, Path path)
      throws IOException {
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("runId", summary.runId());
    document.put("evaluatedAt", timestamp);
    document.put("evaluatedQueries", summary.evaluatedQueries());
    Map<String, RetrievalMetrics.MetricsResult> byCutoff = new LinkedHashMap<>();
    for (QueryEvaluation.CutoffMetrics mean : summary.means()) {
      byCutoff.put(String.valueOf(mean.k()), mean.metrics());
    }
    document.put("metrics", byCutoff);
    document.put("unretrievedQueries", summary.unretrievedQueries());
    document.put("unjudgedQueries", summary.unjudgedQueries());
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), document);
  }

  private static String formatMetrics(RetrievalMetrics.MetricsResult metrics) {
    return String.format(
        Locale.US,
        "%.4f,%.4f,%.4f,%.4f,%.4f,%.4f",
        metrics.recallAtK(),
        metrics.precisionAtK(),
        metrics.mrr(),
        metrics.ndcgAtK(),
        metrics.averagePrecision(),
        metrics.hitRate());
  }

  private static String escapeCsv(String value) {
    if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
