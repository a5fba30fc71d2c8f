package dev.hybridir.job;

import dev.hybridir.eval.RunEvaluation;
import dev.hybridir.fusion.BatchFusionResult;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;

/**
 * What a fusion job produced.
 *
 * @param runId the id stamped on the fused run
 * @param outputPath the written run file
 * @param fusion the batch outcome
 * @param evaluation the evaluation of the fused run; null when no qrels were configured
 */
public record JobReport(
    String runId, Path outputPath, BatchFusionResult fusion, @Nullable RunEvaluation evaluation) {}
