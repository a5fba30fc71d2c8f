package dev.hybridir.fusion;

import dev.hybridir.run.FusionResult;
import java.util.List;

/**
 * Outcome of fusing a batch of runs.
 *
 * @param results fused rankings in canonical query order; only complete queries are included
 * @param consistency queries some runs had no results for
 * @param cancelled whether scheduling stopped early on request
 * @param skippedQueries queries never scheduled because of cancellation
 */
public record BatchFusionResult(
    List<FusionResult> results,
    ConsistencyReport consistency,
    boolean cancelled,
    List<String> skippedQueries) {

  public BatchFusionResult {
    results = List.copyOf(results);
    skippedQueries = List.copyOf(skippedQueries);
  }
}
