package dev.hybridir.run;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes fused rankings in the standard six-column result format, stamping every line with the
 * caller's run id.
 *
 * <p>Queries are written in lexicographic order of their ids and documents in rank order, so the
 * output only depends on the results, not on the order they were produced in. Write errors are
 * not retried.
 */
public final class RunEmitter {

  private static final Logger log = LoggerFactory.getLogger(RunEmitter.class);

  /** Fixed second column of the format. */
  public static final String PLACEHOLDER = "Q0";

  private final String runId;

  public RunEmitter(String runId) {
    if (runId == null || runId.isBlank() || runId.chars().anyMatch(Character::isWhitespace)) {
      throw new IllegalArgumentException("runId must be a single non-blank token: " + runId);
    }
    this.runId = runId;
  }

  public String runId() {
    return runId;
  }

  /**
   * Writes the results to a file, creating parent directories and replacing an existing file.
   *
   * @return the number of lines written
   */
  public long emit(Collection<FusionResult> results, Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    long lines;
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      lines = emit(results, writer);
    }
    log.info("Wrote {} lines for {} queries to {}", lines, results.size(), path);
    return lines;
  }

  /**
   * Writes the results to a stream. The stream is flushed but not closed.
   *
   * @return the number of lines written
   */
  public long emit(Collection<FusionResult> results, Writer writer) throws IOException {
    List<FusionResult> ordered =
        results.stream().sorted(Comparator.comparing(FusionResult::queryId)).toList();
    long lines = 0;
    for (FusionResult result : ordered) {
      for (FusedDocument document : result.documents()) {
        writer.write(format(result.queryId(), document));
        writer.write('\n');
        lines++;
      }
    }
    writer.flush();
    return lines;
  }

  String format(String queryId, FusedDocument document) {
    return String.format(
        Locale.ROOT,
        "%s %s %s %d %.6f %s",
        queryId,
        PLACEHOLDER,
        document.docId(),
        document.rank(),
        document.score(),
        runId);
  }
}
