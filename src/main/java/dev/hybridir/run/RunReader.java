package dev.hybridir.run;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses runs in the standard six-column result format:
 *
 * <pre>query_id  Q0  document_id  rank  score  run_id</pre>
 *
 * <p>Fields are whitespace separated. The placeholder and run id columns are required but ignored.
 * Every problem is reported as a {@link RunFormatException} naming the source and line: wrong field
 * count, non-numeric or non-positive rank, non-numeric or infinite score, a document repeated
 * within one query, or two lines of one query sharing a rank. Lines of a query may appear in any
 * order; they are sorted by rank.
 */
public final class RunReader {

  static final int FIELD_COUNT = 6;

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private RunReader() {}

  /**
   * Reads a run file. The system name is the file name without its extension.
   *
   * @param path the run file
   * @return the parsed run
   * @throws RunFormatException if a line is malformed
   * @throws IOException if the file cannot be read
   */
  public static Run read(Path path) throws IOException {
    String system = systemName(path);
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(system, path.toString(), reader);
    }
  }

  /**
   * Reads a run from a character stream.
   *
   * @param system the name of the producing system
   * @param source a description of the stream used in error messages
   * @param reader the stream; not closed by this method
   */
  public static Run read(String system, String source, Reader reader) throws IOException {
    BufferedReader buffered =
        reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    Map<String, List<Line>> byQuery = new LinkedHashMap<>();
    Map<String, Map<String, Integer>> seenDocs = new HashMap<>();

    String text;
    int lineNumber = 0;
    while ((text = buffered.readLine()) != null) {
      lineNumber++;
      String trimmed = text.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      Line line = parseLine(trimmed, source, lineNumber);
      Integer firstSeen =
          seenDocs
              .computeIfAbsent(line.queryId(), q -> new HashMap<>())
              .putIfAbsent(line.document().docId(), lineNumber);
      if (firstSeen != null) {
        throw new RunFormatException(
            source,
            lineNumber,
            "document %s repeated for query %s (first seen on line %d)"
                .formatted(line.document().docId(), line.queryId(), firstSeen));
      }
      byQuery.computeIfAbsent(line.queryId(), q -> new ArrayList<>()).add(line);
    }

    List<RankedList> lists = new ArrayList<>(byQuery.size());
    for (Map.Entry<String, List<Line>> entry : byQuery.entrySet()) {
      lists.add(toRankedList(system, source, entry.getKey(), entry.getValue()));
    }
    return Run.of(system, lists);
  }

  static String systemName(Path path) {
    String fileName = path.getFileName().toString();
    int dot = fileName.lastIndexOf('.');
    return dot > 0 ? fileName.substring(0, dot) : fileName;
  }

  private static Line parseLine(String text, String source, int lineNumber)
      throws RunFormatException {
    String[] fields = WHITESPACE.split(text);
    if (fields.length != FIELD_COUNT) {
      throw new RunFormatException(
          source,
          lineNumber,
          "expected %d fields but found %d".formatted(FIELD_COUNT, fields.length));
    }
    int rank;
    try {
      rank = Integer.parseInt(fields[3]);
    } catch (NumberFormatException e) {
      throw new RunFormatException(source, lineNumber, "rank is not an integer: " + fields[3]);
    }
    if (rank < 1) {
      throw new RunFormatException(source, lineNumber, "rank must be positive: " + rank);
    }
    double score;
    try {
      score = Double.parseDouble(fields[4]);
    } catch (NumberFormatException e) {
      throw new RunFormatException(source, lineNumber, "score is not a number: " + fields[4]);
    }
    if (Double.isNaN(score)) {
      throw new RunFormatException(source, lineNumber, "score is not a number: " + fields[4]);
    }
    if (Double.isInfinite(score)) {
      throw new RunFormatException(source, lineNumber, "score must be finite: " + fields[4]);
    }
    return new Line(fields[0], new RankedDocument(fields[2], rank, score), lineNumber);
  }

  private static RankedList toRankedList(
      String system, String source, String queryId, List<Line> lines) throws RunFormatException {
    lines.sort(Comparator.comparingInt(l -> l.document().rank()));
    List<RankedDocument> documents = new ArrayList<>(lines.size());
    Line previous = null;
    for (Line line : lines) {
      if (previous != null && previous.document().rank() == line.document().rank()) {
        throw new RunFormatException(
            source,
            line.lineNumber(),
            "rank %d repeated for query %s (also on line %d)"
                .formatted(line.document().rank(), queryId, previous.lineNumber()));
      }
      documents.add(line.document());
      previous = line;
    }
    return new RankedList(system, queryId, documents);
  }

  private record Line(String queryId, RankedDocument document, int lineNumber) {}
}
