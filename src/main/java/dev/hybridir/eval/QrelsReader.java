package dev.hybridir.eval;

import dev.hybridir.run.RunFormatException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parses relevance judgments in the four-column qrels format:
 *
 * <pre>query_id  iteration  document_id  grade</pre>
 *
 * <p>The iteration column is ignored. A document judged twice for the same query is an error.
 */
public final class QrelsReader {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private QrelsReader() {}

  public static Qrels read(Path path) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return read(path.toString(), reader);
    }
  }

  public static Qrels read(String source, Reader reader) throws IOException {
    BufferedReader buffered =
        reader instanceof BufferedReader br ? br : new BufferedReader(reader);
    Map<String, List<RelevanceJudgment>> judgments = new HashMap<>();
    Set<String> seen = new HashSet<>();

    String text;
    int lineNumber = 0;
    while ((text = buffered.readLine()) != null) {
      lineNumber++;
      String trimmed = text.strip();
      if (trimmed.isEmpty()) {
        continue;
      }
      String[] fields = WHITESPACE.split(trimmed);
      if (fields.length != 4) {
        throw new RunFormatException(
            source, lineNumber, "expected 4 fields but found " + fields.length);
      }
      int grade;
      try {
        grade = Integer.parseInt(fields[3]);
      } catch (NumberFormatException e) {
        throw new RunFormatException(source, lineNumber, "grade is not an integer: " + fields[3]);
      }
      if (!seen.add(fields[0] + '\u0000' + fields[2])) {
        throw new RunFormatException(
            source,
            lineNumber,
            "document %s judged twice for query %s".formatted(fields[2], fields[0]));
      }
      judgments
          .computeIfAbsent(fields[0], q -> new ArrayList<>())
          .add(new RelevanceJudgment(fields[2], grade));
    }
    return new Qrels(judgments);
  }
}
