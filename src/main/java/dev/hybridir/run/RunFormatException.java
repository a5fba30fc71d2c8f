package dev.hybridir.run;

import java.io.IOException;

/** Signals a malformed line in a run or qrels file. Carries the source name and 1-based line. */
public class RunFormatException extends IOException {

  private final String source;
  private final int lineNumber;

  public RunFormatException(String source, int lineNumber, String message) {
    super("%s:%d: %s".formatted(source, lineNumber, message));
    this.source = source;
    this.lineNumber = lineNumber;
  }

  public String getSource() {
    return source;
  }

  public int getLineNumber() {
    return lineNumber;
  }
}
