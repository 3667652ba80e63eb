package vcg.frontend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Per-invocation diagnostic context: the name of the source being processed and everything reported about it.
 * Passed explicitly through preprocessing, lexing, parsing and rule resolution.
 */
public class ParseContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public enum Severity { Warning, Error }

  public record Diagnostic(Severity severity, String sourceName, int line, int column, String message) {
    @Override
    public String toString() {
      String location = (line > 0) ? (sourceName + ":" + line + (column > 0 ? ":" + column : "")) : sourceName;
      return "[" + location + "] " + message;
    }
  }

  private final String sourceName;
  private final List<Diagnostic> diagnostics = new ArrayList<>();
  private int errorCount = 0;

  public ParseContext(String sourceName) { this.sourceName = (sourceName == null || sourceName.isEmpty()) ? "<input>" : sourceName; }

  public String getSourceName() { return sourceName; }

  public void warning(int line, int column, String message) {
    Diagnostic diag = new Diagnostic(Severity.Warning, sourceName, line, column, message);
    diagnostics.add(diag);
    logger.warn(diag.toString());
  }

  /** Records an error; every call counts towards {@link #getErrorCount()}. */
  public void error(int line, int column, String message) {
    Diagnostic diag = new Diagnostic(Severity.Error, sourceName, line, column, message);
    diagnostics.add(diag);
    errorCount++;
    logger.warn(diag.toString());
  }

  public List<Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }

  public List<Diagnostic> getDiagnostics(Severity severity) { return diagnostics.stream().filter(diag -> diag.severity() == severity).toList(); }

  public int getErrorCount() { return errorCount; }
}
