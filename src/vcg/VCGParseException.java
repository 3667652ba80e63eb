package vcg;

import java.util.Collections;
import java.util.List;
import vcg.frontend.ParseContext;

/** The parse produced no usable module. */
public class VCGParseException extends VCGException {
  private static final long serialVersionUID = 1L;

  private final transient List<ParseContext.Diagnostic> diagnostics;

  public VCGParseException(String message, List<ParseContext.Diagnostic> diagnostics) {
    super(message);
    this.diagnostics = (diagnostics == null) ? List.of() : List.copyOf(diagnostics);
  }

  public List<ParseContext.Diagnostic> getDiagnostics() { return Collections.unmodifiableList(diagnostics); }
}
