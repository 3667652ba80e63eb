package vcg.frontend;

import java.util.List;
import java.util.Optional;
import vcg.ast.DesignUnit;
import vcg.ast.ModuleDeclaration;

/**
 * Outcome of one parse. The design unit is always present, possibly empty or partially populated.
 * @param designUnit root of the parsed tree
 * @param errorCount number of lexical and syntax errors encountered
 * @param diagnostics all errors and warnings, in the order they were reported
 */
public record ParseResult(DesignUnit designUnit, int errorCount, List<ParseContext.Diagnostic> diagnostics) {
  public Optional<ModuleDeclaration> module() { return designUnit.getModule(); }

  public boolean hasErrors() { return errorCount > 0; }
}
