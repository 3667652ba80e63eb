package vcg.preprocess;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.frontend.ParseContext;

/**
 * Reduces Verilog source to the part the parser needs: the module header, followed by the body lines that
 * declare ports or parameters, followed by <code>endmodule</code>. Conditional compilation directives are
 * evaluated against a {@link MacroSet}; lines in dead branches are dropped.
 */
public class VerilogPreprocessor {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String MODULE_END = "endmodule";

  private static final Pattern MODULE_START = Pattern.compile("^\\s*module\\s+\\w+");
  private static final Pattern DECLARATION_START = Pattern.compile("^\\s*(input|output|inout|parameter)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern MODULE_END_LINE = Pattern.compile("^\\s*endmodule\\b");
  private static final Pattern DIRECTIVE = Pattern.compile("^\\s*`(\\w+)\\s*(\\w*)\\s*(.*)$");
  /** Directives that are evaluated or dropped; any other backtick word at line start is macro usage and kept as text. */
  private static final Set<String> KNOWN_DIRECTIVES =
      Set.of("ifdef", "ifndef", "elsif", "else", "endif", "define", "undef", "include", "timescale", "default_nettype", "resetall",
             "celldefine", "endcelldefine", "unconnected_drive", "nounconnected_drive", "pragma", "line");

  private final MacroSet macros;
  private final ParseContext context;

  /**
   * @param macros externally defined macros; not modified, <code>`define</code>/<code>`undef</code> act on a copy
   * @param context receives warnings about unbalanced directives
   */
  public VerilogPreprocessor(MacroSet macros, ParseContext context) {
    this.macros = (macros == null) ? MacroSet.empty() : macros;
    this.context = context;
  }

  private enum LineRole { Ignored, Region, Directive }

  /**
   * @return the reduced text, or an empty string if there is no module declaration
   * @throws PreprocessException if the text could not be reduced
   */
  public String reduce(String text) throws PreprocessException {
    try {
      String[] lines = text.split("\r?\n", -1);
      LineRole[] roles = classify(lines);
      if (roles == null) {
        logger.debug("No module declaration found in {}", context.getSourceName());
        return "";
      }
      return evaluate(lines, roles) + "\n" + MODULE_END;
    } catch (RuntimeException e) {
      throw new PreprocessException(String.valueOf(e.getMessage()), e);
    }
  }

  /**
   * Marks the lines that belong to the module header and body declarations, and the directive lines that
   * must be evaluated. Returns null if no module starts in the text.
   */
  private LineRole[] classify(String[] lines) {
    LineRole[] roles = new LineRole[lines.length];
    Arrays.fill(roles, LineRole.Ignored);

    int moduleLine = -1;
    for (int i = 0; i < lines.length; ++i) {
      if (isDirective(lines[i])) {
        roles[i] = LineRole.Directive;
        continue;
      }
      if (MODULE_START.matcher(lines[i]).find()) {
        moduleLine = i;
        break;
      }
    }
    if (moduleLine < 0)
      return null;

    int i = moduleLine;
    // header: up to and including the line that terminates it
    for (; i < lines.length; ++i) {
      roles[i] = isDirective(lines[i]) ? LineRole.Directive : LineRole.Region;
      if (roles[i] == LineRole.Region && lines[i].contains(";")) {
        ++i;
        break;
      }
    }
    boolean inDeclaration = false;
    for (; i < lines.length; ++i) {
      String line = lines[i];
      if (isDirective(line)) {
        roles[i] = LineRole.Directive;
        continue;
      }
      if (inDeclaration) {
        roles[i] = LineRole.Region;
        inDeclaration = !line.contains(";");
        continue;
      }
      if (MODULE_END_LINE.matcher(line).find()) {
        markTrailingDirectives(lines, roles, i + 1);
        break;
      }
      if (DECLARATION_START.matcher(line).find()) {
        roles[i] = LineRole.Region;
        inDeclaration = !line.contains(";");
      }
    }
    return roles;
  }

  /** Directives after the module still close conditionals opened before it, as an include guard does. */
  private static void markTrailingDirectives(String[] lines, LineRole[] roles, int from) {
    for (int i = from; i < lines.length; ++i) {
      if (isDirective(lines[i]))
        roles[i] = LineRole.Directive;
    }
  }

  private static boolean isDirective(String line) {
    Matcher m = DIRECTIVE.matcher(line);
    return m.matches() && KNOWN_DIRECTIVES.contains(m.group(1));
  }

  /** Runs the condition stack over all classified lines and keeps the live region lines. */
  private String evaluate(String[] lines, LineRole[] roles) {
    MacroSet defined = macros.copy();
    ConditionStack stack = new ConditionStack();
    List<String> kept = new ArrayList<>();
    for (int i = 0; i < lines.length; ++i) {
      switch (roles[i]) {
      case Ignored:
        break;
      case Region:
        if (stack.isLive())
          kept.add(lines[i]);
        break;
      case Directive:
        applyDirective(lines[i], i + 1, stack, defined);
        break;
      }
    }
    if (stack.depth() > 0)
      context.warning(0, 0, stack.depth() + " conditional block(s) not closed by `endif");
    return String.join("\n", kept);
  }

  private void applyDirective(String line, int lineNumber, ConditionStack stack, MacroSet defined) {
    Matcher m = DIRECTIVE.matcher(line);
    if (!m.matches())
      return;
    String directive = m.group(1);
    String name = m.group(2);
    boolean balanced = true;
    switch (directive) {
    case "ifdef":
      stack.push(defined.isDefined(name));
      break;
    case "ifndef":
      stack.push(!defined.isDefined(name));
      break;
    case "elsif":
      balanced = stack.elsif(defined.isDefined(name));
      break;
    case "else":
      balanced = stack.otherwise();
      break;
    case "endif":
      balanced = stack.pop();
      break;
    case "define":
      if (stack.isLive() && !name.isEmpty()) {
        defined.define(name, m.group(3).strip());
        logger.trace("Line {}: define {}", lineNumber, name);
      }
      break;
    case "undef":
      if (stack.isLive())
        defined.undefine(name);
      break;
    default:
      logger.trace("Line {}: dropping directive `{}", lineNumber, directive);
      break;
    }
    if (!balanced)
      context.warning(lineNumber, 0, "`" + directive + " without matching `ifdef/`ifndef");
  }
}
