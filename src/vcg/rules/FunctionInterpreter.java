package vcg.rules;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates the expressions inside <code>${...}</code> in rule targets.
 * <p>
 * The language has string literals (<code>'x'</code>, <code>"x"</code>), integer literals, capture references
 * (<code>*0</code>, <code>*1</code>, ...; a bare <code>*</code> is <code>*0</code>), calls of the
 * allow-listed string transforms in function form (<code>upper(*0)</code>) or method form
 * (<code>*0.upper()</code>), parentheses and <code>+</code> for concatenation. Nothing else is callable.
 */
public class FunctionInterpreter {
  @FunctionalInterface
  private interface Transform {
    String apply(List<String> args) throws FunctionCallException;
  }

  private record Function(int minArgs, int maxArgs, Transform transform) {}

  private static final Map<String, Function> functions;
  static {
    HashMap<String, Function> table = new HashMap<>();
    table.put("upper", new Function(1, 1, args -> args.get(0).toUpperCase(Locale.ROOT)));
    table.put("lower", new Function(1, 1, args -> args.get(0).toLowerCase(Locale.ROOT)));
    table.put("title", new Function(1, 1, args -> title(args.get(0))));
    table.put("capitalize", new Function(1, 1, args -> capitalize(args.get(0))));
    table.put("replace", new Function(3, 4, args -> replace(args)));
    table.put("strip", new Function(1, 2, args -> strip(args.get(0), args.size() > 1 ? args.get(1) : null, true, true)));
    table.put("lstrip", new Function(1, 2, args -> strip(args.get(0), args.size() > 1 ? args.get(1) : null, true, false)));
    table.put("rstrip", new Function(1, 2, args -> strip(args.get(0), args.size() > 1 ? args.get(1) : null, false, true)));
    table.put("str", new Function(1, 1, args -> args.get(0)));
    functions = Collections.unmodifiableMap(table);
  }

  /** Names of the callable transforms. */
  public static Set<String> getFunctionNames() { return functions.keySet(); }

  private final List<String> groups;
  private String text;
  private int pos;

  /** @param groups wildcard captures the expression may refer to */
  public FunctionInterpreter(List<String> groups) { this.groups = List.copyOf(groups); }

  /** Evaluates one expression (the text between <code>${</code> and <code>}</code>). */
  public String evaluate(String expression) throws FunctionCallException {
    text = expression;
    pos = 0;
    String value = parseSum();
    skipSpace();
    if (pos < text.length())
      throw error("unexpected '" + text.charAt(pos) + "'");
    return value;
  }

  private String parseSum() throws FunctionCallException {
    String value = parseTerm();
    while (accept('+'))
      value = value + parseTerm();
    return value;
  }

  private String parseTerm() throws FunctionCallException {
    String value = parsePrimary();
    while (accept('.')) {
      String name = parseName();
      List<String> args = new ArrayList<>();
      args.add(value);
      args.addAll(parseArguments());
      value = call(name, args);
    }
    return value;
  }

  private String parsePrimary() throws FunctionCallException {
    skipSpace();
    if (pos >= text.length())
      throw error("unexpected end of expression");
    char c = text.charAt(pos);
    if (c == '\'' || c == '"')
      return parseString(c);
    if (c == '*')
      return parseReference();
    if (Character.isDigit(c)) {
      int start = pos;
      while (pos < text.length() && Character.isDigit(text.charAt(pos)))
        pos++;
      return text.substring(start, pos);
    }
    if (c == '(') {
      pos++;
      String value = parseSum();
      expect(')');
      return value;
    }
    if (Character.isLetter(c) || c == '_') {
      String name = parseName();
      skipSpace();
      if (pos >= text.length() || text.charAt(pos) != '(')
        throw error("name '" + name + "' is not defined");
      return call(name, parseArguments());
    }
    throw error("unexpected '" + c + "'");
  }

  private String parseReference() throws FunctionCallException {
    pos++;
    int start = pos;
    while (pos < text.length() && Character.isDigit(text.charAt(pos)))
      pos++;
    int index = 0;
    if (start != pos) {
      try {
        index = Integer.parseInt(text.substring(start, pos));
      } catch (NumberFormatException e) {
        throw error("capture index *" + text.substring(start, pos) + " too large");
      }
    }
    if (index >= groups.size())
      throw error("capture *" + index + " does not exist (" + groups.size() + " captured)");
    return groups.get(index);
  }

  private String parseString(char quote) throws FunctionCallException {
    StringBuilder value = new StringBuilder();
    pos++;
    while (pos < text.length()) {
      char c = text.charAt(pos++);
      if (c == quote)
        return value.toString();
      if (c == '\\' && pos < text.length()) {
        char escaped = text.charAt(pos++);
        switch (escaped) {
        case 'n' -> value.append('\n');
        case 't' -> value.append('\t');
        default -> value.append(escaped);
        }
        continue;
      }
      value.append(c);
    }
    throw error("unterminated string literal");
  }

  private String parseName() throws FunctionCallException {
    skipSpace();
    int start = pos;
    while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
      pos++;
    if (start == pos)
      throw error("expected a function name");
    return text.substring(start, pos);
  }

  private List<String> parseArguments() throws FunctionCallException {
    expect('(');
    List<String> args = new ArrayList<>();
    if (accept(')'))
      return args;
    do {
      args.add(parseSum());
    } while (accept(','));
    expect(')');
    return args;
  }

  private String call(String name, List<String> args) throws FunctionCallException {
    Function function = functions.get(name);
    if (function == null)
      throw error("function '" + name + "' is not allowed");
    if (args.size() < function.minArgs() || args.size() > function.maxArgs())
      throw error(name + "() takes " + function.minArgs() +
                  (function.maxArgs() != function.minArgs() ? " to " + function.maxArgs() : "") + " arguments, " + args.size() + " given");
    return function.transform().apply(args);
  }

  private void skipSpace() {
    while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
      pos++;
  }

  private boolean accept(char c) {
    skipSpace();
    if (pos < text.length() && text.charAt(pos) == c) {
      pos++;
      return true;
    }
    return false;
  }

  private void expect(char c) throws FunctionCallException {
    if (!accept(c))
      throw error("expected '" + c + "'");
  }

  private FunctionCallException error(String message) { return new FunctionCallException(message + " in '" + text + "'"); }

  //// Transforms

  /** First letter of each run of letters upper case, the rest lower case. */
  static String title(String value) {
    StringBuilder result = new StringBuilder(value.length());
    boolean inWord = false;
    for (int i = 0; i < value.length(); ++i) {
      char c = value.charAt(i);
      if (Character.isLetter(c)) {
        result.append(inWord ? Character.toLowerCase(c) : Character.toUpperCase(c));
        inWord = true;
      } else {
        result.append(c);
        inWord = false;
      }
    }
    return result.toString();
  }

  static String capitalize(String value) {
    if (value.isEmpty())
      return value;
    return Character.toUpperCase(value.charAt(0)) + value.substring(1).toLowerCase(Locale.ROOT);
  }

  private static String replace(List<String> args) throws FunctionCallException {
    String value = args.get(0);
    String target = args.get(1);
    String replacement = args.get(2);
    int count = -1;
    if (args.size() > 3) {
      try {
        count = Integer.parseInt(args.get(3).strip());
      } catch (NumberFormatException e) {
        throw new FunctionCallException("replace() count must be an integer, got '" + args.get(3) + "'");
      }
    }
    if (count < 0)
      return value.replace(target, replacement);
    StringBuilder result = new StringBuilder();
    int start = 0;
    for (int done = 0; done < count; ++done) {
      int found = value.indexOf(target, start);
      if (found < 0)
        break;
      result.append(value, start, found).append(replacement);
      start = found + target.length();
      if (target.isEmpty()) {
        if (start >= value.length())
          break;
        result.append(value.charAt(start));
        start++;
      }
    }
    return result.append(value.substring(start)).toString();
  }

  /** Removes the given characters (whitespace if null) from either end. */
  static String strip(String value, String chars, boolean leading, boolean trailing) {
    int start = 0;
    int end = value.length();
    if (leading) {
      while (start < end && isStripped(value.charAt(start), chars))
        start++;
    }
    if (trailing) {
      while (end > start && isStripped(value.charAt(end - 1), chars))
        end--;
    }
    return value.substring(start, end);
  }

  private static boolean isStripped(char c, String chars) { return (chars == null) ? Character.isWhitespace(c) : chars.indexOf(c) >= 0; }
}
