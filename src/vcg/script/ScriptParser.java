package vcg.script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Reads a generator script into a list of calls.
 * <p>
 * A script is a sequence of calls {@code Name(arg, ..., key=arg, ...)}, one per line. A call may span lines while
 * its parentheses are open. Arguments are quoted strings (single or double quotes, adjacent literals and {@code +}
 * concatenate), integers, {@code True}/{@code False} and {@code None}. {@code #} starts a comment.
 * Nothing else is accepted; scripts are never evaluated as general code.
 */
public class ScriptParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private enum Kind { Name, Str, Number, LParen, RParen, Comma, Assign, Plus, Newline, End }

  private record Tok(Kind kind, String text, int line) {}

  private final String text;
  private int pos = 0;
  private int line = 1;
  private int depth = 0;
  private Tok current;

  public ScriptParser(String text) { this.text = (text == null) ? "" : text; }

  /**
   * @throws VCGScriptException on the first malformed statement
   */
  public List<ScriptCall> parse() throws VCGScriptException {
    List<ScriptCall> calls = new ArrayList<>();
    advance();
    while (current.kind != Kind.End) {
      if (current.kind == Kind.Newline) {
        advance();
        continue;
      }
      calls.add(parseCall());
      if (current.kind != Kind.Newline && current.kind != Kind.End)
        throw syntax("expected end of statement, found '" + current.text + "'");
    }
    logger.trace("Parsed {} generator statements", calls.size());
    return calls;
  }

  private ScriptCall parseCall() throws VCGScriptException {
    Tok name = expect(Kind.Name, "a function name");
    expect(Kind.LParen, "'('");
    List<String> positional = new ArrayList<>();
    Map<String, String> keywords = new LinkedHashMap<>();
    while (current.kind != Kind.RParen) {
      if (current.kind == Kind.Name && peekAssign()) {
        String keyword = current.text;
        advance();
        advance();
        if (keywords.containsKey(keyword))
          throw syntax("keyword argument repeated: " + keyword);
        keywords.put(keyword, parseValue());
      } else {
        if (!keywords.isEmpty())
          throw syntax("positional argument follows keyword argument");
        positional.add(parseValue());
      }
      if (current.kind == Kind.Comma)
        advance();
      else if (current.kind != Kind.RParen)
        throw syntax("expected ',' or ')', found '" + current.text + "'");
    }
    advance();
    return new ScriptCall(name.text, positional, keywords, name.line);
  }

  private String parseValue() throws VCGScriptException {
    Tok first = current;
    String value = parseTerm();
    while (current.kind == Kind.Plus) {
      advance();
      String next = parseTerm();
      if (value == null || next == null || first.kind != Kind.Str)
        throw syntax("'+' is only supported between strings");
      value = value + next;
    }
    return value;
  }

  private String parseTerm() throws VCGScriptException {
    switch (current.kind) {
    case Str: {
      StringBuilder value = new StringBuilder(current.text);
      advance();
      while (current.kind == Kind.Str) {
        value.append(current.text);
        advance();
      }
      return value.toString();
    }
    case Number: {
      String value = current.text;
      advance();
      return value;
    }
    case Name:
      if (current.text.equals("None") || current.text.equals("True") || current.text.equals("False")) {
        String value = current.text.equals("None") ? null : current.text;
        advance();
        return value;
      }
      throw syntax("variables are not supported: " + current.text);
    default:
      throw syntax("expected an argument value, found '" + current.text + "'");
    }
  }

  private Tok expect(Kind kind, String what) throws VCGScriptException {
    if (current.kind != kind)
      throw syntax("expected " + what + ", found '" + current.text + "'");
    Tok tok = current;
    advance();
    return tok;
  }

  private VCGScriptException syntax(String message) {
    return new VCGScriptException("Syntax error at line " + current.line + ": " + message);
  }

  //// Tokens

  private boolean peekAssign() {
    int i = pos;
    while (i < text.length() && (text.charAt(i) == ' ' || text.charAt(i) == '\t'))
      i++;
    return i < text.length() && text.charAt(i) == '=' && !text.startsWith("==", i);
  }

  private void advance() throws VCGScriptException { current = scan(); }

  private Tok scan() throws VCGScriptException {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '#') {
        while (pos < text.length() && text.charAt(pos) != '\n')
          pos++;
        continue;
      }
      if (c == '\\' && text.startsWith("\n", pos + 1)) {
        pos += 2;
        line++;
        continue;
      }
      if (c == '\n') {
        pos++;
        line++;
        if (depth == 0)
          return new Tok(Kind.Newline, "\\n", line - 1);
        continue;
      }
      if (Character.isWhitespace(c)) {
        pos++;
        continue;
      }
      if (Character.isLetter(c) || c == '_') {
        int start = pos;
        while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '_'))
          pos++;
        return new Tok(Kind.Name, text.substring(start, pos), line);
      }
      if (Character.isDigit(c) || (c == '-' && pos + 1 < text.length() && Character.isDigit(text.charAt(pos + 1)))) {
        int start = pos++;
        while (pos < text.length() && Character.isDigit(text.charAt(pos)))
          pos++;
        return new Tok(Kind.Number, text.substring(start, pos), line);
      }
      if (c == '"' || c == '\'')
        return scanString(c);
      pos++;
      switch (c) {
      case '(':
        depth++;
        return new Tok(Kind.LParen, "(", line);
      case ')':
        depth = Math.max(0, depth - 1);
        return new Tok(Kind.RParen, ")", line);
      case ',':
        return new Tok(Kind.Comma, ",", line);
      case '=':
        return new Tok(Kind.Assign, "=", line);
      case '+':
        return new Tok(Kind.Plus, "+", line);
      case ';':
        return new Tok(Kind.Newline, ";", line);
      default:
        throw new VCGScriptException("Syntax error at line " + line + ": unexpected character '" + c + "'");
      }
    }
    return new Tok(Kind.End, "end of script", line);
  }

  private Tok scanString(char quote) throws VCGScriptException {
    int startLine = line;
    StringBuilder value = new StringBuilder();
    int i = pos + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == quote) {
        pos = i + 1;
        return new Tok(Kind.Str, value.toString(), startLine);
      }
      if (c == '\n')
        break;
      if (c == '\\' && i + 1 < text.length()) {
        char escaped = text.charAt(i + 1);
        switch (escaped) {
        case 'n' -> value.append('\n');
        case 't' -> value.append('\t');
        case '\\' -> value.append('\\');
        case '\'' -> value.append('\'');
        case '"' -> value.append('"');
        default -> value.append('\\').append(escaped);
        }
        i += 2;
        continue;
      }
      value.append(c);
      i++;
    }
    throw new VCGScriptException("Syntax error at line " + startLine + ": unterminated string literal");
  }
}
