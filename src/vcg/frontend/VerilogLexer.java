package vcg.frontend;

import java.util.Iterator;
import java.util.NoSuchElementException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Pull-based tokenizer for the reduced Verilog subset.
 * An instance is bound to one input; once {@link TokenKind#EndOfInput} has been produced, it stays exhausted.
 * Illegal characters are reported to the {@link ParseContext} and skipped one at a time.
 */
public class VerilogLexer implements Iterator<Token> {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Operators in match order: longer spellings first. */
  private static final TokenKind[] operators = {
      TokenKind.Power,     TokenKind.LogicalOr,  TokenKind.LogicalAnd, TokenKind.ShiftLeft,  TokenKind.ShiftRight, TokenKind.LessEqual,
      TokenKind.GreaterEqual, TokenKind.Equal,   TokenKind.NotEqual,   TokenKind.Xnor,       TokenKind.Plus,       TokenKind.Minus,
      TokenKind.Times,     TokenKind.Divide,     TokenKind.Mod,        TokenKind.Not,        TokenKind.Or,         TokenKind.And,
      TokenKind.Xor,       TokenKind.LogicalNot, TokenKind.Less,       TokenKind.Greater,    TokenKind.Question,   TokenKind.Assignment,
      TokenKind.Comma,     TokenKind.Colon,      TokenKind.Semicolon,  TokenKind.Hash,       TokenKind.At,         TokenKind.Dot,
      TokenKind.LParen,    TokenKind.RParen,     TokenKind.LBracket,   TokenKind.RBracket,   TokenKind.LBrace,     TokenKind.RBrace};

  private final String text;
  private final ParseContext context;
  private int pos = 0;
  private int line = 1;
  private int lineStart = 0;
  private Token lookahead = null;
  private boolean exhausted = false;

  public VerilogLexer(String text, ParseContext context) {
    this.text = (text == null) ? "" : text;
    this.context = context;
  }

  @Override
  public boolean hasNext() {
    return !exhausted;
  }

  /** Returns the next token without consuming it. */
  public Token peek() {
    if (lookahead == null)
      lookahead = scan();
    return lookahead;
  }

  @Override
  public Token next() {
    if (exhausted)
      throw new NoSuchElementException("Lexer input exhausted");
    Token token = peek();
    lookahead = null;
    if (token.kind() == TokenKind.EndOfInput)
      exhausted = true;
    return token;
  }

  private Token scan() {
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (c == '\n') {
        pos++;
        line++;
        lineStart = pos;
        continue;
      }
      if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
        pos++;
        continue;
      }
      if (text.startsWith("//", pos)) {
        while (pos < text.length() && text.charAt(pos) != '\n')
          pos++;
        continue;
      }
      if (text.startsWith("/*", pos)) {
        skipBlockComment();
        continue;
      }

      int column = pos - lineStart + 1;
      Token token;
      if (Character.isDigit(c) || (c == '\'' && pos + 1 < text.length() && isRadixChar(text.charAt(pos + 1))))
        token = scanNumber(column);
      else if (isIdentStart(c))
        token = scanIdentifier(column);
      else if (c == '"')
        token = scanString(column);
      else
        token = scanOperator(column);
      if (token != null)
        return token;
      reportIllegal(column, c);
      pos++;
    }
    return new Token(TokenKind.EndOfInput, "", line, pos - lineStart + 1);
  }

  private void skipBlockComment() {
    int end = text.indexOf("*/", pos + 2);
    int stop = (end < 0) ? text.length() : end + 2;
    for (int i = pos; i < stop; ++i) {
      if (text.charAt(i) == '\n') {
        line++;
        lineStart = i + 1;
      }
    }
    if (end < 0)
      context.warning(line, 0, "Unterminated block comment");
    pos = stop;
  }

  private static boolean isIdentStart(char c) { return Character.isLetter(c) || c == '_' || c == '`' || c == '$'; }
  private static boolean isIdentPart(char c) { return isIdentStart(c) || Character.isDigit(c); }
  private static boolean isRadixChar(char c) { return "hHoObBdD".indexOf(c) >= 0; }

  private Token scanIdentifier(int column) {
    int start = pos;
    while (pos < text.length() && isIdentPart(text.charAt(pos)))
      pos++;
    String word = text.substring(start, pos);
    TokenKind kind = TokenKind.getReservedWords().getOrDefault(word, TokenKind.Identifier);
    return new Token(kind, word, line, column);
  }

  /** Reads a run of digits valid for the radix, allowing '_' separators between them. */
  private int scanDigits(String digits) {
    int start = pos;
    while (pos < text.length()) {
      char c = text.charAt(pos);
      if (digits.indexOf(c) >= 0 || (c == '_' && pos > start))
        pos++;
      else
        break;
    }
    return pos - start;
  }

  private Token scanNumber(int column) {
    int start = pos;
    scanDigits("0123456789");
    if (pos + 1 < text.length() && text.charAt(pos) == '\'' && isRadixChar(text.charAt(pos + 1))) {
      char radix = Character.toLowerCase(text.charAt(pos + 1));
      int beforeRadix = pos;
      pos += 2;
      TokenKind kind;
      int count;
      switch (radix) {
      case 'h':
        kind = TokenKind.HexNumber;
        count = scanDigits("0123456789abcdefABCDEF");
        break;
      case 'o':
        kind = TokenKind.OctNumber;
        count = scanDigits("01234567");
        break;
      case 'b':
        kind = TokenKind.BinNumber;
        count = scanDigits("01");
        break;
      default:
        kind = TokenKind.DecNumber;
        count = scanDigits("0123456789");
        break;
      }
      if (count == 0) {
        // size prefix without value digits; emit the size alone and let the quote be reported
        pos = beforeRadix;
        if (pos == start)
          return null;
        return new Token(TokenKind.DecNumber, text.substring(start, pos).replace("_", ""), line, column);
      }
      return new Token(kind, text.substring(start, pos).replace("_", ""), line, column);
    }
    return new Token(TokenKind.DecNumber, text.substring(start, pos).replace("_", ""), line, column);
  }

  private Token scanString(int column) {
    StringBuilder value = new StringBuilder();
    int i = pos + 1;
    while (i < text.length()) {
      char c = text.charAt(i);
      if (c == '"') {
        pos = i + 1;
        return new Token(TokenKind.StringLiteral, value.toString(), line, column);
      }
      if (c == '\n')
        break;
      if (c == '\\' && i + 1 < text.length()) {
        char escaped = text.charAt(i + 1);
        switch (escaped) {
        case 'n' -> value.append('\n');
        case 't' -> value.append('\t');
        case '"' -> value.append('"');
        case '\\' -> value.append('\\');
        default -> value.append('\\').append(escaped);
        }
        i += 2;
        continue;
      }
      value.append(c);
      i++;
    }
    // unterminated, the quote itself is reported as illegal
    return null;
  }

  private void reportIllegal(int column, char c) {
    context.error(line, column, String.format("Lexical error at line %d, column %d: Illegal character '%c' (0x%02x)", line, column, c, (int)c));
  }

  private Token scanOperator(int column) {
    if (text.startsWith("^~", pos)) {
      pos += 2;
      return new Token(TokenKind.Xnor, "^~", line, column);
    }
    for (TokenKind kind : operators) {
      if (text.startsWith(kind.spelling, pos)) {
        pos += kind.spelling.length();
        return new Token(kind, kind.spelling, line, column);
      }
    }
    return null;
  }
}
