package vcg.frontend;

/**
 * Lexical token. For literals, text is the processed value: digit separators stripped from numbers,
 * quotes removed and escapes resolved for strings.
 */
public record Token(TokenKind kind, String text, int line, int column) {
  @Override
  public String toString() {
    return kind + "('" + text + "') at " + line + ":" + column;
  }
}
