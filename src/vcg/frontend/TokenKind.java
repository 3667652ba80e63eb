package vcg.frontend;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

public enum TokenKind {
  // keywords
  Module("module"),
  Endmodule("endmodule"),
  Begin("begin"),
  End("end"),
  Input("input"),
  Inout("inout"),
  Output("output"),
  Reg("reg"),
  Logic("logic"),
  Wire("wire"),
  Parameter("parameter"),
  Localparam("localparam"),
  Assign("assign"),
  Always("always"),

  // operators
  Plus("+"),
  Minus("-"),
  Power("**"),
  Times("*"),
  Divide("/"),
  Mod("%"),
  Not("~"),
  Or("|"),
  And("&"),
  Xor("^"),
  Xnor("~^"),
  LogicalOr("||"),
  LogicalAnd("&&"),
  LogicalNot("!"),
  ShiftLeft("<<"),
  ShiftRight(">>"),
  Less("<"),
  Greater(">"),
  LessEqual("<="),
  GreaterEqual(">="),
  Equal("=="),
  NotEqual("!="),
  Question("?"),
  Assignment("="),

  // punctuation
  Comma(","),
  Colon(":"),
  Semicolon(";"),
  Hash("#"),
  At("@"),
  Dot("."),
  LParen("("),
  RParen(")"),
  LBracket("["),
  RBracket("]"),
  LBrace("{"),
  RBrace("}"),

  // literals and names
  Identifier(null),
  StringLiteral(null),
  DecNumber(null),
  HexNumber(null),
  OctNumber(null),
  BinNumber(null),

  EndOfInput(null);

  /** Fixed spelling for keywords, operators and punctuation; null for variable-text tokens. */
  public final String spelling;

  private TokenKind(String spelling) { this.spelling = spelling; }

  private static final Map<String, TokenKind> reservedWords;
  static {
    HashMap<String, TokenKind> words = new HashMap<>();
    for (TokenKind kind : values()) {
      if (kind.isKeyword())
        words.put(kind.spelling, kind);
    }
    reservedWords = Collections.unmodifiableMap(words);
  }

  /** Case-sensitive reserved-word table. */
  public static Map<String, TokenKind> getReservedWords() { return reservedWords; }

  public boolean isKeyword() { return ordinal() <= Always.ordinal(); }

  public boolean isNumber() { return this == DecNumber || this == HexNumber || this == OctNumber || this == BinNumber; }

  public boolean isDirection() { return this == Input || this == Output || this == Inout; }

  public boolean isNetKind() { return this == Wire || this == Reg || this == Logic; }
}
