package vcg.frontend;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.ast.AstArena;
import vcg.ast.DesignUnit;
import vcg.ast.ModuleBuilder;
import vcg.ast.ModuleDeclaration;
import vcg.ast.NetKind;
import vcg.ast.ParameterKind;
import vcg.ast.PortDirection;
import vcg.ast.RangeExpression;

/**
 * Recursive-descent parser for a single module declaration.
 * <p>
 * Parameters and ports are turned into AST nodes; other module items (continuous assignments, always blocks,
 * instantiations) are parsed only to be skipped. Expressions are flattened back to text.
 * <p>
 * On a malformed construct, an error is recorded and tokens are discarded up to the next list or statement
 * terminator (or a module/endmodule keyword); parsing then resumes. A parser instance handles one input.
 */
public class VerilogParser {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Raised inside the parser to unwind to the nearest recovery point. */
  private static class SyntaxError extends Exception {
    private static final long serialVersionUID = 1L;
    final Token token;

    SyntaxError(Token token, String message) {
      super(message);
      this.token = token;
    }
  }

  /** Binary operator precedence, lowest first. The conditional operator sits below all of these. */
  private static int binaryPrecedence(TokenKind kind) {
    return switch (kind) {
      case LogicalOr -> 1;
      case LogicalAnd -> 2;
      case Or -> 3;
      case Xor, Xnor -> 4;
      case And -> 5;
      case Equal, NotEqual -> 6;
      case Less, Greater, LessEqual, GreaterEqual -> 7;
      case ShiftLeft, ShiftRight -> 8;
      case Plus, Minus -> 9;
      case Times, Divide, Mod -> 10;
      case Power -> 11;
      default -> -1;
    };
  }

  private static final Set<TokenKind> listSync =
      EnumSet.of(TokenKind.Comma, TokenKind.RParen, TokenKind.Semicolon, TokenKind.Endmodule, TokenKind.Module);
  private static final Set<TokenKind> itemSync = EnumSet.of(TokenKind.Semicolon, TokenKind.Endmodule, TokenKind.Module);

  private final VerilogLexer lexer;
  private final ParseContext context;
  private Token current;
  private boolean used = false;

  public VerilogParser(String text, ParseContext context) {
    this.context = context;
    this.lexer = new VerilogLexer(text, context);
  }

  public ParseContext getContext() { return context; }

  /**
   * Parses the input. Never throws on malformed input.
   */
  public ParseResult parse() {
    if (used)
      throw new IllegalStateException("VerilogParser instances are single-use");
    used = true;
    current = lexer.next();

    AstArena arena = new AstArena();
    DesignUnit unit = new DesignUnit(arena);
    int unitIndex = arena.add(unit, -1);

    if (current.kind() != TokenKind.Module && current.kind() != TokenKind.EndOfInput) {
      Token first = current;
      while (current.kind() != TokenKind.Module && current.kind() != TokenKind.EndOfInput)
        advance();
      context.warning(first.line(), first.column(), "Skipped text before the module declaration");
    }
    if (current.kind() == TokenKind.Module) {
      parseModule(arena, unitIndex);
      if (current.kind() != TokenKind.EndOfInput)
        context.warning(current.line(), current.column(), "Ignoring text after the first module declaration");
    }

    if (context.getErrorCount() > 0)
      logger.warn("Parsing {} completed with {} errors", context.getSourceName(), context.getErrorCount());
    return new ParseResult(unit, context.getErrorCount(), context.getDiagnostics());
  }

  //// Module structure

  private void parseModule(AstArena arena, int unitIndex) {
    Token moduleToken = current;
    advance();
    if (current.kind() != TokenKind.Identifier) {
      reportError(new SyntaxError(current, "Invalid module declaration: expected module name"));
      recover(EnumSet.of(TokenKind.Endmodule));
      if (current.kind() == TokenKind.Endmodule)
        advance();
      return;
    }
    ModuleBuilder builder = new ModuleBuilder(arena, unitIndex, current.text(), moduleToken.line());
    logger.debug("Parsing module {}", current.text());
    advance();

    if (current.kind() == TokenKind.Hash)
      parseParameterList(builder);
    if (current.kind() == TokenKind.LParen)
      parsePortList(builder);

    if (current.kind() == TokenKind.Semicolon) {
      advance();
    } else {
      reportError(new SyntaxError(current, "Invalid module declaration: expected ';' after the port list"));
      recover(itemSync);
      if (current.kind() == TokenKind.Semicolon)
        advance();
    }

    while (current.kind() != TokenKind.Endmodule) {
      if (current.kind() == TokenKind.EndOfInput || current.kind() == TokenKind.Module) {
        reportError(new SyntaxError(current, "Missing endmodule for module '" + builder.getModuleName() + "'"));
        break;
      }
      try {
        parseModuleItem(builder);
      } catch (SyntaxError e) {
        reportError(e);
        recover(itemSync);
        if (current.kind() == TokenKind.Semicolon)
          advance();
      }
    }
    if (current.kind() == TokenKind.Endmodule)
      advance();

    ModuleDeclaration module = builder.finish();
    for (String warning : builder.getWarnings())
      context.warning(0, 0, "Port declaration: " + warning);
    logger.debug("Module {}: {} parameters, {} ports", module.getName(), module.getParameters().size(), module.getPorts().size());
  }

  /** <code>#( [parameter|localparam] [type] NAME = expr, ... )</code>; entries without a keyword inherit the previous kind. */
  private void parseParameterList(ModuleBuilder builder) {
    advance();
    if (current.kind() != TokenKind.LParen) {
      reportError(new SyntaxError(current, "Invalid parameter list: expected '('"));
      return;
    }
    advance();
    if (accept(TokenKind.RParen))
      return;
    ParameterKind kind = ParameterKind.Parameter;
    boolean more = true;
    while (more) {
      boolean failed = false;
      try {
        if (current.kind() == TokenKind.Parameter || current.kind() == TokenKind.Localparam) {
          kind = ParameterKind.fromSerialName(current.text()).orElseThrow();
          advance();
        }
        String dataType = parseOptionalDataType();
        Token name = expect(TokenKind.Identifier, "Invalid parameter declaration: expected a parameter name");
        expect(TokenKind.Assignment, "Invalid parameter assignment: expected '='");
        String value = parseExpression();
        builder.addHeaderParameter(name.text(), kind, value, dataType, name.line());
      } catch (SyntaxError e) {
        reportError(e);
        recover(listSync);
        failed = true;
      }
      more = continueList("parameter list", failed);
    }
  }

  /** <code>( [direction] [net kind] [range] name, ... )</code>, also accepts <code>()</code>. */
  private void parsePortList(ModuleBuilder builder) {
    advance();
    if (accept(TokenKind.RParen))
      return;
    boolean more = true;
    while (more) {
      boolean failed = false;
      try {
        parsePortListEntry(builder);
      } catch (SyntaxError e) {
        reportError(e);
        recover(listSync);
        failed = true;
      }
      more = continueList("port list", failed);
    }
  }

  /**
   * Consumes the separator after a list entry.
   * @param entryFailed the entry already reported an error and recovered
   * @return true if another entry follows, false if the list is done
   */
  private boolean continueList(String listName, boolean entryFailed) {
    if (accept(TokenKind.Comma))
      return true;
    if (accept(TokenKind.RParen))
      return false;
    if (!entryFailed) {
      reportError(new SyntaxError(current, "Invalid " + listName + ": expected ',' or ')'"));
      recover(listSync);
      if (accept(TokenKind.Comma))
        return true;
      accept(TokenKind.RParen);
    }
    return false;
  }

  private void parsePortListEntry(ModuleBuilder builder) throws SyntaxError {
    PortDirection direction = null;
    if (current.kind().isDirection()) {
      direction = PortDirection.fromSerialName(current.text()).orElseThrow();
      advance();
    }
    NetKind netKind = parseOptionalNetKind();
    skipSignedness();
    RangeExpression range = (current.kind() == TokenKind.LBracket) ? parseRange() : null;
    Token name = expect(TokenKind.Identifier, "Invalid port declaration: expected a port name");
    builder.declareHeaderPort(name.text(), direction, netKind, range, name.line());
  }

  //// Module items

  private void parseModuleItem(ModuleBuilder builder) throws SyntaxError {
    switch (current.kind()) {
    case Input:
    case Output:
    case Inout:
      parseBodyPortDeclaration(builder);
      break;
    case Wire:
    case Reg:
    case Logic:
      parseBodyNetDeclaration(builder);
      break;
    case Parameter:
    case Localparam:
      parseBodyParameterDeclaration(builder);
      break;
    case Assign:
      skipAssignment();
      break;
    case Always:
      skipAlwaysBlock();
      break;
    case Identifier:
      skipInstantiation();
      break;
    default:
      throw new SyntaxError(current, "Unexpected module item");
    }
  }

  /** <code>input [net kind] [range] a, b;</code> */
  private void parseBodyPortDeclaration(ModuleBuilder builder) throws SyntaxError {
    PortDirection direction = PortDirection.fromSerialName(current.text()).orElseThrow();
    advance();
    NetKind netKind = parseOptionalNetKind();
    skipSignedness();
    RangeExpression range = (current.kind() == TokenKind.LBracket) ? parseRange() : null;
    do {
      Token name = expect(TokenKind.Identifier, "Invalid " + direction + " declaration: expected a port name");
      builder.declareBodyPort(name.text(), direction, netKind, range, name.line());
    } while (accept(TokenKind.Comma));
    expect(TokenKind.Semicolon, "Invalid " + direction + " declaration: expected ';'");
  }

  /** <code>wire [range] a [= expr], b;</code>; only affects names that are ports. */
  private void parseBodyNetDeclaration(ModuleBuilder builder) throws SyntaxError {
    NetKind netKind = NetKind.fromSerialName(current.text()).orElseThrow();
    advance();
    skipSignedness();
    RangeExpression range = (current.kind() == TokenKind.LBracket) ? parseRange() : null;
    do {
      Token name = expect(TokenKind.Identifier, "Invalid " + netKind + " declaration: expected a name");
      while (current.kind() == TokenKind.LBracket) {
        // unpacked dimension
        advance();
        parseExpression();
        if (accept(TokenKind.Colon))
          parseExpression();
        expect(TokenKind.RBracket, "Invalid unpacked dimension: expected ']'");
      }
      if (accept(TokenKind.Assignment))
        parseExpression();
      builder.declareBodyNet(name.text(), netKind, range, name.line());
    } while (accept(TokenKind.Comma));
    expect(TokenKind.Semicolon, "Invalid " + netKind + " declaration: expected ';'");
  }

  /** <code>parameter [type] A = 1, B = 2;</code> */
  private void parseBodyParameterDeclaration(ModuleBuilder builder) throws SyntaxError {
    ParameterKind kind = ParameterKind.fromSerialName(current.text()).orElseThrow();
    advance();
    String dataType = parseOptionalDataType();
    do {
      Token name = expect(TokenKind.Identifier, "Invalid " + kind + " declaration: expected a parameter name");
      expect(TokenKind.Assignment, "Invalid parameter assignment: expected '='");
      String value = parseExpression();
      builder.addBodyParameter(name.text(), kind, value, dataType, name.line());
    } while (accept(TokenKind.Comma));
    expect(TokenKind.Semicolon, "Invalid " + kind + " declaration: expected ';'");
  }

  /** <code>assign lhs = expr, ...;</code> */
  private void skipAssignment() throws SyntaxError {
    advance();
    do {
      parseExpression();
      expect(TokenKind.Assignment, "Invalid assignment: expected '='");
      parseExpression();
    } while (accept(TokenKind.Comma));
    expect(TokenKind.Semicolon, "Invalid assignment: expected ';'");
  }

  /** <code>always [@ event] statement</code>; the statement is skipped by its block structure. */
  private void skipAlwaysBlock() throws SyntaxError {
    advance();
    if (accept(TokenKind.At)) {
      if (current.kind() == TokenKind.LParen)
        skipBalanced(TokenKind.LParen, TokenKind.RParen);
      else if (current.kind() == TokenKind.Times || current.kind() == TokenKind.Identifier)
        advance();
      else
        throw new SyntaxError(current, "Invalid always block: expected an event control");
    }
    skipStatement();
  }

  private void skipStatement() throws SyntaxError {
    if (current.kind() == TokenKind.Begin) {
      int depth = 0;
      do {
        if (current.kind() == TokenKind.Begin)
          depth++;
        else if (current.kind() == TokenKind.End)
          depth--;
        else if (current.kind() == TokenKind.Endmodule || current.kind() == TokenKind.EndOfInput)
          throw new SyntaxError(current, "Unterminated begin block");
        advance();
      } while (depth > 0);
    } else {
      while (current.kind() != TokenKind.Semicolon) {
        if (current.kind() == TokenKind.Endmodule || current.kind() == TokenKind.EndOfInput || current.kind() == TokenKind.Begin)
          break;
        advance();
      }
      if (current.kind() == TokenKind.Begin) {
        skipStatement();
      } else {
        expect(TokenKind.Semicolon, "Invalid statement: expected ';'");
      }
    }
    // else-branch of a block-less if statement
    if (current.kind() == TokenKind.Identifier && current.text().equals("else")) {
      advance();
      skipStatement();
    }
  }

  /**
   * <code>type [#(...)] name (...);</code> for module instances, <code>type a, b;</code> for declarations of
   * other variable types, <code>keyword begin ... end</code> for procedural blocks.
   */
  private void skipInstantiation() throws SyntaxError {
    Token type = current;
    advance();
    if (current.kind() == TokenKind.Begin) {
      // initial/final style blocks
      skipStatement();
      return;
    }
    if (current.kind() == TokenKind.Hash) {
      advance();
      skipBalanced(TokenKind.LParen, TokenKind.RParen);
    }
    if (current.kind() == TokenKind.LBracket)
      parseRange();
    expect(TokenKind.Identifier, "Invalid module item starting with '" + type.text() + "'");
    if (current.kind() == TokenKind.LParen) {
      skipBalanced(TokenKind.LParen, TokenKind.RParen);
    } else {
      while (current.kind() != TokenKind.Semicolon && !itemSync.contains(current.kind()))
        advance();
    }
    expect(TokenKind.Semicolon, "Invalid instantiation: expected ';'");
  }

  private void skipBalanced(TokenKind open, TokenKind close) throws SyntaxError {
    expect(open, "Expected '" + open.spelling + "'");
    int depth = 1;
    while (depth > 0) {
      if (current.kind() == TokenKind.EndOfInput || current.kind() == TokenKind.Endmodule)
        throw new SyntaxError(current, "Missing '" + close.spelling + "'");
      if (current.kind() == open)
        depth++;
      else if (current.kind() == close)
        depth--;
      advance();
    }
  }

  //// Declaration parts

  private NetKind parseOptionalNetKind() {
    if (!current.kind().isNetKind())
      return null;
    NetKind netKind = NetKind.fromSerialName(current.text()).orElseThrow();
    advance();
    return netKind;
  }

  private void skipSignedness() {
    if (current.kind() == TokenKind.Identifier && (current.text().equals("signed") || current.text().equals("unsigned")))
      advance();
  }

  /**
   * Type words and packed ranges between the parameter keyword and the name, e.g. <code>integer</code> or
   * <code>logic [7:0]</code>. Returns null if there are none.
   */
  private String parseOptionalDataType() throws SyntaxError {
    List<String> parts = new ArrayList<>();
    while (true) {
      if (current.kind() == TokenKind.Identifier &&
          (lexer.peek().kind() == TokenKind.Identifier || lexer.peek().kind() == TokenKind.LBracket)) {
        parts.add(current.text());
        advance();
      } else if (current.kind().isNetKind()) {
        parts.add(current.text());
        advance();
      } else if (current.kind() == TokenKind.LBracket) {
        parts.add(parseRange().toDeclarationString());
      } else {
        break;
      }
    }
    return parts.isEmpty() ? null : String.join(" ", parts);
  }

  /** <code>[msb:lsb]</code> */
  private RangeExpression parseRange() throws SyntaxError {
    expect(TokenKind.LBracket, "Invalid packed dimension: expected '['");
    String msb = parseExpression();
    expect(TokenKind.Colon, "Invalid packed dimension: expected ':'");
    String lsb = parseExpression();
    expect(TokenKind.RBracket, "Invalid packed dimension: expected ']'");
    return RangeExpression.simplify(msb, lsb);
  }

  //// Expressions, flattened to text

  private String parseExpression() throws SyntaxError {
    String condition = parseBinary(1);
    if (!accept(TokenKind.Question))
      return condition;
    String whenTrue = parseExpression();
    expect(TokenKind.Colon, "Invalid conditional expression: expected ':'");
    String whenFalse = parseExpression();
    return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
  }

  private String parseBinary(int minPrecedence) throws SyntaxError {
    String left = parseUnary();
    while (true) {
      int precedence = binaryPrecedence(current.kind());
      if (precedence < minPrecedence)
        return left;
      Token op = current;
      advance();
      // ** is right-associative, everything else left-associative
      String right = parseBinary(op.kind() == TokenKind.Power ? precedence : precedence + 1);
      left = left + op.text() + right;
    }
  }

  private String parseUnary() throws SyntaxError {
    switch (current.kind()) {
    case Plus:
    case Minus:
    case Not:
    case LogicalNot:
    case And:
    case Or:
    case Xor:
      Token op = current;
      advance();
      return op.text() + parseUnary();
    default:
      return parsePrimary();
    }
  }

  private String parsePrimary() throws SyntaxError {
    Token token = current;
    if (token.kind().isNumber()) {
      advance();
      return token.text();
    }
    switch (token.kind()) {
    case StringLiteral:
      advance();
      return "\"" + token.text() + "\"";
    case LParen: {
      advance();
      String inner = parseExpression();
      expect(TokenKind.RParen, "Expected ')'");
      return "(" + inner + ")";
    }
    case LBrace:
      return parseConcatenation();
    case Identifier: {
      advance();
      StringBuilder text = new StringBuilder(token.text());
      if (accept(TokenKind.LParen)) {
        text.append("(").append(current.kind() == TokenKind.RParen ? "" : parseExpressionList()).append(")");
        expect(TokenKind.RParen, "Invalid function call: expected ')'");
      }
      while (accept(TokenKind.LBracket)) {
        String index = parseExpression();
        if (accept(TokenKind.Colon))
          index = index + ":" + parseExpression();
        expect(TokenKind.RBracket, "Invalid bit selection: expected ']'");
        text.append("[").append(index).append("]");
      }
      return text.toString();
    }
    default:
      throw new SyntaxError(token, "Expected an expression");
    }
  }

  /** <code>{a, b}</code> or the replication <code>{N{a, b}}</code> */
  private String parseConcatenation() throws SyntaxError {
    expect(TokenKind.LBrace, "Expected '{'");
    String first = parseExpression();
    String result;
    if (current.kind() == TokenKind.LBrace) {
      advance();
      String replicated = parseExpressionList();
      expect(TokenKind.RBrace, "Invalid replication: expected '}'");
      result = "{" + first + "{" + replicated + "}}";
    } else {
      StringBuilder text = new StringBuilder("{").append(first);
      while (accept(TokenKind.Comma))
        text.append(", ").append(parseExpression());
      result = text.append("}").toString();
    }
    expect(TokenKind.RBrace, "Invalid concatenation: expected '}'");
    return result;
  }

  private String parseExpressionList() throws SyntaxError {
    StringBuilder text = new StringBuilder(parseExpression());
    while (accept(TokenKind.Comma))
      text.append(", ").append(parseExpression());
    return text.toString();
  }

  //// Token handling

  private void advance() {
    if (current != null && current.kind() == TokenKind.EndOfInput)
      return;
    current = lexer.next();
  }

  private boolean accept(TokenKind kind) {
    if (current.kind() != kind)
      return false;
    advance();
    return true;
  }

  private Token expect(TokenKind kind, String message) throws SyntaxError {
    Token token = current;
    if (token.kind() != kind)
      throw new SyntaxError(token, message);
    advance();
    return token;
  }

  private void reportError(SyntaxError error) {
    Token token = error.token;
    String found = (token.kind() == TokenKind.EndOfInput) ? "EOF" : token.kind() + "('" + token.text() + "')";
    context.error(token.line(), token.column(), "Syntax error at token " + found + " at line " + token.line() + ": " + error.getMessage());
  }

  /**
   * Discards tokens until one of the given kinds is current. Commas and closing parentheses only
   * count outside of nested parentheses, brackets and braces.
   */
  private void recover(Set<TokenKind> syncKinds) {
    int depth = 0;
    while (current.kind() != TokenKind.EndOfInput) {
      TokenKind kind = current.kind();
      boolean nestable = kind == TokenKind.Comma || kind == TokenKind.RParen;
      if (syncKinds.contains(kind) && (depth == 0 || !nestable))
        return;
      if (kind == TokenKind.LParen || kind == TokenKind.LBracket || kind == TokenKind.LBrace)
        depth++;
      else if ((kind == TokenKind.RParen || kind == TokenKind.RBracket || kind == TokenKind.RBrace) && depth > 0)
        depth--;
      advance();
    }
  }
}
