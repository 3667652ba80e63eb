package vcg.ast;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Folds integer literals and literal-only arithmetic found in range bounds.
 * Anything that references a name (parameter, macro, function) is left alone.
 */
public class ConstantFolder {
  private static final Pattern DECIMAL = Pattern.compile("\\d+");
  private static final Pattern BASED = Pattern.compile("(\\d*)'([dDhHoObB])([0-9a-fA-F]+)");
  private static final Pattern ARITHMETIC = Pattern.compile("[\\d+\\-*/()\\s]+");

  private ConstantFolder() {}

  /**
   * Tests whether the text is a single integer literal, either plain decimal or with a radix marker
   * (<code>8'hFF</code>, <code>'d10</code>), and returns its value.
   */
  public static Optional<Long> literalValue(String text) {
    if (text == null)
      return Optional.empty();
    String literal = text.strip().replace("_", "");
    try {
      if (DECIMAL.matcher(literal).matches())
        return Optional.of(Long.parseLong(literal));
      Matcher based = BASED.matcher(literal);
      if (based.matches()) {
        int radix = switch (Character.toLowerCase(based.group(2).charAt(0))) {
          case 'h' -> 16;
          case 'o' -> 8;
          case 'b' -> 2;
          default -> 10;
        };
        return Optional.of(Long.parseLong(based.group(3), radix));
      }
    } catch (NumberFormatException e) {
      // digits outside the radix or too wide for a long; not foldable
    }
    return Optional.empty();
  }

  public static boolean isLiteral(String text) { return literalValue(text).isPresent(); }

  /**
   * Evaluates an expression built only from decimal literals, <code>+ - * /</code> and parentheses.
   * Division truncates. Returns empty for anything else, including division by zero.
   */
  public static Optional<Long> evaluateArithmetic(String text) {
    if (text == null || !ARITHMETIC.matcher(text).matches())
      return Optional.empty();
    Evaluator evaluator = new Evaluator(text.replaceAll("\\s+", ""));
    try {
      long value = evaluator.parseSum();
      if (evaluator.pos != evaluator.text.length())
        return Optional.empty();
      return Optional.of(value);
    } catch (ArithmeticException | IllegalStateException | NumberFormatException e) {
      return Optional.empty();
    }
  }

  /** Literal value if the text is a literal, otherwise the value of literal-only arithmetic. */
  public static Optional<Long> fold(String text) {
    Optional<Long> literal = literalValue(text);
    if (literal.isPresent())
      return literal;
    return evaluateArithmetic(text);
  }

  private static class Evaluator {
    final String text;
    int pos = 0;

    Evaluator(String text) { this.text = text; }

    long parseSum() {
      long value = parseProduct();
      while (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
        char op = text.charAt(pos++);
        long rhs = parseProduct();
        value = (op == '+') ? value + rhs : value - rhs;
      }
      return value;
    }

    long parseProduct() {
      long value = parseUnary();
      while (pos < text.length() && (text.charAt(pos) == '*' || text.charAt(pos) == '/')) {
        char op = text.charAt(pos++);
        long rhs = parseUnary();
        value = (op == '*') ? value * rhs : value / rhs;
      }
      return value;
    }

    long parseUnary() {
      if (pos < text.length() && text.charAt(pos) == '-') {
        pos++;
        return -parseUnary();
      }
      if (pos < text.length() && text.charAt(pos) == '+') {
        pos++;
        return parseUnary();
      }
      return parseAtom();
    }

    long parseAtom() {
      if (pos < text.length() && text.charAt(pos) == '(') {
        pos++;
        long value = parseSum();
        if (pos >= text.length() || text.charAt(pos) != ')')
          throw new IllegalStateException("unbalanced parenthesis in " + text);
        pos++;
        return value;
      }
      int start = pos;
      while (pos < text.length() && Character.isDigit(text.charAt(pos)))
        pos++;
      if (start == pos)
        throw new IllegalStateException("expected a number at offset " + start + " in " + text);
      return Long.parseLong(text.substring(start, pos));
    }
  }
}
