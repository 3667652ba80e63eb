package vcg.ast;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Packed range <code>[msb:lsb]</code> of a port, kept as text plus whatever could be folded to integers.
 * The width expression is always derived from the two bounds by {@link #simplify(String, String)}.
 */
public final class RangeExpression {
  private static final Pattern MINUS_ONE = Pattern.compile("^(.+?)\\s*-\\s*1$");
  private static final Pattern DECIMAL = Pattern.compile("\\d+");

  private final String msbExpr;
  private final String lsbExpr;
  private final Long msbValue;
  private final Long lsbValue;
  private final String widthExpr;
  private final Long widthValue;

  private RangeExpression(String msbExpr, String lsbExpr, Long msbValue, Long lsbValue, String widthExpr, Long widthValue) {
    this.msbExpr = msbExpr;
    this.lsbExpr = lsbExpr;
    this.msbValue = msbValue;
    this.lsbValue = lsbValue;
    this.widthExpr = widthExpr;
    this.widthValue = widthValue;
  }

  /**
   * Builds the range for the given bound expressions.
   * Literal-only arithmetic in a bound (<code>8-1</code>) is folded and replaces the bound text.
   * @param msbExpr most significant bound, as flattened expression text
   * @param lsbExpr least significant bound, as flattened expression text
   */
  public static RangeExpression simplify(String msbExpr, String lsbExpr) {
    String msb = Objects.requireNonNull(msbExpr, "msbExpr").strip();
    String lsb = Objects.requireNonNull(lsbExpr, "lsbExpr").strip();

    Long msbValue = ConstantFolder.literalValue(msb).orElse(null);
    if (msbValue == null) {
      Optional<Long> folded = ConstantFolder.evaluateArithmetic(msb);
      if (folded.isPresent()) {
        msbValue = folded.get();
        msb = String.valueOf(msbValue);
      }
    }
    Long lsbValue = ConstantFolder.literalValue(lsb).orElse(null);
    if (lsbValue == null) {
      Optional<Long> folded = ConstantFolder.evaluateArithmetic(lsb);
      if (folded.isPresent()) {
        lsbValue = folded.get();
        lsb = String.valueOf(lsbValue);
      }
    }

    Long widthValue = null;
    if (msbValue != null && lsbValue != null)
      widthValue = Math.abs(msbValue - lsbValue) + 1;
    return new RangeExpression(msb, lsb, msbValue, lsbValue, deriveWidth(msb, lsb, widthValue), widthValue);
  }

  private static String deriveWidth(String msb, String lsb, Long widthValue) {
    if (msb.equals(lsb))
      return "1";
    if (lsb.equals("0")) {
      if (DECIMAL.matcher(msb).matches())
        return new BigInteger(msb).add(BigInteger.ONE).toString();
      Matcher minusOne = MINUS_ONE.matcher(msb);
      if (minusOne.matches())
        return stripOuterParens(minusOne.group(1).strip());
      return msb + "+1";
    }
    if (widthValue != null)
      return String.valueOf(widthValue);
    return "(" + msb + "-" + lsb + "+1)";
  }

  /** Removes one layer of parentheses, only if the opening one is closed by the last character. */
  static String stripOuterParens(String expr) {
    if (expr.length() < 2 || expr.charAt(0) != '(' || expr.charAt(expr.length() - 1) != ')')
      return expr;
    int depth = 0;
    for (int i = 0; i < expr.length(); ++i) {
      char c = expr.charAt(i);
      if (c == '(')
        depth++;
      else if (c == ')') {
        depth--;
        if (depth == 0 && i != expr.length() - 1)
          return expr;
      }
    }
    return expr.substring(1, expr.length() - 1);
  }

  public String getMsbExpr() { return msbExpr; }
  public String getLsbExpr() { return lsbExpr; }
  public Optional<Long> getMsbValue() { return Optional.ofNullable(msbValue); }
  public Optional<Long> getLsbValue() { return Optional.ofNullable(lsbValue); }
  public String getWidthExpr() { return widthExpr; }
  public Optional<Long> getWidthValue() { return Optional.ofNullable(widthValue); }

  public boolean isSingleBit() {
    return msbExpr.equals(lsbExpr) || (msbValue != null && lsbValue != null && msbValue.longValue() == lsbValue.longValue());
  }

  public boolean isParametric() { return msbValue == null || lsbValue == null; }

  /** The range as written in a declaration, e.g. <code>[WIDTH-1:0]</code>. */
  public String toDeclarationString() { return "[" + msbExpr + ":" + lsbExpr + "]"; }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    RangeExpression other = (RangeExpression)obj;
    return msbExpr.equals(other.msbExpr) && lsbExpr.equals(other.lsbExpr);
  }

  @Override
  public int hashCode() {
    return Objects.hash(msbExpr, lsbExpr);
  }

  @Override
  public String toString() {
    return toDeclarationString() + " width " + widthExpr;
  }
}
