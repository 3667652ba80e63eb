package vcg.signature;

import java.math.BigInteger;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import vcg.ast.ConstantFolder;
import vcg.ast.NetKind;
import vcg.ast.PortDeclaration;
import vcg.ast.PortDirection;
import vcg.ast.RangeExpression;

/**
 * Flattened view of one port.
 * @param name port identifier
 * @param direction port direction; null if unknown, which lets the port pass any direction filter
 * @param netKind net kind, wire if not declared
 * @param range declared packed range, or null for a scalar or a port described only by its width
 * @param width width expression: "1" for scalars, the derived width of the range, or any width text
 */
public record PortInfo(String name, PortDirection direction, NetKind netKind, RangeExpression range, String width) {
  private static final Pattern DIGITS = Pattern.compile("\\d+");
  private static final Pattern PLUS_ONE = Pattern.compile("^(.+?)\\s*\\+\\s*1$");

  public PortInfo {
    if (name == null)
      throw new IllegalArgumentException("Port name must not be null");
    if (netKind == null)
      netKind = NetKind.Wire;
    if (width == null && range != null)
      width = range.getWidthExpr();
  }

  public static PortInfo of(PortDeclaration declaration) {
    RangeExpression range = declaration.getRange().orElse(null);
    return new PortInfo(declaration.getIdentifier(), declaration.getDirection(), declaration.getNetKind(), range,
                        range == null ? "1" : range.getWidthExpr());
  }

  /** A port described only by name, direction and width text. */
  public static PortInfo of(String name, PortDirection direction, String width) {
    return new PortInfo(name, direction, NetKind.Wire, null, width);
  }

  public Optional<PortDirection> getDirection() { return Optional.ofNullable(direction); }

  public Optional<RangeExpression> getRange() { return Optional.ofNullable(range); }

  /** Folded width, if known. */
  public Optional<Long> getWidthValue() {
    if (range != null)
      return range.getWidthValue();
    if (width != null && DIGITS.matcher(width.strip()).matches())
      return ConstantFolder.literalValue(width);
    return Optional.empty();
  }

  public boolean isSingleBit() {
    if (range != null)
      return range.isSingleBit();
    return getWidthValue().map(value -> value <= 1).orElse(width == null || width.isBlank());
  }

  public boolean isParametric() {
    if (range != null)
      return range.isParametric();
    return width != null && !width.isBlank() && getWidthValue().isEmpty();
  }

  /**
   * Packed range text for declarations and comments, empty for single-bit ports.
   * Uses the declared range when there is one, otherwise the form derived by {@link #rangeForWidth(String)}.
   */
  public String getRangeDescription() {
    if (range != null)
      return range.isSingleBit() ? "" : range.toDeclarationString();
    return rangeForWidth(width);
  }

  /**
   * <code>[N-1:0]</code> for a width N &gt; 1, <code>[X:0]</code> for a width <code>X+1</code>,
   * <code>[W-1:0]</code> otherwise. Empty for widths up to 1.
   */
  public static String rangeForWidth(String width) {
    if (width == null || width.isBlank())
      return "";
    String text = width.strip();
    if (DIGITS.matcher(text).matches()) {
      BigInteger value = new BigInteger(text);
      return (value.compareTo(BigInteger.ONE) <= 0) ? "" : "[" + value.subtract(BigInteger.ONE) + ":0]";
    }
    Matcher plusOne = PLUS_ONE.matcher(text);
    if (plusOne.matches()) {
      String base = plusOne.group(1).strip();
      if (base.startsWith("$") && base.contains("("))
        return "[" + base + ":0]";
      if (containsAny(base, "+-*/ "))
        return "[(" + base + "):0]";
      return "[" + base + ":0]";
    }
    if (containsAny(text, "+-*/()"))
      return "[(" + text + ")-1:0]";
    return "[" + text + "-1:0]";
  }

  static boolean containsAny(String text, String chars) {
    for (int i = 0; i < chars.length(); ++i) {
      if (text.indexOf(chars.charAt(i)) >= 0)
        return true;
    }
    return false;
  }

  @Override
  public String toString() {
    String range = getRangeDescription();
    return (direction == null ? "?" : direction.serialName) + " " + netKind + (range.isEmpty() ? "" : " " + range) + " " + name;
  }
}
