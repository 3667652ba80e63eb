package vcg.rules;

import java.util.Optional;
import vcg.signature.PortInfo;

/**
 * Expands a single binary digit to a constant as wide as a port.
 */
public final class WidthLiteral {
  /** Widest constant that is spelled out digit by digit; wider ones use a replication. */
  public static final long MAX_SPELLED_WIDTH = 4096;

  private static final String OPERATORS = "+-*/()";

  private WidthLiteral() {}

  /** True for the values that get expanded: exactly "0" or "1". */
  public static boolean isExpandable(String value) { return value.equals("0") || value.equals("1"); }

  /**
   * <code>1'b&lt;d&gt;</code> for widths up to 1, <code>N'b&lt;d...d&gt;</code> for a known width N,
   * a replication <code>{W{1'b&lt;d&gt;}}</code> for a symbolic width (parenthesised if it contains operators)
   * or a width above {@link #MAX_SPELLED_WIDTH}.
   */
  public static String expand(PortInfo port, String digit) {
    String width = (port == null) ? null : port.width();
    if (width == null || width.isBlank())
      return "1'b" + digit;
    width = width.strip();
    Optional<Long> bits = port.getWidthValue();
    if (bits.isPresent()) {
      if (bits.get() <= 1)
        return "1'b" + digit;
      if (bits.get() <= MAX_SPELLED_WIDTH)
        return bits.get() + "'b" + digit.repeat(bits.get().intValue());
      return "{" + bits.get() + "{1'b" + digit + "}}";
    }
    for (int i = 0; i < OPERATORS.length(); ++i) {
      if (width.indexOf(OPERATORS.charAt(i)) >= 0)
        return "{(" + width + "){1'b" + digit + "}}";
    }
    return "{" + width + "{1'b" + digit + "}}";
  }
}
