package vcg.rules;

import java.util.Optional;

/**
 * Wire declaration rule.
 * @param port port name pattern
 * @param wire wire name target with comments replaced by placeholders
 * @param width width override, or null to use the port's
 * @param expression assigned expression target, or null
 */
public record WireRule(WildcardPattern port, InlineComments.Extracted wire, String width, InlineComments.Extracted expression, int index) {
  public Optional<String> getWidth() { return Optional.ofNullable(width); }

  @Override
  public String toString() {
    return "#" + index + " '" + port + "' -> '" + InlineComments.restore(wire.text(), wire.comments()) + "'" +
        (width != null ? " width " + width : "") +
        (expression != null ? " = " + InlineComments.restore(expression.text(), expression.comments()) : "");
  }
}
