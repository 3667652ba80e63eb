package vcg.rules;

import java.util.Optional;
import vcg.ast.PortDirection;

/**
 * Port to signal connection rule.
 * @param source port name pattern
 * @param target target text with comments replaced by placeholders
 * @param direction only ports of this direction match; null for any
 * @param index insertion position among the signal rules
 */
public record SignalRule(WildcardPattern source, InlineComments.Extracted target, PortDirection direction, int index) {
  public Optional<PortDirection> getDirection() { return Optional.ofNullable(direction); }

  @Override
  public String toString() {
    return "#" + index + " '" + source + "' -> '" + InlineComments.restore(target.text(), target.comments()) + "'" +
        (direction != null ? " (" + direction + ")" : "");
  }
}
