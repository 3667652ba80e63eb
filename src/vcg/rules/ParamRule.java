package vcg.rules;

/**
 * Parameter override rule. The value is used verbatim.
 */
public record ParamRule(WildcardPattern name, String value, int index) {
  @Override
  public String toString() {
    return "#" + index + " " + name + " = " + value;
  }
}
