package vcg.ast;

import java.util.Optional;

public class ParameterDeclaration extends AstNode {
  private final String identifier;
  private final ParameterKind parameterKind;
  private final String defaultValue;
  private final String dataType;

  /**
   * @param defaultValue default value as expression text, empty if none was given
   * @param dataType declared data type (<code>integer</code>, <code>[7:0]</code>, ...) or null
   */
  public ParameterDeclaration(String identifier, ParameterKind parameterKind, String defaultValue, String dataType, int sourceLine) {
    super(sourceLine);
    this.identifier = identifier;
    this.parameterKind = parameterKind;
    this.defaultValue = defaultValue == null ? "" : defaultValue;
    this.dataType = dataType;
  }

  @Override
  public NodeKind getKind() {
    return NodeKind.ParameterDeclaration;
  }

  public String getIdentifier() { return identifier; }
  public ParameterKind getParameterKind() { return parameterKind; }
  public String getDefaultValue() { return defaultValue; }
  public Optional<String> getDataType() { return Optional.ofNullable(dataType); }

  @Override
  public String toString() {
    return parameterKind + " " + identifier + " = " + defaultValue;
  }
}
