package vcg.signature;

import java.util.Optional;
import vcg.ast.ParameterDeclaration;
import vcg.ast.ParameterKind;

/**
 * Flattened view of one parameter.
 * @param defaultValue default value as expression text, empty if none
 * @param dataType declared data type or null
 */
public record ParameterInfo(String name, ParameterKind kind, String defaultValue, String dataType) {
  public static ParameterInfo of(ParameterDeclaration declaration) {
    return new ParameterInfo(declaration.getIdentifier(), declaration.getParameterKind(), declaration.getDefaultValue(),
                             declaration.getDataType().orElse(null));
  }

  /** localparams cannot be overridden from an instance. */
  public boolean isLocal() { return kind == ParameterKind.Localparam; }

  public Optional<String> getDataType() { return Optional.ofNullable(dataType); }

  @Override
  public String toString() {
    return kind + " " + name + " = " + defaultValue;
  }
}
