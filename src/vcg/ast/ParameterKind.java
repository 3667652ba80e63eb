package vcg.ast;

import java.util.Optional;
import java.util.stream.Stream;

public enum ParameterKind {
  Parameter("parameter"),
  Localparam("localparam");

  public final String serialName;

  private ParameterKind(String serialName) { this.serialName = serialName; }
  public static Optional<ParameterKind> fromSerialName(String serialName) {
    return Stream.of(ParameterKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
