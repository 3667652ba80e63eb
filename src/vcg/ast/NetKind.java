package vcg.ast;

import java.util.Optional;
import java.util.stream.Stream;

public enum NetKind {
  Wire("wire"),
  Reg("reg"),
  Logic("logic");

  public final String serialName;

  private NetKind(String serialName) { this.serialName = serialName; }
  public static Optional<NetKind> fromSerialName(String serialName) {
    return Stream.of(NetKind.values()).filter(kindVal -> kindVal.serialName.equals(serialName)).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
