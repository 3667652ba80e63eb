package vcg.ast;

import java.util.Optional;
import java.util.stream.Stream;

public enum PortDirection {
  Input("input"),
  Output("output"),
  Inout("inout");

  public final String serialName;

  private PortDirection(String serialName) { this.serialName = serialName; }

  /** Case-insensitive lookup by the Verilog keyword spelling. */
  public static Optional<PortDirection> fromSerialName(String serialName) {
    if (serialName == null)
      return Optional.empty();
    return Stream.of(PortDirection.values()).filter(dirVal -> dirVal.serialName.equalsIgnoreCase(serialName.trim())).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
