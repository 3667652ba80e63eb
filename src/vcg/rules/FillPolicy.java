package vcg.rules;

import java.util.Optional;
import java.util.stream.Stream;

/** What wire generation does for a port that no wire rule matches. */
public enum FillPolicy {
  /** Declare a wire named after the port. */
  Greedy("greedy"),
  /** Declare nothing for the port. */
  Lazy("lazy");

  public final String serialName;

  private FillPolicy(String serialName) { this.serialName = serialName; }

  public static Optional<FillPolicy> fromSerialName(String serialName) {
    if (serialName == null)
      return Optional.empty();
    return Stream.of(FillPolicy.values()).filter(policy -> policy.serialName.equalsIgnoreCase(serialName.trim())).findAny();
  }

  @Override
  public String toString() {
    return serialName;
  }
}
