package vcg.preprocess;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Name to value mapping used to evaluate conditional compilation. Names given without a value map to "1".
 */
public class MacroSet {
  public static final String DEFAULT_VALUE = "1";

  private final LinkedHashMap<String, String> macros = new LinkedHashMap<>();

  public MacroSet() {}

  public MacroSet(Map<String, String> macros) {
    if (macros != null)
      macros.forEach(this::define);
  }

  public static MacroSet empty() { return new MacroSet(); }

  /** Plain names, each mapping to "1". */
  public static MacroSet of(Collection<String> names) {
    MacroSet set = new MacroSet();
    if (names != null)
      names.forEach(name -> set.define(name, DEFAULT_VALUE));
    return set;
  }

  /**
   * Parses a comma-separated list such as <code>DEBUG,WIDTH=32</code>.
   * Blank entries are skipped.
   * @throws IllegalArgumentException on an entry with an empty name
   */
  public static MacroSet parse(String definitions) {
    MacroSet set = new MacroSet();
    if (definitions == null)
      return set;
    for (String entry : definitions.split(",")) {
      String item = entry.strip();
      if (item.isEmpty())
        continue;
      int eq = item.indexOf('=');
      String name = (eq < 0) ? item : item.substring(0, eq).strip();
      String value = (eq < 0) ? DEFAULT_VALUE : item.substring(eq + 1).strip();
      if (name.isEmpty())
        throw new IllegalArgumentException("Macro definition without a name: '" + item + "'");
      set.define(name, value);
    }
    return set;
  }

  public void define(String name, String value) {
    if (name == null || name.isBlank())
      throw new IllegalArgumentException("Macro name must not be empty");
    macros.put(name.strip(), (value == null || value.isEmpty()) ? DEFAULT_VALUE : value);
  }

  public void undefine(String name) { macros.remove(name); }

  public boolean isDefined(String name) { return macros.containsKey(name); }

  public Optional<String> get(String name) { return Optional.ofNullable(macros.get(name)); }

  /** Adds all entries of the other set, overriding existing values. */
  public void putAll(MacroSet other) { macros.putAll(other.macros); }

  public MacroSet copy() { return new MacroSet(macros); }

  public Map<String, String> asMap() { return Collections.unmodifiableMap(macros); }

  public int size() { return macros.size(); }

  @Override
  public String toString() {
    return macros.toString();
  }
}
