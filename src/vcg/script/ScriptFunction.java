package vcg.script;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * The statements a generator script may call, with their parameter lists.
 * Parameters after {@link #requiredCount} are optional and default to null.
 */
public enum ScriptFunction {
  Instance("Instance", 3, "file_path", "module_name", "instance_name"),
  Connect("Connect", 2, "source_pattern", "target_pattern", "port_type"),
  ConnectParam("ConnectParam", 2, "param_name", "param_value"),
  WiresDef("WiresDef", 2, "file_path", "module_name", "port_type", "pattern"),
  WiresRule("WiresRule", 2, "port_pattern", "wire_pattern", "width", "expression"),
  Print("print", 0);

  public final String serialName;
  public final int requiredCount;
  private final List<String> parameterNames;

  private ScriptFunction(String serialName, int requiredCount, String... parameterNames) {
    this.serialName = serialName;
    this.requiredCount = requiredCount;
    this.parameterNames = List.of(parameterNames);
  }

  public static Optional<ScriptFunction> fromSerialName(String serialName) {
    return Stream.of(ScriptFunction.values()).filter(function -> function.serialName.equals(serialName)).findAny();
  }

  public List<String> getParameterNames() { return parameterNames; }

  private int parameterIndex(String keyword) {
    if (this == WiresRule && keyword.equals("expr"))
      keyword = "expression";
    return parameterNames.indexOf(keyword);
  }

  /**
   * Assigns the arguments of a call to this function's parameter slots.
   * Not applicable to {@link #Print}, which takes any number of positional arguments.
   *
   * @return one entry per parameter, null where an optional parameter was not given
   * @throws VCGScriptException if arguments are missing, duplicated or unknown
   */
  public String[] bind(ScriptCall call) throws VCGScriptException {
    if (this == Print)
      throw new IllegalStateException("print has no fixed parameter list");
    String[] slots = new String[parameterNames.size()];
    boolean[] given = new boolean[slots.length];

    if (call.positional().size() > slots.length)
      throw error(call, "takes at most " + slots.length + " arguments (" + call.positional().size() + " given)");
    for (int i = 0; i < call.positional().size(); ++i) {
      slots[i] = call.positional().get(i);
      given[i] = true;
    }
    for (Map.Entry<String, String> keyword : call.keywords().entrySet()) {
      int index = parameterIndex(keyword.getKey());
      if (index < 0)
        throw error(call, "got an unexpected keyword argument '" + keyword.getKey() + "'");
      if (given[index])
        throw error(call, "got multiple values for argument '" + parameterNames.get(index) + "'");
      slots[index] = keyword.getValue();
      given[index] = true;
    }
    for (int i = 0; i < requiredCount; ++i) {
      if (!given[i])
        throw error(call, "missing required argument '" + parameterNames.get(i) + "'");
      if (slots[i] == null)
        throw error(call, "argument '" + parameterNames.get(i) + "' must not be None");
    }
    return slots;
  }

  private VCGScriptException error(ScriptCall call, String message) {
    return new VCGScriptException("Line " + call.line() + ": " + serialName + "() " + message);
  }
}
