package vcg.script;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.VCGException;
import vcg.ast.PortDirection;
import vcg.gen.InstanceGenerator;
import vcg.gen.WireGenerator;
import vcg.rules.FillPolicy;
import vcg.rules.RuleEngine;
import vcg.signature.ModuleSignature;

/**
 * Executes generator scripts against one rule engine.
 * Every {@link #execute(String)} starts with an empty rule set and an empty output, so rules never leak between blocks.
 */
public class GeneratorHost {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Supplies the signature of the module described in a file. */
  @FunctionalInterface
  public interface ModuleLoader {
    ModuleSignature load(Path file) throws VCGException;
  }

  private final RuleEngine rules;
  private final InstanceGenerator instanceGenerator;
  private final WireGenerator wireGenerator;
  private final ModuleLoader loader;
  private final Path baseDir;
  private final OutputCollector output = new OutputCollector();
  private final Map<Path, ModuleSignature> loaded = new HashMap<>();

  /**
   * @param baseDir directory that relative file arguments are resolved against first; null for the working directory only
   */
  public GeneratorHost(RuleEngine rules, InstanceGenerator instanceGenerator, WireGenerator wireGenerator, ModuleLoader loader, Path baseDir) {
    this.rules = rules;
    this.instanceGenerator = instanceGenerator;
    this.wireGenerator = wireGenerator;
    this.loader = loader;
    this.baseDir = baseDir;
  }

  public RuleEngine getRules() { return rules; }

  /**
   * Runs a script and returns the collected output fragments joined by line breaks.
   * @throws VCGScriptException if the script is malformed or a statement is invalid
   * @throws VCGException if a referenced module file cannot be read or parsed
   */
  public String execute(String script) throws VCGException {
    logger.debug("Starting generator script execution");
    rules.reset();
    output.clear();
    loaded.clear();

    List<ScriptCall> calls;
    try {
      calls = new ScriptParser(script).parse();
      for (ScriptCall call : calls)
        dispatch(call);
    } catch (VCGScriptException | IllegalArgumentException e) {
      logger.error("Execution error: {}", e.getMessage());
      throw new VCGScriptException("Exec Error: " + e.getMessage(), e);
    }
    logger.debug("Executed {} statements, rules: {}", calls.size(), rules.summary());
    return output.getFinalOutput();
  }

  private void dispatch(ScriptCall call) throws VCGException {
    ScriptFunction function = ScriptFunction.fromSerialName(call.function())
                                  .orElseThrow(() -> new VCGScriptException("Line " + call.line() + ": unknown statement '" + call.function() + "'"));
    logger.trace("Line {}: {}", call.line(), call);
    if (function == ScriptFunction.Print) {
      print(call);
      return;
    }
    String[] args = function.bind(call);
    switch (function) {
    case Connect -> rules.addSignalRule(args[0], args[1], WireGenerator.parseDirectionFilter(args[2]));
    case ConnectParam -> rules.addParamRule(args[0], args[1]);
    case WiresRule -> rules.addWireRule(args[0], args[1], args[2], args[3]);
    case WiresDef -> {
      PortDirection direction = WireGenerator.parseDirectionFilter(args[2]);
      String pattern = (args[3] == null) ? FillPolicy.Greedy.serialName : args[3];
      FillPolicy policy =
          FillPolicy.fromSerialName(pattern).orElseThrow(() -> new VCGScriptException("Invalid pattern: " + pattern + ". Must be 'lazy' or 'greedy'"));
      ModuleSignature signature = load(args[0], args[1]);
      output.addWires(wireGenerator.generate(signature, direction, policy));
    }
    case Instance -> {
      ModuleSignature signature = load(args[0], args[1]);
      logger.info("Generating instance '{}' of module '{}' from {}", args[2], args[1], args[0]);
      output.addInstance(instanceGenerator.generate(signature, args[1], args[2]));
    }
    default -> throw new IllegalStateException("Unhandled statement " + function);
    }
  }

  private void print(ScriptCall call) throws VCGScriptException {
    for (String keyword : call.keywords().keySet()) {
      if (!keyword.equals("sep") && !keyword.equals("end"))
        throw new VCGScriptException("Line " + call.line() + ": print() got an unexpected keyword argument '" + keyword + "'");
    }
    String sep = call.keywords().getOrDefault("sep", " ");
    String end = call.keywords().getOrDefault("end", "\n");
    String text = call.positional().stream().map(arg -> arg == null ? "None" : arg).collect(Collectors.joining(sep == null ? " " : sep));
    output.addText(text + (end == null ? "\n" : end));
  }

  private ModuleSignature load(String fileName, String moduleName) throws VCGException {
    Path file = resolve(fileName);
    ModuleSignature signature = loaded.get(file);
    if (signature == null) {
      signature = loader.load(file);
      loaded.put(file, signature);
    }
    if (!signature.getName().equals(moduleName))
      logger.warn("Module name '{}' does not match module '{}' declared in {}", moduleName, signature.getName(), fileName);
    return signature;
  }

  /** Relative names are looked up next to the processed file first, then in the working directory. */
  Path resolve(String fileName) {
    Path file = Path.of(fileName);
    if (baseDir != null && !file.isAbsolute()) {
      Path candidate = baseDir.resolve(file);
      if (Files.exists(candidate))
        return candidate.normalize();
    }
    return file;
  }
}
