package vcg.gen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.rules.RuleEngine;
import vcg.signature.ModuleSignature;
import vcg.signature.ParameterInfo;
import vcg.signature.PortInfo;

/**
 * Renders a module instantiation using the current signal and parameter rules:
 * <pre>
 * module #(
 *     .WIDTH             (32)
 * ) inst (
 *     .clk               (sys_clk),          // input
 *     .data              (bus)               // output [WIDTH-1:0]
 * );
 * </pre>
 */
public class InstanceGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_ALIGNMENT = 18;
  public static final String DEFAULT_INDENT = "    ";

  private final RuleEngine rules;
  private final int alignment;
  private final String indent;

  public InstanceGenerator(RuleEngine rules) { this(rules, DEFAULT_ALIGNMENT, DEFAULT_INDENT); }

  /**
   * @param alignment column width of the <code>.name</code> part; port connections are padded to twice this width before their comment
   * @param indent prefix of every parameter and port line
   */
  public InstanceGenerator(RuleEngine rules, int alignment, String indent) {
    this.rules = rules;
    this.alignment = alignment;
    this.indent = indent;
  }

  /**
   * @param signature the instantiated module
   * @param moduleName module name to emit, normally the signature's
   * @param instanceName instance name
   */
  public String generate(ModuleSignature signature, String moduleName, String instanceName) {
    logger.debug("Generating instance '{}' of module '{}' ({} ports, {} parameters)", instanceName, moduleName, signature.getPortCount(),
                 signature.getParameters().size());
    Map<String, String> paramConnections = new LinkedHashMap<>();
    for (ParameterInfo param : signature.getOverridableParameters()) {
      Optional<String> value = rules.resolveParam(param.name());
      value.ifPresent(val -> paramConnections.put(param.name(), val));
    }

    List<String> lines = new ArrayList<>();
    if (!paramConnections.isEmpty()) {
      lines.add(moduleName + " #(");
      int i = 0;
      for (Map.Entry<String, String> param : paramConnections.entrySet()) {
        String line = indent + "." + TextLayout.padRight(param.getKey(), alignment) + "(" + param.getValue() + ")";
        if (++i < paramConnections.size())
          line += ",";
        lines.add(line);
      }
      lines.add(") " + instanceName + " (");
    } else {
      lines.add(moduleName + " " + instanceName + " (");
    }

    List<PortInfo> ports = signature.getPorts();
    for (int i = 0; i < ports.size(); ++i) {
      PortInfo port = ports.get(i);
      String signal = rules.resolveSignal(port);
      String connection = "." + TextLayout.padRight(port.name(), alignment) + "(" + signal + ")";
      if (i < ports.size() - 1)
        connection += ",";
      String comment = portComment(port);
      lines.add(comment.isEmpty() ? indent + connection : indent + TextLayout.padRight(connection, alignment * 2) + comment);
      logger.trace("Port '{}' -> '{}'", port.name(), signal);
    }
    lines.add(");");

    logger.info("Instance '{}' of '{}' generated with {} port connections and {} parameter overrides", instanceName, moduleName, ports.size(),
                paramConnections.size());
    return String.join("\n", lines);
  }

  /** <code>// direction [range]</code>, empty if the direction is unknown. */
  static String portComment(PortInfo port) {
    if (port.direction() == null)
      return "";
    String range = port.getRangeDescription();
    return "// " + port.direction().serialName + (range.isEmpty() ? "" : " " + range);
  }
}
