package vcg.gen;

import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import vcg.ast.PortDirection;
import vcg.rules.FillPolicy;
import vcg.rules.RuleEngine;
import vcg.rules.WireResolution;
import vcg.signature.ModuleSignature;
import vcg.signature.PortInfo;

/**
 * Renders wire declarations for the ports of a module using the current wire rules:
 * <code>wire [range] name [= expression];</code>, with the name starting at a fixed column.
 */
public class WireGenerator {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final int DEFAULT_SPACING = 15;

  private final RuleEngine rules;
  private final int spacing;

  public WireGenerator(RuleEngine rules) { this(rules, DEFAULT_SPACING); }

  /** @param spacing column of the wire name; at least one space always separates it from the range */
  public WireGenerator(RuleEngine rules, int spacing) {
    this.rules = rules;
    this.spacing = spacing;
  }

  /**
   * Parses a direction filter as given to a wire definition request.
   * @return the direction, or null (all ports) for a null filter
   * @throws IllegalArgumentException for anything other than input, output or inout
   */
  public static PortDirection parseDirectionFilter(String filter) {
    if (filter == null)
      return null;
    return PortDirection.fromSerialName(filter).orElseThrow(() -> new IllegalArgumentException("Unsupported port type: " + filter));
  }

  /**
   * @param direction only ports of this direction; null for all
   * @return one declaration per line, in port order
   */
  public String generate(ModuleSignature signature, PortDirection direction, FillPolicy policy) {
    List<PortInfo> ports = signature.getPorts(direction);
    logger.debug("Generating wire definitions for module '{}' (type: {}, pattern: {}), {} ports", signature.getName(),
                 direction == null ? "all" : direction, policy, ports.size());
    List<String> declarations = new ArrayList<>();
    int skipped = 0;
    for (PortInfo port : ports) {
      String declaration = generateWire(port, policy);
      if (declaration.isEmpty()) {
        skipped++;
        logger.trace("Skipped port '{}'", port.name());
      } else {
        declarations.add(declaration);
        logger.trace("Port '{}': {}", port.name(), declaration);
      }
    }
    logger.info("Wire generation completed: {} wires generated, {} ports skipped", declarations.size(), skipped);
    return String.join("\n", declarations);
  }

  /** Declaration for one port, or an empty string if the port gets no wire. */
  String generateWire(PortInfo port, FillPolicy policy) {
    WireResolution resolution = rules.resolveWire(port, policy);
    if (!resolution.matched() && policy == FillPolicy.Lazy)
      return "";
    String name = resolution.name();
    if (name == null || name.isBlank()) {
      // a matching rule with an empty target suppresses the wire
      if (resolution.matched() || policy == FillPolicy.Lazy)
        return "";
      name = port.name();
    }
    return format(name, resolution.width(), resolution.expression(), port);
  }

  String format(String name, String widthOverride, String expression, PortInfo port) {
    String range = (widthOverride != null) ? PortInfo.rangeForWidth(widthOverride) : port.getRangeDescription();
    String prefix = range.isEmpty() ? "wire" : "wire " + range;
    String declaration = prefix + " ".repeat(Math.max(1, spacing - prefix.length())) + name;
    if (expression != null && !expression.isEmpty())
      declaration += " = " + expression;
    return declaration + ";";
  }
}
