package vcg.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the declarations of one module while it is being parsed and reconciles ports that are declared
 * in two places: listed in the header, then given direction/type/range by a body declaration.
 * <p>
 * Header entries seed a pending-port table keyed by identifier. Body declarations complete matching entries.
 * {@link #finish()} emits the module with its ports in header order; entries that never got a direction are
 * reported through {@link #getWarnings()} and left out.
 */
public class ModuleBuilder {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private static class PendingPort {
    final String identifier;
    final int line;
    PortDirection direction;
    NetKind netKind;
    RangeExpression range;
    /** Set for ANSI continuation entries (<code>input a, b</code>): used if no body declaration completes the port. */
    PendingPort inheritFrom;

    PendingPort(String identifier, int line) {
      this.identifier = identifier;
      this.line = line;
    }
  }

  private record PendingParameter(String identifier, ParameterKind kind, String defaultValue, String dataType, int line) {}

  private final AstArena arena;
  private final int parent;
  private final String moduleName;
  private final int line;
  private final LinkedHashMap<String, PendingPort> ports = new LinkedHashMap<>();
  private final List<PendingParameter> headerParameters = new ArrayList<>();
  private final List<PendingParameter> bodyParameters = new ArrayList<>();
  private final List<String> warnings = new ArrayList<>();
  private PendingPort lastDirectedHeaderPort = null;
  private boolean finished = false;

  /**
   * @param arena arena that receives the module node on {@link #finish()}
   * @param parent index of the design unit node
   * @param moduleName module identifier
   * @param line source line of the module keyword
   */
  public ModuleBuilder(AstArena arena, int parent, String moduleName, int line) {
    this.arena = arena;
    this.parent = parent;
    this.moduleName = moduleName;
    this.line = line;
  }

  public String getModuleName() { return moduleName; }

  public void addHeaderParameter(String identifier, ParameterKind kind, String defaultValue, String dataType, int line) {
    headerParameters.add(new PendingParameter(identifier, kind, defaultValue, dataType, line));
  }

  public void addBodyParameter(String identifier, ParameterKind kind, String defaultValue, String dataType, int line) {
    bodyParameters.add(new PendingParameter(identifier, kind, defaultValue, dataType, line));
  }

  /**
   * Registers a port list entry. Any of direction, netKind and range may be null.
   */
  public void declareHeaderPort(String identifier, PortDirection direction, NetKind netKind, RangeExpression range, int line) {
    if (ports.containsKey(identifier)) {
      warn("Port '" + identifier + "' listed twice in the header of module '" + moduleName + "' (line " + line + ")");
      return;
    }
    PendingPort port = new PendingPort(identifier, line);
    port.direction = direction;
    port.netKind = netKind;
    port.range = range;
    if (direction != null) {
      lastDirectedHeaderPort = port;
    } else if (netKind == null && range == null && lastDirectedHeaderPort != null) {
      port.inheritFrom = lastDirectedHeaderPort;
    }
    ports.put(identifier, port);
    logger.trace("Module {}: header port {} direction={} net={} range={}", moduleName, identifier, direction, netKind, range);
  }

  /**
   * Applies a body <code>input/output/inout</code> declaration to the matching header entry.
   * netKind and range may be null.
   */
  public void declareBodyPort(String identifier, PortDirection direction, NetKind netKind, RangeExpression range, int line) {
    PendingPort port = ports.get(identifier);
    if (port == null) {
      warn("Port '" + identifier + "' declared as " + direction + " at line " + line + " is not in the port list of module '" +
           moduleName + "'");
      return;
    }
    if (port.direction != null && port.direction != direction)
      warn("Port '" + identifier + "' redeclared as " + direction + " (was " + port.direction + ") at line " + line);
    port.direction = direction;
    port.inheritFrom = null;
    if (netKind != null)
      port.netKind = netKind;
    if (range != null)
      port.range = range;
    logger.trace("Module {}: body port {} direction={} net={} range={}", moduleName, identifier, direction, port.netKind, port.range);
  }

  /**
   * Applies a body <code>wire/reg/logic</code> declaration. Only affects names that are ports; other nets are ignored.
   */
  public void declareBodyNet(String identifier, NetKind netKind, RangeExpression range, int line) {
    PendingPort port = ports.get(identifier);
    if (port == null)
      return;
    port.netKind = netKind;
    if (port.range == null && range != null)
      port.range = range;
  }

  /**
   * Creates the module node with its parameters and fully defined ports.
   * @return the module node, already added to the arena below the parent
   */
  public ModuleDeclaration finish() {
    if (finished)
      throw new IllegalStateException("Module '" + moduleName + "' already finished");
    finished = true;

    ModuleDeclaration module = new ModuleDeclaration(arena, moduleName, line);
    int moduleIndex = arena.add(module, parent);
    for (PendingParameter param : headerParameters)
      arena.add(new ParameterDeclaration(param.identifier(), param.kind(), param.defaultValue(), param.dataType(), param.line()), moduleIndex);
    for (PendingParameter param : bodyParameters)
      arena.add(new ParameterDeclaration(param.identifier(), param.kind(), param.defaultValue(), param.dataType(), param.line()), moduleIndex);

    for (PendingPort port : ports.values()) {
      if (port.direction == null && port.inheritFrom != null) {
        port.direction = port.inheritFrom.direction;
        if (port.netKind == null)
          port.netKind = port.inheritFrom.netKind;
        if (port.range == null)
          port.range = port.inheritFrom.range;
      }
      if (port.direction == null) {
        warn("Port '" + port.identifier + "' of module '" + moduleName + "' (line " + port.line + ") has no direction declaration");
        continue;
      }
      NetKind netKind = port.netKind != null ? port.netKind : NetKind.Wire;
      arena.add(new PortDeclaration(port.identifier, port.direction, netKind, port.range, port.line), moduleIndex);
    }
    return module;
  }

  /** Port declaration warnings collected so far. */
  public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }

  /** Number of entries in the pending-port table, defined or not. */
  public int getPendingPortCount() { return ports.size(); }

  private void warn(String message) { warnings.add(message); }
}
