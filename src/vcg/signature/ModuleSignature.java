package vcg.signature;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import vcg.ast.PortDirection;

/**
 * Query view of a parsed module: ordered ports and parameters as consumed by instance and wire generation.
 */
public class ModuleSignature {
  private final String name;
  private final List<PortInfo> ports;
  private final List<ParameterInfo> parameters;

  public ModuleSignature(String name, List<PortInfo> ports, List<ParameterInfo> parameters) {
    this.name = name;
    this.ports = List.copyOf(ports);
    this.parameters = List.copyOf(parameters);
  }

  public String getName() { return name; }

  /** All ports in header order. */
  public List<PortInfo> getPorts() { return ports; }

  /**
   * Ports of the given direction, in header order.
   * @param direction the direction to keep, or null for all ports
   */
  public List<PortInfo> getPorts(PortDirection direction) {
    if (direction == null)
      return ports;
    return ports.stream().filter(port -> port.direction() == direction).collect(Collectors.toList());
  }

  public List<PortInfo> getInputPorts() { return getPorts(PortDirection.Input); }
  public List<PortInfo> getOutputPorts() { return getPorts(PortDirection.Output); }
  public List<PortInfo> getInoutPorts() { return getPorts(PortDirection.Inout); }

  public int getPortCount() { return ports.size(); }

  /** Number of ports per direction; directions without ports map to 0. */
  public Map<PortDirection, Integer> getPortCountByDirection() {
    EnumMap<PortDirection, Integer> counts = new EnumMap<>(PortDirection.class);
    for (PortDirection direction : PortDirection.values())
      counts.put(direction, 0);
    for (PortInfo port : ports) {
      if (port.direction() != null)
        counts.merge(port.direction(), 1, Integer::sum);
    }
    return Collections.unmodifiableMap(counts);
  }

  public Optional<PortInfo> findPort(String portName) { return ports.stream().filter(port -> port.name().equals(portName)).findFirst(); }

  /** All parameters: header list first, then body declarations. */
  public List<ParameterInfo> getParameters() { return parameters; }

  /** Parameters an instance may override (excludes localparams). */
  public List<ParameterInfo> getOverridableParameters() {
    return parameters.stream().filter(param -> !param.isLocal()).collect(Collectors.toList());
  }

  public boolean hasParameters() { return !parameters.isEmpty(); }

  public Optional<ParameterInfo> findParameter(String paramName) {
    return parameters.stream().filter(param -> param.name().equals(paramName)).findFirst();
  }

  /** Statement bodies are never retained, so this is always true. */
  public boolean isBodyIgnored() { return true; }

  @Override
  public String toString() {
    return "module " + name + " (" + parameters.size() + " parameters, " + ports.size() + " ports)";
  }
}
