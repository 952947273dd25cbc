package netfirrtl.netlist;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Primitive cell or module instance.
 */
public class Cell {
  private final String name;
  private final String type;
  private final CellKind kind;
  private final Map<String, Const> parameters = new LinkedHashMap<>();
  private final Map<String, SigSpec> connections = new LinkedHashMap<>();
  private final Map<String, Const> attributes = new LinkedHashMap<>();

  Cell(String name, String type) {
    this.name = name;
    this.type = type;
    this.kind = CellKind.classify(type);
  }

  public String getName() { return name; }
  /** The original type tag, kept for diagnostics and instance lookup. */
  public String getType() { return type; }
  public CellKind getKind() { return kind; }

  public Map<String, Const> getParameters() { return Collections.unmodifiableMap(parameters); }
  public boolean hasParam(String param) { return parameters.containsKey(param); }

  /**
   * @throws IllegalArgumentException if the parameter is not set
   */
  public Const getParam(String param) {
    Const ret = parameters.get(param);
    if (ret == null)
      throw new IllegalArgumentException("Cell " + name + " (" + type + ") has no parameter " + param);
    return ret;
  }

  public Cell setParam(String param, Const value) {
    parameters.put(param, value);
    return this;
  }

  public Map<String, SigSpec> getConnections() { return Collections.unmodifiableMap(connections); }
  public boolean hasPort(String port) { return connections.containsKey(port); }

  /**
   * @throws IllegalArgumentException if the port is not connected
   */
  public SigSpec getPort(String port) {
    SigSpec ret = connections.get(port);
    if (ret == null)
      throw new IllegalArgumentException("Cell " + name + " (" + type + ") has no port " + port);
    return ret;
  }

  public Cell setPort(String port, SigSpec sig) {
    connections.put(port, sig);
    return this;
  }

  public Map<String, Const> getAttributes() { return attributes; }

  @Override
  public String toString() {
    return name + " (" + type + ")";
  }
}
