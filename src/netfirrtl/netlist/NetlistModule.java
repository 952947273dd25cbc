package netfirrtl.netlist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A netlist module: wires (in declaration order), cells and direct connections.
 */
public class NetlistModule {
  private final String name;
  private final LinkedHashMap<String, Wire> wires = new LinkedHashMap<>();
  private final LinkedHashMap<String, Cell> cells = new LinkedHashMap<>();
  private final List<Connection> connections = new ArrayList<>();
  private final Map<String, Const> attributes = new LinkedHashMap<>();
  private int nextPortId = 1;

  NetlistModule(String name) { this.name = name; }

  public String getName() { return name; }

  public Wire addWire(String wireName, int width) {
    if (wires.containsKey(wireName))
      throw new IllegalArgumentException("Module " + name + " already has a wire " + wireName);
    Wire wire = new Wire(wireName, width);
    wires.put(wireName, wire);
    return wire;
  }

  /**
   * Adds a port wire; ports are numbered in the order they are added.
   */
  public Wire addPort(String wireName, int width, PortDirection direction) {
    Wire wire = addWire(wireName, width);
    wire.portId = nextPortId++;
    wire.portInput = direction == PortDirection.INPUT || direction == PortDirection.INOUT;
    wire.portOutput = direction == PortDirection.OUTPUT || direction == PortDirection.INOUT;
    return wire;
  }

  /** Returns the wire with the given name, or null. */
  public Wire wire(String wireName) { return wires.get(wireName); }

  /** All wires in insertion order. */
  public Collection<Wire> wires() { return Collections.unmodifiableCollection(wires.values()); }

  /** Port wires ordered by port id. */
  public List<Wire> ports() {
    return wires.values().stream().filter(Wire::isPort).sorted(Comparator.comparingInt(Wire::getPortId)).collect(Collectors.toList());
  }

  public Cell addCell(String cellName, String type) {
    if (cells.containsKey(cellName))
      throw new IllegalArgumentException("Module " + name + " already has a cell " + cellName);
    Cell cell = new Cell(cellName, type);
    cells.put(cellName, cell);
    return cell;
  }

  /** Returns the cell with the given name, or null. */
  public Cell cell(String cellName) { return cells.get(cellName); }

  /** All cells in insertion order. */
  public Collection<Cell> cells() { return Collections.unmodifiableCollection(cells.values()); }

  public void remove(Cell cell) { cells.remove(cell.getName(), cell); }

  public void connect(SigSpec destination, SigSpec source) { connections.add(new Connection(destination, source)); }

  public List<Connection> connections() { return Collections.unmodifiableList(connections); }

  public Map<String, Const> getAttributes() { return attributes; }

  public void setAttribute(String key, Const value) { attributes.put(key, value); }

  public boolean getBoolAttribute(String key) {
    Const value = attributes.get(key);
    return value != null && value.asBool();
  }

  @Override
  public String toString() {
    return name;
  }
}
