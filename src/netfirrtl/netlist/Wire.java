package netfirrtl.netlist;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Named multi-bit signal of a module. Ports have a port id above zero and at least one direction flag.
 */
public class Wire {
  private final String name;
  private final int width;
  int portId = 0;
  boolean portInput = false;
  boolean portOutput = false;
  private final Map<String, Const> attributes = new LinkedHashMap<>();

  Wire(String name, int width) {
    if (width <= 0)
      throw new IllegalArgumentException("Wire " + name + " must have a positive width, got " + width);
    this.name = name;
    this.width = width;
  }

  public String getName() { return name; }
  public int getWidth() { return width; }
  public int getPortId() { return portId; }
  public boolean isPort() { return portId > 0; }
  public boolean isPortInput() { return portInput; }
  public boolean isPortOutput() { return portOutput; }

  public PortDirection getDirection() {
    if (!isPort())
      return PortDirection.NONE;
    return PortDirection.of(portInput, portOutput);
  }

  public Map<String, Const> getAttributes() { return attributes; }
  public boolean hasAttribute(String key) { return attributes.containsKey(key); }
  public void setAttribute(String key, Const value) { attributes.put(key, value); }

  @Override
  public String toString() {
    return name + "[" + width + "]";
  }
}
