package netfirrtl.netlist;

/**
 * Direction of a module port, as seen from inside the module.
 */
public enum PortDirection {
  NONE,
  INPUT,
  OUTPUT,
  INOUT;

  public static PortDirection of(boolean input, boolean output) {
    if (input && output)
      return INOUT;
    if (input)
      return INPUT;
    return output ? OUTPUT : NONE;
  }

  /** Parses the direction names used by JSON netlists ("input", "output", "inout"); anything else is NONE. */
  public static PortDirection fromName(String name) {
    switch (name) {
    case "input":
      return INPUT;
    case "output":
      return OUTPUT;
    case "inout":
      return INOUT;
    default:
      return NONE;
    }
  }
}
