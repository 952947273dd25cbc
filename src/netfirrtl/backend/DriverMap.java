package netfirrtl.backend;

import java.util.HashMap;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.SigSpec;

/**
 * Records, per wire bit, which generated expression drives it.
 */
public class DriverMap {
  /**
   * Bit offset within a driving expression.
   * @param exprId the identifier (or subfield path) of the driving expression
   * @param offset the bit of that expression
   * @param exprWidth the full width of that expression
   */
  public record Driver(String exprId, int offset, int exprWidth) {}

  private final HashMap<SigBit, Driver> drivers = new HashMap<>();
  private final boolean strict;
  private final String moduleName;

  /**
   * @param moduleName module name used in error messages
   * @param strict if set, registering a second driver for a bit is a fatal error
   */
  public DriverMap(String moduleName, boolean strict) {
    this.moduleName = moduleName;
    this.strict = strict;
  }

  /**
   * Registers exprId as the driver of every wire bit in sig, bit i of sig being bit i of exprId. Constant bits are skipped.
   * Without strict checking, a later registration replaces an earlier one.
   */
  public void register(String exprId, SigSpec sig) throws NetlistLoweringException {
    for (int i = 0; i < sig.size(); i++) {
      SigBit bit = sig.get(i);
      if (!bit.isWire())
        continue;
      Driver prev = drivers.put(bit, new Driver(exprId, i, sig.size()));
      if (prev != null && strict)
        throw new NetlistLoweringException("Multiple drivers for " + moduleName + "." + bit + ": " + prev.exprId() + " and " + exprId);
    }
  }

  /** Returns the driver of bit, or null if undriven. */
  public Driver get(SigBit bit) { return drivers.get(bit); }

  public boolean isDriven(SigBit bit) { return drivers.containsKey(bit); }
}
