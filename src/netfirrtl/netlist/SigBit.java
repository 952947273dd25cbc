package netfirrtl.netlist;

import java.util.Objects;

/**
 * A single bit of a signal: either bit {@link #getOffset()} of a wire, or a constant.
 */
public final class SigBit {
  private final Wire wire;
  private final int offset;
  private final BitState data;

  public SigBit(Wire wire, int offset) {
    if (offset < 0 || offset >= wire.getWidth())
      throw new IndexOutOfBoundsException("Bit " + offset + " out of range for wire " + wire.getName());
    this.wire = wire;
    this.offset = offset;
    this.data = null;
  }

  public SigBit(BitState data) {
    this.wire = null;
    this.offset = 0;
    this.data = Objects.requireNonNull(data);
  }

  public boolean isWire() { return wire != null; }

  /** The referenced wire, or null for a constant bit. */
  public Wire getWire() { return wire; }

  public int getOffset() { return offset; }

  /** The constant value, or null for a wire bit. */
  public BitState getData() { return data; }

  @Override
  public int hashCode() {
    return wire != null ? Objects.hash(wire, offset) : data.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    SigBit other = (SigBit)obj;
    return wire == other.wire && offset == other.offset && data == other.data;
  }

  @Override
  public String toString() {
    if (wire == null)
      return String.valueOf(data.getSymbol());
    return wire.getWidth() == 1 ? wire.getName() : wire.getName() + "[" + offset + "]";
  }
}
