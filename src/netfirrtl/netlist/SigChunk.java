package netfirrtl.netlist;

import java.util.Collections;
import java.util.List;

/**
 * A maximal run inside a {@link SigSpec}: either consecutive bits of one wire, or consecutive constant bits.
 */
public final class SigChunk {
  private final Wire wire;
  private final int offset;
  private final int width;
  private final List<BitState> data;

  SigChunk(Wire wire, int offset, int width) {
    this.wire = wire;
    this.offset = offset;
    this.width = width;
    this.data = Collections.emptyList();
  }

  SigChunk(List<BitState> data) {
    this.wire = null;
    this.offset = 0;
    this.width = data.size();
    this.data = Collections.unmodifiableList(data);
  }

  public boolean isWire() { return wire != null; }
  public Wire getWire() { return wire; }
  /** Lowest wire bit covered by this chunk. */
  public int getOffset() { return offset; }
  public int getWidth() { return width; }
  /** Constant bits (LSB first), empty for wire chunks. */
  public List<BitState> getData() { return data; }

  /** True iff the chunk covers its whole wire. */
  public boolean isWholeWire() { return wire != null && offset == 0 && width == wire.getWidth(); }
}
