package netfirrtl.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Ordered bit vector of a signal, least significant bit first.
 * Each bit refers to a wire bit or holds a constant.
 */
public class SigSpec implements Iterable<SigBit> {
  private final List<SigBit> bits;

  public SigSpec() { this.bits = new ArrayList<>(); }

  public SigSpec(List<SigBit> bits) { this.bits = new ArrayList<>(bits); }

  public SigSpec(SigBit bit) {
    this();
    bits.add(bit);
  }

  /** The full width of a wire. */
  public SigSpec(Wire wire) {
    this();
    for (int i = 0; i < wire.getWidth(); i++)
      bits.add(new SigBit(wire, i));
  }

  /** Bits [offset, offset+width) of a wire. */
  public SigSpec(Wire wire, int offset, int width) {
    this();
    for (int i = offset; i < offset + width; i++)
      bits.add(new SigBit(wire, i));
  }

  public SigSpec(Const value) {
    this();
    value.getBits().forEach(state -> bits.add(new SigBit(state)));
  }

  public static SigSpec of(BitState state, int width) { return new SigSpec(Const.repeat(state, width)); }

  public int size() { return bits.size(); }

  public boolean isEmpty() { return bits.isEmpty(); }

  public SigBit get(int i) { return bits.get(i); }

  public List<SigBit> getBits() { return Collections.unmodifiableList(bits); }

  @Override
  public Iterator<SigBit> iterator() {
    return getBits().iterator();
  }

  /** Returns bits [offset, offset+length) as a new SigSpec. */
  public SigSpec extract(int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > bits.size())
      throw new IndexOutOfBoundsException("Cannot extract [" + offset + "+:" + length + "] from a signal of width " + bits.size());
    return new SigSpec(bits.subList(offset, offset + length));
  }

  /** Returns bit offset as a single-bit SigSpec. */
  public SigSpec extract(int offset) { return extract(offset, 1); }

  /** Appends the bits of other above the current most significant bit. */
  public SigSpec append(SigSpec other) {
    bits.addAll(other.bits);
    return this;
  }

  public SigSpec append(SigBit bit) {
    bits.add(bit);
    return this;
  }

  public boolean isFullyConst() { return bits.stream().noneMatch(SigBit::isWire); }

  public boolean isFullyUndef() { return bits.stream().allMatch(bit -> !bit.isWire() && (bit.getData() == BitState.Sx || bit.getData() == BitState.Sz)); }

  /**
   * Converts a fully constant signal to a Const.
   * @throws IllegalStateException if a bit references a wire
   */
  public Const asConst() {
    if (!isFullyConst())
      throw new IllegalStateException("Signal " + this + " is not constant");
    return new Const(bits.stream().map(SigBit::getData).collect(Collectors.toList()));
  }

  /**
   * Splits the signal into maximal chunks of either consecutive bits of the same wire (increasing offsets), or constant bits.
   */
  public List<SigChunk> chunks() {
    List<SigChunk> ret = new ArrayList<>();
    int i = 0;
    while (i < bits.size()) {
      SigBit start = bits.get(i);
      int len = 1;
      if (start.isWire()) {
        while (i + len < bits.size()) {
          SigBit next = bits.get(i + len);
          if (next.getWire() != start.getWire() || next.getOffset() != start.getOffset() + len)
            break;
          len++;
        }
        ret.add(new SigChunk(start.getWire(), start.getOffset(), len));
      } else {
        List<BitState> data = new ArrayList<>();
        data.add(start.getData());
        while (i + len < bits.size() && !bits.get(i + len).isWire()) {
          data.add(bits.get(i + len).getData());
          len++;
        }
        ret.add(new SigChunk(data));
      }
      i += len;
    }
    return ret;
  }

  @Override
  public int hashCode() {
    return Objects.hash(bits);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    return bits.equals(((SigSpec)obj).bits);
  }

  @Override
  public String toString() {
    List<SigChunk> chunks = chunks();
    List<String> parts = new ArrayList<>(chunks.size());
    for (int i = chunks.size() - 1; i >= 0; i--) {
      SigChunk chunk = chunks.get(i);
      if (!chunk.isWire())
        parts.add(new Const(chunk.getData()).toString());
      else if (chunk.isWholeWire())
        parts.add(chunk.getWire().getName());
      else if (chunk.getWidth() == 1)
        parts.add(chunk.getWire().getName() + "[" + chunk.getOffset() + "]");
      else
        parts.add(chunk.getWire().getName() + "[" + (chunk.getOffset() + chunk.getWidth() - 1) + ":" + chunk.getOffset() + "]");
    }
    return parts.size() == 1 ? parts.get(0) : "{ " + String.join(" ", parts) + " }";
  }
}
