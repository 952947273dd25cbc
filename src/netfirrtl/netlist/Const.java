package netfirrtl.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Constant bit vector, used for cell parameters and attributes.
 * Bits are stored least significant first.
 */
public class Const {
  private final List<BitState> bits;
  /** Set if the constant was created from a string value (e.g. a memory id). */
  private final String stringValue;

  public Const(List<BitState> bits) {
    this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
    this.stringValue = null;
  }

  private Const(List<BitState> bits, String stringValue) {
    this.bits = Collections.unmodifiableList(new ArrayList<>(bits));
    this.stringValue = stringValue;
  }

  /** Creates a constant of the given width holding the two's complement representation of value. */
  public static Const fromInt(long value, int width) {
    List<BitState> bits = new ArrayList<>(width);
    for (int i = 0; i < width; i++)
      bits.add(((i < 64 ? (value >> i) : (value >> 63)) & 1) != 0 ? BitState.S1 : BitState.S0);
    return new Const(bits);
  }

  public static Const fromInt(long value) { return fromInt(value, 32); }

  public static Const fromBool(boolean value) { return fromInt(value ? 1 : 0, 1); }

  /**
   * Parses a bit string written most significant bit first, e.g. "0101x".
   */
  public static Const fromBinaryString(String msbFirst) {
    List<BitState> bits = new ArrayList<>(msbFirst.length());
    for (int i = msbFirst.length() - 1; i >= 0; i--)
      bits.add(BitState.fromSymbol(msbFirst.charAt(i)));
    return new Const(bits);
  }

  /** Encodes a string as 8 bits per character, first character in the most significant byte. */
  public static Const fromString(String value) {
    List<BitState> bits = new ArrayList<>(value.length() * 8);
    for (int i = value.length() - 1; i >= 0; i--) {
      char ch = value.charAt(i);
      for (int b = 0; b < 8; b++)
        bits.add(((ch >> b) & 1) != 0 ? BitState.S1 : BitState.S0);
    }
    return new Const(bits, value);
  }

  /** Creates a constant of width bits all set to state. */
  public static Const repeat(BitState state, int width) { return new Const(Collections.nCopies(width, state)); }

  public List<BitState> getBits() { return bits; }

  public int size() { return bits.size(); }

  public BitState get(int i) { return bits.get(i); }

  /**
   * Interprets the constant as an unsigned integer; x and z count as 0. Bits above 31 are ignored.
   */
  public int asInt() {
    int ret = 0;
    for (int i = 0; i < bits.size() && i < 32; i++)
      if (bits.get(i) == BitState.S1)
        ret |= 1 << i;
    return ret;
  }

  /** True iff any bit is 1. */
  public boolean asBool() { return bits.contains(BitState.S1); }

  public boolean isFullyUndef() { return bits.stream().allMatch(bit -> bit == BitState.Sx || bit == BitState.Sz); }

  public boolean isString() { return stringValue != null; }

  /** Returns the string value for string constants, else the bit string (MSB first). */
  public String asString() {
    if (stringValue != null)
      return stringValue;
    StringBuilder ret = new StringBuilder(bits.size());
    for (int i = bits.size() - 1; i >= 0; i--)
      ret.append(bits.get(i).getSymbol());
    return ret.toString();
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
    Const other = (Const)obj;
    return bits.equals(other.bits);
  }

  @Override
  public String toString() {
    return stringValue != null ? "\"" + stringValue + "\"" : bits.size() + "'" + asString();
  }
}
