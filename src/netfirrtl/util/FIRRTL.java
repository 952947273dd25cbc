package netfirrtl.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import netfirrtl.netlist.BitState;

/**
 * Text generation for FIRRTL statements and expressions.
 */
public class FIRRTL {

  public enum DictWords {
    circuit,
    module,
    input,
    output,
    wire,
    reg,
    mem,
    inst,
    of,
    connect,
    invalid,
    UInt,
    SInt,
    ZeroBit,
    OneBit
  }

  /** Indentation of statements inside a module. */
  public String tab = "    ";
  /** Indentation of a module header inside the circuit. */
  public String moduleTab = "  ";

  public HashMap<DictWords, String> dictionary = new HashMap<DictWords, String>();

  public FIRRTL() { DictionaryDefinition(); }

  private void DictionaryDefinition() {
    dictionary.put(DictWords.circuit, "circuit");
    dictionary.put(DictWords.module, "module");
    dictionary.put(DictWords.input, "input");
    dictionary.put(DictWords.output, "output");
    dictionary.put(DictWords.wire, "wire");
    dictionary.put(DictWords.reg, "reg");
    dictionary.put(DictWords.mem, "mem");
    dictionary.put(DictWords.inst, "inst");
    dictionary.put(DictWords.of, "of");
    dictionary.put(DictWords.connect, "<=");
    dictionary.put(DictWords.invalid, "is invalid");
    dictionary.put(DictWords.UInt, "UInt");
    dictionary.put(DictWords.SInt, "SInt");
    dictionary.put(DictWords.ZeroBit, "UInt<1>(0)");
    dictionary.put(DictWords.OneBit, "UInt<1>(1)");
  }

  //////////   expressions   //////////

  /**
   * Generates a hex literal like {@code UInt<5>("h13")}.
   * The bits (LSB first) are zero-padded to a multiple of four for the digits; the declared width stays the chunk width.
   * Undefined bits are encoded as 0.
   */
  public String CreateUIntLiteral(List<BitState> bits) {
    List<BitState> padded = new ArrayList<>(bits);
    while (padded.size() % 4 != 0)
      padded.add(BitState.S0);
    StringBuilder digits = new StringBuilder();
    for (int i = padded.size() - 4; i >= 0; i -= 4) {
      int val = 0;
      for (int b = 0; b < 4; b++)
        if (padded.get(i + b) == BitState.S1)
          val += 1 << b;
      digits.append(Character.forDigit(val, 16));
    }
    return dictionary.get(DictWords.UInt) + "<" + bits.size() + ">(\"h" + digits + "\")";
  }

  /** Generates {@code UInt<width>(value)}. */
  public String CreateUInt(int width, long value) { return dictionary.get(DictWords.UInt) + "<" + width + ">(" + value + ")"; }

  /** Zero literal typed with the given sign and width, e.g. {@code SInt<8>(0)}. */
  public String CreateZero(boolean signed, int width) {
    return dictionary.get(signed ? DictWords.SInt : DictWords.UInt) + "<" + width + ">(0)";
  }

  /** Zero literal with inferred width, e.g. {@code UInt(0)}. */
  public String CreateZero(boolean signed) { return dictionary.get(signed ? DictWords.SInt : DictWords.UInt) + "(0)"; }

  public String CreatePrimop(String primop, String... args) { return primop + "(" + String.join(", ", args) + ")"; }

  /** Bit range [hi:lo] of expr. */
  public String CreateBits(String expr, int hi, int lo) { return "bits(" + expr + ", " + hi + ", " + lo + ")"; }

  /** Concatenation with hi in the upper bits. */
  public String CreateCat(String hi, String lo) { return "cat(" + hi + ", " + lo + ")"; }

  public String CreatePad(String expr, int width) { return "pad(" + expr + ", " + width + ")"; }

  public String CreateAsSInt(String expr) { return "asSInt(" + expr + ")"; }

  public String CreateAsUInt(String expr) { return "asUInt(" + expr + ")"; }

  public String CreateAsClock(String expr) { return "asClock(" + expr + ")"; }

  /** Two-way select, true branch first. */
  public String CreateMux(String cond, String ifTrue, String ifFalse) { return "mux(" + cond + ", " + ifTrue + ", " + ifFalse + ")"; }

  public String CreateValidIf(String cond, String expr) { return "validif(" + cond + ", " + expr + ")"; }

  //////////   statements   //////////

  public String CreateCircuitHeader(String top) { return dictionary.get(DictWords.circuit) + " " + top + ":\n"; }

  public String CreateModuleHeader(String name) { return moduleTab + dictionary.get(DictWords.module) + " " + name + ":\n"; }

  public String CreatePortDecl(boolean input, String name, int width) {
    return tab + dictionary.get(input ? DictWords.input : DictWords.output) + " " + name + ": " + CreateType(width) + "\n";
  }

  public String CreateWireDecl(String name, int width) { return tab + dictionary.get(DictWords.wire) + " " + name + ": " + CreateType(width) + "\n"; }

  public String CreateRegDecl(String name, int width, String clockExpr) {
    return tab + dictionary.get(DictWords.reg) + " " + name + ": " + CreateType(width) + ", " + clockExpr + "\n";
  }

  public String CreateConnect(String sink, String source) { return tab + sink + " " + dictionary.get(DictWords.connect) + " " + source + "\n"; }

  public String CreateInvalid(String name) { return tab + name + " " + dictionary.get(DictWords.invalid) + "\n"; }

  public String CreateInst(String name, String module) {
    return tab + dictionary.get(DictWords.inst) + " " + name + " " + dictionary.get(DictWords.of) + " " + module + "\n";
  }

  /**
   * Generates the memory declaration block. Ports are named r&lt;i&gt; and w&lt;i&gt;.
   */
  public String CreateMemBlock(String name, int width, int depth, int readPorts, int writePorts) {
    String fieldTab = tab + "  ";
    StringBuilder text = new StringBuilder();
    text.append(tab).append(dictionary.get(DictWords.mem)).append(" ").append(name).append(":\n");
    text.append(fieldTab).append("data-type => ").append(CreateType(width)).append("\n");
    text.append(fieldTab).append("depth => ").append(depth).append("\n");
    for (int i = 0; i < readPorts; i++)
      text.append(fieldTab).append("reader => ").append(ReadPortName(i)).append("\n");
    for (int i = 0; i < writePorts; i++)
      text.append(fieldTab).append("writer => ").append(WritePortName(i)).append("\n");
    text.append(fieldTab).append("read-latency => 0\n");
    text.append(fieldTab).append("write-latency => 1\n");
    text.append(fieldTab).append("read-under-write => undefined\n");
    return text.toString();
  }

  public String ReadPortName(int i) { return "r" + i; }

  public String WritePortName(int i) { return "w" + i; }

  /** Reference to a subfield, e.g. {@code mem.r0.addr}. */
  public String CreateSubfield(String... path) { return String.join(".", path); }

  public String CreateType(int width) { return dictionary.get(DictWords.UInt) + "<" + width + ">"; }
}
