package netfirrtl.backend;

import java.util.Collections;
import java.util.List;
import netfirrtl.netlist.BitState;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.Design;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.SigSpec;
import netfirrtl.netlist.Wire;
import netfirrtl.ui.NetFIRRTLConfig;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class CellLoweringTest {

  Design design;
  NetlistModule module;
  TranslationContext ctx;
  ModuleSections sections;
  DriverMap drivers;
  CellLowering lowering;

  @BeforeEach
  void setUp() throws Exception {
    design = new Design();
    module = design.addModule("top");
    ctx = new TranslationContext(design, new NetFIRRTLConfig());
    sections = new ModuleSections();
    drivers = new DriverMap("top", false);
    lowering = new CellLowering(ctx, module, sections, drivers);
  }

  private Cell binary(String type, Wire a, boolean aSigned, SigSpec b, boolean bSigned, Wire y) {
    return module.addCell("c", type)
        .setParam("A_SIGNED", Const.fromBool(aSigned))
        .setParam("B_SIGNED", Const.fromBool(bSigned))
        .setParam("A_WIDTH", Const.fromInt(a.getWidth()))
        .setParam("B_WIDTH", Const.fromInt(b.size()))
        .setParam("Y_WIDTH", Const.fromInt(y.getWidth()))
        .setPort("A", new SigSpec(a))
        .setPort("B", b)
        .setPort("Y", new SigSpec(y));
  }

  private Cell unary(String type, Wire a, boolean aSigned, Wire y) {
    return module.addCell("c", type)
        .setParam("A_SIGNED", Const.fromBool(aSigned))
        .setParam("A_WIDTH", Const.fromInt(a.getWidth()))
        .setParam("Y_WIDTH", Const.fromInt(y.getWidth()))
        .setPort("A", new SigSpec(a))
        .setPort("Y", new SigSpec(y));
  }

  /** Lowers the cell and returns its single assignment statement. */
  private String lowerSingle(Cell cell) throws NetlistLoweringException {
    lowering.lower(cell);
    Assertions.assertEquals(1, sections.cellExprs.size());
    return sections.cellExprs.get(0);
  }

  @Test
  void testUnsignedAdd() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 5);
    lowering.lower(binary("$add", a, false, new SigSpec(b), false, y));

    Assertions.assertEquals(List.of("    wire c: UInt<5>\n"), sections.wireDecls);
    Assertions.assertEquals(List.of("    c <= add(a, b)\n"), sections.cellExprs);
    Assertions.assertEquals(new DriverMap.Driver("c", 0, 5), drivers.get(new SigBit(y, 0)));
    Assertions.assertEquals(new DriverMap.Driver("c", 4, 5), drivers.get(new SigBit(y, 4)));
  }

  @Test
  void testSignedSub() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 5);
    Assertions.assertEquals("    c <= asUInt(sub(pad(asSInt(a), 5), pad(asSInt(b), 5)))\n",
                            lowerSingle(binary("$sub", a, true, new SigSpec(b), true, y)));
  }

  @Test
  void testUnsignedSubIsRecast() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 4);
    Assertions.assertEquals("    c <= asUInt(sub(a, b))\n", lowerSingle(binary("$sub", a, false, new SigSpec(b), false, y)));
  }

  @Test
  void testUnsignedSubPaddedToOutputWidth() throws NetlistLoweringException {
    // 1 - 2 must read 0xff in 8 bits, not the 5-bit wrap 0x1f
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= asUInt(sub(pad(a, 8), pad(b, 8)))\n", lowerSingle(binary("$sub", a, false, new SigSpec(b), false, y)));
  }

  @Test
  void testUnsignedAddNotPaddedToWiderOutput() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= add(a, b)\n", lowerSingle(binary("$add", a, false, new SigSpec(b), false, y)));
  }

  @Test
  void testSignedComparisonNotRecast() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 4);
    Wire y = module.addWire("y", 1);
    Assertions.assertEquals("    c <= lt(asSInt(a), asSInt(b))\n", lowerSingle(binary("$lt", a, true, new SigSpec(b), true, y)));
  }

  @Test
  void testMux() throws NetlistLoweringException {
    Wire a = module.addWire("A", 8);
    Wire b = module.addWire("B", 8);
    Wire s = module.addWire("S", 1);
    Wire y = module.addWire("Y", 8);
    Cell cell = module.addCell("m", "$mux")
                    .setParam("WIDTH", Const.fromInt(8))
                    .setPort("A", new SigSpec(a))
                    .setPort("B", new SigSpec(b))
                    .setPort("S", new SigSpec(s))
                    .setPort("Y", new SigSpec(y));
    lowering.lower(cell);
    Assertions.assertEquals(List.of("    wire m: UInt<8>\n"), sections.wireDecls);
    Assertions.assertEquals(List.of("    m <= mux(S, B, A)\n"), sections.cellExprs);
  }

  @Test
  void testDynamicShlTruncated() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= bits(dshl(a, s), 7, 0)\n", lowerSingle(binary("$shl", a, false, new SigSpec(s), false, y)));
  }

  @ParameterizedTest
  @ValueSource(ints = {20, 24, 32})
  void testWideShiftAmountClamped(int amountWidth) throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", amountWidth);
    Wire y = module.addWire("y", 4);
    Assertions.assertEquals("    c <= bits(dshl(a, mux(gt(s, UInt<19>(524287)), UInt<19>(524287), bits(s, 18, 0))), 3, 0)\n",
                            lowerSingle(binary("$sshl", a, false, new SigSpec(s), false, y)));
  }

  @Test
  void testNarrowShiftAmountNotClamped() {
    Assertions.assertEquals("s", lowering.clampShiftAmount("s", CellLowering.MAX_DSH_WIDTH_ERROR - 1));
  }

  @Test
  void testConstantShl() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= bits(shl(a, 2), 7, 0)\n",
                            lowerSingle(binary("$shl", a, false, new SigSpec(Const.fromInt(2, 3)), false, y)));
  }

  @Test
  void testShrOnSignedIsLogical() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= dshr(a, s)\n", lowerSingle(binary("$shr", a, true, new SigSpec(s), false, y)));
  }

  @Test
  void testSshrOnSigned() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= asUInt(dshr(asSInt(a), s))\n", lowerSingle(binary("$sshr", a, true, new SigSpec(s), false, y)));
  }

  @Test
  void testSshrSignExtendsToOutputWidth() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= asUInt(dshr(pad(asSInt(a), 8), s))\n", lowerSingle(binary("$sshr", a, true, new SigSpec(s), false, y)));
  }

  @Test
  void testShrOnSignedSignExtendsBeforeShifting() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= dshr(asUInt(pad(asSInt(a), 8)), s)\n", lowerSingle(binary("$shr", a, true, new SigSpec(s), false, y)));
  }

  @Test
  void testConstantShlIntoWiderOutput() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= bits(shl(pad(a, 8), 2), 7, 0)\n",
                            lowerSingle(binary("$shl", a, false, new SigSpec(Const.fromInt(2, 3)), false, y)));
  }

  @Test
  void testDynamicShlIntoWiderOutput() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire s = module.addWire("s", 1);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= bits(dshl(pad(a, 8), s), 7, 0)\n", lowerSingle(binary("$shl", a, false, new SigSpec(s), false, y)));
  }

  @Test
  void testWideConstantShiftAmountSaturates() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= bits(shl(a, 8), 7, 0)\n",
                            lowerSingle(binary("$shl", a, false, new SigSpec(Const.fromInt(1L << 32, 33)), false, y)));
  }

  @Test
  void testConstantShiftAmount() {
    Assertions.assertEquals(3, CellLowering.constantShiftAmount(Const.fromInt(3, 8), 8));
    Assertions.assertEquals(8, CellLowering.constantShiftAmount(Const.fromInt(100, 8), 8));
    Assertions.assertEquals(8, CellLowering.constantShiftAmount(Const.fromInt(1L << 31, 32), 8));
    Assertions.assertEquals(16, CellLowering.constantShiftAmount(Const.fromInt(1L << 35, 40), 16));
    Assertions.assertEquals(5, CellLowering.constantShiftAmount(Const.fromInt(5, 40), 16));
  }

  @Test
  void testLogicAnd() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire b = module.addWire("b", 2);
    Wire y = module.addWire("y", 1);
    Assertions.assertEquals("    c <= and(neq(a, UInt(0)), neq(asSInt(b), SInt(0)))\n",
                            lowerSingle(binary("$logic_and", a, false, new SigSpec(b), true, y)));
  }

  @Test
  void testSignedNotPaddedAndRecast() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= asUInt(not(pad(asSInt(a), 8)))\n", lowerSingle(unary("$not", a, true, y)));
  }

  @Test
  void testNegAlwaysRecast() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= asUInt(neg(pad(a, 8)))\n", lowerSingle(unary("$neg", a, false, y)));
  }

  @Test
  void testLogicNot() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 1);
    Assertions.assertEquals("    c <= eq(a, UInt<4>(0))\n", lowerSingle(unary("$logic_not", a, false, y)));
  }

  @Test
  void testReduceBoolSigned() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 1);
    Assertions.assertEquals("    c <= neq(asSInt(a), SInt<4>(0))\n", lowerSingle(unary("$reduce_bool", a, true, y)));
  }

  @Test
  void testReduceXnor() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire y = module.addWire("y", 1);
    Assertions.assertEquals("    c <= not(xorr(a))\n", lowerSingle(unary("$reduce_xnor", a, false, y)));
  }

  @Test
  void testShiftWithSignedAmount() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", 4);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= mux(lt(asSInt(s), SInt<1>(0)), bits(dshl(a, asUInt(neg(asSInt(s)))), 7, 0), dshr(a, s))\n",
                            lowerSingle(binary("$shift", a, false, new SigSpec(s), true, y)));
  }

  @Test
  void testShiftPadsNarrowOperand() throws NetlistLoweringException {
    Wire a = module.addWire("a", 4);
    Wire s = module.addWire("s", 3);
    Wire y = module.addWire("y", 8);
    Assertions.assertEquals("    c <= dshr(pad(a, 8), s)\n", lowerSingle(binary("$shift", a, false, new SigSpec(s), false, y)));
  }

  @Test
  void testShiftxSignedAmountTruncated() throws NetlistLoweringException {
    Wire a = module.addWire("a", 8);
    Wire s = module.addWire("s", 4);
    Wire y = module.addWire("y", 2);
    Assertions.assertEquals("    c <= bits(dshr(a, validif(not(bits(s, 3, 3)), s)), 1, 0)\n",
                            lowerSingle(binary("$shiftx", a, false, new SigSpec(s), true, y)));
  }

  private Cell dff(boolean posedge) {
    Wire clk = module.addWire("clk", 1);
    Wire d = module.addWire("d", 4);
    Wire q = module.addWire("q", 4);
    return module.addCell("r", "$dff")
        .setParam("CLK_POLARITY", Const.fromBool(posedge))
        .setParam("WIDTH", Const.fromInt(4))
        .setPort("CLK", new SigSpec(clk))
        .setPort("D", new SigSpec(d))
        .setPort("Q", new SigSpec(q));
  }

  @Test
  void testDff() throws NetlistLoweringException {
    lowering.lower(dff(true));
    Assertions.assertEquals(List.of("    reg r: UInt<4>, asClock(clk)\n"), sections.wireDecls);
    Assertions.assertEquals(List.of("    r <= d\n"), sections.cellExprs);
    Assertions.assertEquals("r", drivers.get(new SigBit(module.wire("q"), 2)).exprId());
  }

  @Test
  void testNegedgeDffIsFatal() {
    Cell cell = dff(false);
    var ex = Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
    Assertions.assertTrue(ex.getMessage().contains("top.r"), ex.getMessage());
  }

  private Cell memory(Const init, SigSpec wrEn) {
    Wire raddr = module.addWire("raddr", 2);
    Wire rdata = module.addWire("rdata", 8);
    Wire waddr = module.addWire("waddr", 2);
    Wire wdata = module.addWire("wdata", 8);
    Wire clk = module.addWire("clk", 1);
    return module.addCell("ram", "$mem")
        .setParam("MEMID", Const.fromString("\\ram"))
        .setParam("SIZE", Const.fromInt(4))
        .setParam("OFFSET", Const.fromInt(0))
        .setParam("ABITS", Const.fromInt(2))
        .setParam("WIDTH", Const.fromInt(8))
        .setParam("INIT", init)
        .setParam("RD_PORTS", Const.fromInt(1))
        .setParam("RD_CLK_ENABLE", Const.fromBool(false))
        .setParam("RD_CLK_POLARITY", Const.fromBool(true))
        .setParam("WR_PORTS", Const.fromInt(1))
        .setParam("WR_CLK_ENABLE", Const.fromBool(true))
        .setParam("WR_CLK_POLARITY", Const.fromBool(true))
        .setPort("RD_CLK", SigSpec.of(BitState.Sx, 1))
        .setPort("RD_EN", SigSpec.of(BitState.S1, 1))
        .setPort("RD_ADDR", new SigSpec(raddr))
        .setPort("RD_DATA", new SigSpec(rdata))
        .setPort("WR_CLK", new SigSpec(clk))
        .setPort("WR_EN", wrEn)
        .setPort("WR_ADDR", new SigSpec(waddr))
        .setPort("WR_DATA", new SigSpec(wdata));
  }

  private SigSpec uniformEnable() {
    Wire we = module.addWire("we", 1);
    return new SigSpec(Collections.nCopies(8, new SigBit(we, 0)));
  }

  @Test
  void testMemory() throws NetlistLoweringException {
    lowering.lower(memory(Const.repeat(BitState.Sx, 32), uniformEnable()));
    Assertions.assertEquals(List.of("    mem ram:\n"
                                        + "      data-type => UInt<8>\n"
                                        + "      depth => 4\n"
                                        + "      reader => r0\n"
                                        + "      writer => w0\n"
                                        + "      read-latency => 0\n"
                                        + "      write-latency => 1\n"
                                        + "      read-under-write => undefined\n",
                                    "    ram.r0.addr <= raddr\n", "    ram.r0.en <= UInt<1>(1)\n", "    ram.r0.clk <= asClock(UInt<1>(0))\n",
                                    "    ram.w0.addr <= waddr\n", "    ram.w0.data <= wdata\n", "    ram.w0.en <= we\n",
                                    "    ram.w0.mask <= UInt<1>(1)\n", "    ram.w0.clk <= asClock(clk)\n"),
                            sections.cellExprs);
    Assertions.assertEquals(new DriverMap.Driver("ram.r0.data", 3, 8), drivers.get(new SigBit(module.wire("rdata"), 3)));
  }

  @Test
  void testMemoryInitIsFatal() {
    List<BitState> init = new java.util.ArrayList<>(Collections.nCopies(32, BitState.Sx));
    init.set(5, BitState.S0);
    Cell cell = memory(new Const(init), uniformEnable());
    Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
  }

  @Test
  void testMemoryComplexWriteEnableIsFatal() {
    Wire we = module.addWire("we", 8);
    Cell cell = memory(Const.repeat(BitState.Sx, 32), new SigSpec(we));
    var ex = Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
    Assertions.assertTrue(ex.getMessage().contains("write enable"), ex.getMessage());
  }

  @Test
  void testClockedReadPortIsFatal() {
    Cell cell = memory(Const.repeat(BitState.Sx, 32), uniformEnable()).setParam("RD_CLK_ENABLE", Const.fromBool(true));
    Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
  }

  @Test
  void testMemoryOffsetIsFatal() {
    Cell cell = memory(Const.repeat(BitState.Sx, 32), uniformEnable()).setParam("OFFSET", Const.fromInt(4));
    var ex = Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
    Assertions.assertTrue(ex.getMessage().contains("offset"), ex.getMessage());
  }

  @Test
  void testUnclockedWritePortIsFatal() {
    Cell cell = memory(Const.repeat(BitState.Sx, 32), uniformEnable()).setParam("WR_CLK_ENABLE", Const.fromBool(false));
    var ex = Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
    Assertions.assertTrue(ex.getMessage().contains("Unclocked write port 0"), ex.getMessage());
  }

  @Test
  void testNegedgeWritePortIsFatal() {
    Cell cell = memory(Const.repeat(BitState.Sx, 32), uniformEnable()).setParam("WR_CLK_POLARITY", Const.fromBool(false));
    var ex = Assertions.assertThrows(NetlistLoweringException.class, () -> lowering.lower(cell));
    Assertions.assertTrue(ex.getMessage().contains("Negedge write port 0"), ex.getMessage());
  }

  @ParameterizedTest
  @ValueSource(strings = {"$memrd", "$memwr", "$pmux", "$fancy_new_cell"})
  void testUnsupportedCellsWarn(String type) throws NetlistLoweringException {
    lowering.lower(module.addCell("u", type));
    Assertions.assertTrue(sections.isEmpty());
    Assertions.assertEquals(1, ctx.getWarnings().size());
    Assertions.assertTrue(ctx.getWarnings().get(0).contains(type), ctx.getWarnings().get(0));
  }
}
