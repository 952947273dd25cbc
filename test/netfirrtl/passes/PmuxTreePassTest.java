package netfirrtl.passes;

import java.util.HashMap;
import netfirrtl.netlist.BitState;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.CellKind;
import netfirrtl.netlist.Connection;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.Design;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.PortDirection;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.SigSpec;
import netfirrtl.netlist.Wire;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PmuxTreePassTest {

  static final int WIDTH = 4;

  NetlistModule module;
  Wire a;
  Wire b;
  Wire s;
  Wire y;

  @BeforeEach
  void setUp() throws Exception {
    module = new Design().addModule("m");
  }

  private void addPmux(int selects, boolean undefDefault) {
    a = module.addPort("a", WIDTH, PortDirection.INPUT);
    b = module.addPort("b", WIDTH * selects, PortDirection.INPUT);
    s = module.addPort("s", selects, PortDirection.INPUT);
    y = module.addPort("y", WIDTH, PortDirection.OUTPUT);
    module.addCell("p", "$pmux")
        .setParam("WIDTH", Const.fromInt(WIDTH))
        .setParam("S_WIDTH", Const.fromInt(selects))
        .setPort("A", undefDefault ? SigSpec.of(BitState.Sx, WIDTH) : new SigSpec(a))
        .setPort("B", new SigSpec(b))
        .setPort("S", new SigSpec(s))
        .setPort("Y", new SigSpec(y));
  }

  /** Evaluates the rewritten module for the given select value; data word i holds the value i+1, the default 15. */
  private int evaluate(int selects, int select) {
    HashMap<SigBit, BitState> values = new HashMap<>();
    for (int i = 0; i < WIDTH; i++)
      values.put(new SigBit(a, i), (15 >> i & 1) != 0 ? BitState.S1 : BitState.S0);
    for (int w = 0; w < selects; w++)
      for (int i = 0; i < WIDTH; i++)
        values.put(new SigBit(b, w * WIDTH + i), ((w + 1) >> i & 1) != 0 ? BitState.S1 : BitState.S0);
    for (int i = 0; i < selects; i++)
      values.put(new SigBit(s, i), (select >> i & 1) != 0 ? BitState.S1 : BitState.S0);

    // Cells are created in dependency order, so one pass over them suffices.
    for (Cell cell : module.cells()) {
      SigSpec out = cell.getPort("Y");
      switch (cell.getKind()) {
      case REDUCE_OR: {
        boolean any = cell.getPort("A").getBits().stream().anyMatch(bit -> value(values, bit) == BitState.S1);
        values.put(out.get(0), any ? BitState.S1 : BitState.S0);
        break;
      }
      case NOT:
        values.put(out.get(0), value(values, cell.getPort("A").get(0)) == BitState.S1 ? BitState.S0 : BitState.S1);
        break;
      case MUX: {
        SigSpec src = value(values, cell.getPort("S").get(0)) == BitState.S1 ? cell.getPort("B") : cell.getPort("A");
        for (int i = 0; i < out.size(); i++)
          values.put(out.get(i), value(values, src.get(i)));
        break;
      }
      default:
        Assertions.fail("Unexpected cell " + cell);
      }
    }
    int ret = 0;
    for (Connection conn : module.connections())
      for (int i = 0; i < conn.destination().size(); i++)
        if (value(values, conn.source().get(i)) == BitState.S1)
          ret |= 1 << conn.destination().get(i).getOffset();
    return ret;
  }

  private static BitState value(HashMap<SigBit, BitState> values, SigBit bit) {
    if (!bit.isWire())
      return bit.getData();
    BitState ret = values.get(bit);
    Assertions.assertNotNull(ret, "Bit " + bit + " read before it was computed");
    return ret;
  }

  @ParameterizedTest
  @ValueSource(ints = {1, 2, 3, 4, 5, 8})
  void testOneHotSelect(int selects) {
    addPmux(selects, false);
    Assertions.assertEquals(1, new PmuxTreePass().run(module));
    Assertions.assertTrue(module.cells().stream().noneMatch(cell -> cell.getKind() == CellKind.PMUX));
    for (int i = 0; i < selects; i++)
      Assertions.assertEquals(i + 1, evaluate(selects, 1 << i), "select " + i);
    Assertions.assertEquals(15, evaluate(selects, 0), "default");
  }

  @Test
  void testUndefinedDefaultAddsNoWord() {
    addPmux(3, true);
    new PmuxTreePass().run(module);
    long notCells = module.cells().stream().filter(cell -> cell.getKind() == CellKind.NOT).count();
    Assertions.assertEquals(0, notCells);
    Assertions.assertEquals(2, module.cells().stream().filter(cell -> cell.getKind() == CellKind.MUX).count());
    for (int i = 0; i < 3; i++)
      Assertions.assertEquals(i + 1, evaluate(3, 1 << i));
  }

  @Test
  void testSingleSelectWithUndefinedDefault() {
    addPmux(1, true);
    new PmuxTreePass().run(module);
    Assertions.assertTrue(module.cells().isEmpty());
    Assertions.assertEquals(1, module.connections().size());
    Assertions.assertEquals(new SigSpec(b), module.connections().get(0).source());
  }

  @Test
  void testNewNamesArePrefixed() {
    addPmux(4, false);
    new PmuxTreePass().run(module);
    for (Cell cell : module.cells())
      Assertions.assertTrue(cell.getName().startsWith(PmuxTreePass.NAME_PREFIX), cell.getName());
  }
}
