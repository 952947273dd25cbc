package netfirrtl.backend;

import netfirrtl.netlist.BitState;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.SigSpec;
import netfirrtl.util.FIRRTL;

/**
 * Lowers multi-port $mem cells to a FIRRTL mem block with combinational read ports and clocked write ports.
 */
public class MemoryLowering {
  private final TranslationContext ctx;
  private final NetlistModule module;
  private final ModuleSections sections;
  private final DriverMap drivers;
  private final SigExprBuilder exprs;
  private final FIRRTL lang;

  public MemoryLowering(TranslationContext ctx, NetlistModule module, ModuleSections sections, DriverMap drivers) {
    this.ctx = ctx;
    this.module = module;
    this.sections = sections;
    this.drivers = drivers;
    this.exprs = new SigExprBuilder(ctx);
    this.lang = ctx.getLang();
  }

  public void lower(Cell cell) throws NetlistLoweringException {
    String memId = ctx.id(cell.getName());
    int abits = cell.getParam("ABITS").asInt();
    int width = cell.getParam("WIDTH").asInt();
    int size = cell.getParam("SIZE").asInt();
    int rdPorts = cell.getParam("RD_PORTS").asInt();
    int wrPorts = cell.getParam("WR_PORTS").asInt();

    if (cell.hasParam("INIT")) {
      for (BitState bit : cell.getParam("INIT").getBits())
        if (bit != BitState.Sx)
          throw new NetlistLoweringException(String.format("Memory with initialization data: %s.%s", module.getName(), cell.getName()));
    }
    if (cell.hasParam("OFFSET") && cell.getParam("OFFSET").asInt() != 0)
      throw new NetlistLoweringException(String.format("Memory with nonzero offset: %s.%s", module.getName(), cell.getName()));

    sections.cellExprs.add(lang.CreateMemBlock(memId, width, size, rdPorts, wrPorts));

    Const rdClkEnable = cell.getParam("RD_CLK_ENABLE");
    for (int i = 0; i < rdPorts; i++) {
      if (rdClkEnable.get(i) != BitState.S0)
        throw new NetlistLoweringException(String.format("Clocked read port %d on memory %s.%s", i, module.getName(), cell.getName()));

      String portName = lang.ReadPortName(i);
      SigSpec dataSig = cell.getPort("RD_DATA").extract(i * width, width);
      String addrExpr = exprs.build(cell.getPort("RD_ADDR").extract(i * abits, abits));

      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "addr"), addrExpr));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "en"), lang.dictionary.get(FIRRTL.DictWords.OneBit)));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "clk"), lang.CreateAsClock(lang.dictionary.get(FIRRTL.DictWords.ZeroBit))));

      drivers.register(lang.CreateSubfield(memId, portName, "data"), dataSig);
    }

    Const wrClkEnable = cell.getParam("WR_CLK_ENABLE");
    Const wrClkPolarity = cell.getParam("WR_CLK_POLARITY");
    for (int i = 0; i < wrPorts; i++) {
      if (wrClkEnable.get(i) != BitState.S1)
        throw new NetlistLoweringException(String.format("Unclocked write port %d on memory %s.%s", i, module.getName(), cell.getName()));
      if (wrClkPolarity.get(i) != BitState.S1)
        throw new NetlistLoweringException(String.format("Negedge write port %d on memory %s.%s", i, module.getName(), cell.getName()));

      String portName = lang.WritePortName(i);
      SigSpec enSig = cell.getPort("WR_EN").extract(i * width, width);
      SigBit enBit = enSig.get(0);
      for (SigBit bit : enSig)
        if (!bit.equals(enBit))
          throw new NetlistLoweringException(String.format("Complex write enable on port %d of memory %s.%s", i, module.getName(), cell.getName()));

      String addrExpr = exprs.build(cell.getPort("WR_ADDR").extract(i * abits, abits));
      String dataExpr = exprs.build(cell.getPort("WR_DATA").extract(i * width, width));
      String enExpr = exprs.build(new SigSpec(enBit));
      String clkExpr = lang.CreateAsClock(exprs.build(cell.getPort("WR_CLK").extract(i)));

      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "addr"), addrExpr));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "data"), dataExpr));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "en"), enExpr));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "mask"), lang.dictionary.get(FIRRTL.DictWords.OneBit)));
      sections.cellExprs.add(lang.CreateConnect(lang.CreateSubfield(memId, portName, "clk"), clkExpr));
    }
  }
}
