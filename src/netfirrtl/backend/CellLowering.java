package netfirrtl.backend;

import netfirrtl.netlist.BitState;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.CellKind;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.SigSpec;
import netfirrtl.util.FIRRTL;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Translates the cells of one module into FIRRTL declarations and statements,
 * registering the generated expressions as drivers of the cell outputs.
 */
public class CellLowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Dynamic shift amounts of this width or wider get clamped; one more than the widest amount FIRRTL accepts. */
  public static final int MAX_DSH_WIDTH_ERROR = 20;

  private final TranslationContext ctx;
  private final NetlistModule module;
  private final ModuleSections sections;
  private final DriverMap drivers;
  private final SigExprBuilder exprs;
  private final FIRRTL lang;
  private final MemoryLowering memories;
  private final InstanceLowering instances;

  public CellLowering(TranslationContext ctx, NetlistModule module, ModuleSections sections, DriverMap drivers) {
    this.ctx = ctx;
    this.module = module;
    this.sections = sections;
    this.drivers = drivers;
    this.exprs = new SigExprBuilder(ctx);
    this.lang = ctx.getLang();
    this.memories = new MemoryLowering(ctx, module, sections, drivers);
    this.instances = new InstanceLowering(ctx, module, sections, drivers);
  }

  /**
   * Lowers a single cell. Unsupported cells are reported as warnings and skipped.
   * @throws NetlistLoweringException on constructs that cannot be translated faithfully
   */
  public void lower(Cell cell) throws NetlistLoweringException {
    logger.trace("Lowering cell {} of type {} in module {}", cell.getName(), cell.getType(), module.getName());
    switch (cell.getKind().getCategory()) {
    case UNARY:
      lowerUnary(cell);
      break;
    case BINARY:
      lowerBinary(cell);
      break;
    case MUX:
      lowerMux(cell);
      break;
    case SHIFT:
      lowerShift(cell);
      break;
    case SHIFTX:
      lowerShiftx(cell);
      break;
    case MEMORY:
      memories.lower(cell);
      break;
    case FLIPFLOP:
      lowerDff(cell);
      break;
    case INSTANCE:
      instances.lower(cell);
      break;
    case MEMORY_PORT:
      ctx.warn(String.format("Standalone memory port cell not supported: %s (%s.%s)", cell.getType(), module.getName(), cell.getName()));
      break;
    case UNSUPPORTED:
      ctx.warn(String.format("Cell type not supported: %s (%s.%s)", cell.getType(), module.getName(), cell.getName()));
      break;
    default:
      throw new IllegalStateException("Unhandled cell category " + cell.getKind().getCategory());
    }
  }

  private void lowerUnary(Cell cell) throws NetlistLoweringException {
    CellKind kind = cell.getKind();
    String yId = ctx.id(cell.getName());
    boolean aSigned = cell.getParam("A_SIGNED").asBool();
    int aWidth = portWidth(cell, "A");
    int yWidth = cell.getParam("Y_WIDTH").asInt();
    String aExpr = exprs.build(cell.getPort("A"));
    sections.wireDecls.add(lang.CreateWireDecl(yId, yWidth));

    if (aSigned)
      aExpr = lang.CreateAsSInt(aExpr);
    // Single-bit results are not widened by the operand.
    if (!kind.isBoolean())
      aExpr = lang.CreatePad(aExpr, yWidth);

    String expr;
    boolean castBack = aSigned && !kind.isBoolean();
    switch (kind) {
    case NOT:
      expr = lang.CreatePrimop("not", aExpr);
      break;
    case NEG:
      // neg is signed-typed even for an unsigned operand
      expr = lang.CreatePrimop("neg", aExpr);
      castBack = true;
      break;
    case LOGIC_NOT:
      expr = lang.CreatePrimop("eq", aExpr, lang.CreateZero(aSigned, aWidth));
      break;
    case REDUCE_AND:
      expr = lang.CreatePrimop("andr", aExpr);
      break;
    case REDUCE_OR:
      expr = lang.CreatePrimop("orr", aExpr);
      break;
    case REDUCE_XOR:
      expr = lang.CreatePrimop("xorr", aExpr);
      break;
    case REDUCE_XNOR:
      expr = lang.CreatePrimop("not", lang.CreatePrimop("xorr", aExpr));
      break;
    case REDUCE_BOOL:
      expr = lang.CreatePrimop("neq", aExpr, lang.CreateZero(aSigned, aWidth));
      break;
    default:
      throw new IllegalStateException("Not a unary cell: " + cell);
    }
    if (castBack)
      expr = lang.CreateAsUInt(expr);

    sections.cellExprs.add(lang.CreateConnect(yId, expr));
    drivers.register(yId, cell.getPort("Y"));
  }

  private void lowerBinary(Cell cell) throws NetlistLoweringException {
    CellKind kind = cell.getKind();
    String yId = ctx.id(cell.getName());
    boolean aSigned = cell.getParam("A_SIGNED").asBool();
    boolean bSigned = cell.getParam("B_SIGNED").asBool();
    int aWidth = portWidth(cell, "A");
    int bWidth = portWidth(cell, "B");
    int yWidth = cell.getParam("Y_WIDTH").asInt();
    SigSpec bSig = cell.getPort("B");
    String aExpr = exprs.build(cell.getPort("A"));
    String bExpr = exprs.build(bSig);
    sections.wireDecls.add(lang.CreateWireDecl(yId, yWidth));

    boolean shift = kind.isShift();
    // A logical right shift keeps the operand unsigned.
    boolean aCast = aSigned && kind != CellKind.SHR;
    // The shift amount is never cast or padded.
    boolean bCast = bSigned && !shift;
    // Unsigned operands are zero extended by the connect, except where the result wraps at the operand width.
    boolean padUnsigned = kind == CellKind.SUB;
    if (aCast)
      aExpr = lang.CreateAsSInt(aExpr);
    if (!kind.isBoolean() && aWidth < yWidth && (aCast || padUnsigned || shift)) {
      if (kind == CellKind.SHR && aSigned)
        // sign extended first, then shifted logically
        aExpr = lang.CreateAsUInt(lang.CreatePad(lang.CreateAsSInt(aExpr), yWidth));
      else
        aExpr = lang.CreatePad(aExpr, yWidth);
    }
    if (bCast)
      bExpr = lang.CreateAsSInt(bExpr);
    if (!shift && !kind.isBoolean() && bWidth < yWidth && (bCast || padUnsigned))
      bExpr = lang.CreatePad(bExpr, yWidth);
    int shiftedWidth = Math.max(aWidth, yWidth);

    String expr;
    boolean alwaysUInt = false;
    switch (kind) {
    case ADD:
      expr = lang.CreatePrimop("add", aExpr, bExpr);
      break;
    case SUB:
      expr = lang.CreatePrimop("sub", aExpr, bExpr);
      break;
    case MUL:
      expr = lang.CreatePrimop("mul", aExpr, bExpr);
      break;
    case DIV:
      expr = lang.CreatePrimop("div", aExpr, bExpr);
      break;
    case MOD:
      expr = lang.CreatePrimop("rem", aExpr, bExpr);
      break;
    case AND:
      expr = lang.CreatePrimop("and", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case OR:
      expr = lang.CreatePrimop("or", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case XOR:
      expr = lang.CreatePrimop("xor", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case EQ:
    case EQX:
      expr = lang.CreatePrimop("eq", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case NE:
    case NEX:
      expr = lang.CreatePrimop("neq", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case LT:
      expr = lang.CreatePrimop("lt", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case LE:
      expr = lang.CreatePrimop("leq", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case GT:
      expr = lang.CreatePrimop("gt", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case GE:
      expr = lang.CreatePrimop("geq", aExpr, bExpr);
      alwaysUInt = true;
      break;
    case SHL:
    case SSHL:
      if (bSig.isFullyConst())
        expr = lang.CreatePrimop("shl", aExpr, String.valueOf(constantShiftAmount(bSig.asConst(), shiftedWidth)));
      else
        expr = lang.CreatePrimop("dshl", aExpr, clampShiftAmount(bExpr, bWidth));
      // FIRRTL widens the result by the shift amount; keep the low bits like Verilog does.
      expr = lang.CreateBits(expr, yWidth - 1, 0);
      break;
    case SHR:
    case SSHR:
      if (bSig.isFullyConst())
        expr = lang.CreatePrimop("shr", aExpr, String.valueOf(constantShiftAmount(bSig.asConst(), shiftedWidth)));
      else
        expr = lang.CreatePrimop("dshr", aExpr, bExpr);
      break;
    case LOGIC_AND:
      expr = lang.CreatePrimop("and", lang.CreatePrimop("neq", aExpr, lang.CreateZero(aSigned)),
                               lang.CreatePrimop("neq", bExpr, lang.CreateZero(bSigned)));
      alwaysUInt = true;
      break;
    case LOGIC_OR:
      expr = lang.CreatePrimop("or", lang.CreatePrimop("neq", aExpr, lang.CreateZero(aSigned)),
                               lang.CreatePrimop("neq", bExpr, lang.CreateZero(bSigned)));
      alwaysUInt = true;
      break;
    default:
      throw new IllegalStateException("Not a binary cell: " + cell);
    }

    if (((aCast || bCast) && !alwaysUInt) || kind == CellKind.SUB)
      expr = lang.CreateAsUInt(expr);

    sections.cellExprs.add(lang.CreateConnect(yId, expr));
    drivers.register(yId, cell.getPort("Y"));
  }

  private void lowerMux(Cell cell) throws NetlistLoweringException {
    String yId = ctx.id(cell.getName());
    int width = cell.getParam("WIDTH").asInt();
    String aExpr = exprs.build(cell.getPort("A"));
    String bExpr = exprs.build(cell.getPort("B"));
    String sExpr = exprs.build(cell.getPort("S"));
    sections.wireDecls.add(lang.CreateWireDecl(yId, width));

    // A is selected by S=0, B by S=1.
    String expr = lang.CreateMux(sExpr, bExpr, aExpr);

    sections.cellExprs.add(lang.CreateConnect(yId, expr));
    drivers.register(yId, cell.getPort("Y"));
  }

  /** assign y = a >> b, where a signed b shifts left for negative values. */
  private void lowerShift(Cell cell) throws NetlistLoweringException {
    String yId = ctx.id(cell.getName());
    int yWidth = cell.getParam("Y_WIDTH").asInt();
    int bWidth = portWidth(cell, "B");
    String aExpr = exprs.build(cell.getPort("A"));
    String bExpr = exprs.build(cell.getPort("B"));
    sections.wireDecls.add(lang.CreateWireDecl(yId, yWidth));

    if (portWidth(cell, "A") < yWidth)
      aExpr = lang.CreatePad(aExpr, yWidth);

    String expr;
    if (cell.getParam("B_SIGNED").asBool()) {
      String bSigned = lang.CreateAsSInt(bExpr);
      // The negated amount is one bit wider than b.
      String leftAmount = lang.CreateAsUInt(lang.CreatePrimop("neg", bSigned));
      String dshl = lang.CreateBits(lang.CreatePrimop("dshl", aExpr, clampShiftAmount(leftAmount, bWidth + 1)), yWidth - 1, 0);
      String dshr = lang.CreatePrimop("dshr", aExpr, bExpr);
      expr = lang.CreateMux(lang.CreatePrimop("lt", bSigned, lang.CreateZero(true, 1)), dshl, dshr);
    } else {
      expr = lang.CreatePrimop("dshr", aExpr, bExpr);
    }

    sections.cellExprs.add(lang.CreateConnect(yId, expr));
    drivers.register(yId, cell.getPort("Y"));
  }

  /** assign y = a[b +: Y_WIDTH], undefined for negative b. */
  private void lowerShiftx(Cell cell) throws NetlistLoweringException {
    String yId = ctx.id(cell.getName());
    int yWidth = cell.getParam("Y_WIDTH").asInt();
    int aWidth = portWidth(cell, "A");
    String aExpr = exprs.build(cell.getPort("A"));
    String bExpr = exprs.build(cell.getPort("B"));
    sections.wireDecls.add(lang.CreateWireDecl(yId, yWidth));

    if (cell.getParam("B_SIGNED").asBool()) {
      int bSign = portWidth(cell, "B") - 1;
      bExpr = lang.CreateValidIf(lang.CreatePrimop("not", lang.CreateBits(bExpr, bSign, bSign)), bExpr);
    }
    String expr = lang.CreatePrimop("dshr", aExpr, bExpr);
    if (yWidth < aWidth)
      expr = lang.CreateBits(expr, yWidth - 1, 0);

    sections.cellExprs.add(lang.CreateConnect(yId, expr));
    drivers.register(yId, cell.getPort("Y"));
  }

  private void lowerDff(Cell cell) throws NetlistLoweringException {
    if (!cell.getParam("CLK_POLARITY").asBool())
      throw new NetlistLoweringException(String.format("Negative edge clock on FF %s.%s.", module.getName(), cell.getName()));

    String qId = ctx.id(cell.getName());
    int width = cell.getParam("WIDTH").asInt();
    String expr = exprs.build(cell.getPort("D"));
    String clkExpr = lang.CreateAsClock(exprs.build(cell.getPort("CLK")));

    sections.wireDecls.add(lang.CreateRegDecl(qId, width, clkExpr));
    sections.cellExprs.add(lang.CreateConnect(qId, expr));
    drivers.register(qId, cell.getPort("Q"));
  }

  /**
   * Limits a dynamic shift amount to the widest amount FIRRTL accepts.
   * Amounts of at least {@link #MAX_DSH_WIDTH_ERROR} bits saturate at the largest representable shift.
   * @param amountExpr the shift amount expression
   * @param amountWidth the width of amountExpr
   */
  String clampShiftAmount(String amountExpr, int amountWidth) {
    if (amountWidth < MAX_DSH_WIDTH_ERROR)
      return amountExpr;
    int maxShiftWidthBits = MAX_DSH_WIDTH_ERROR - 1;
    String maxShift = lang.CreateUInt(maxShiftWidthBits, (1 << maxShiftWidthBits) - 1);
    return lang.CreateMux(lang.CreatePrimop("gt", amountExpr, maxShift), maxShift, lang.CreateBits(amountExpr, maxShiftWidthBits - 1, 0));
  }

  /**
   * Value of a constant shift amount, saturated at width. Shifting a value of width bits by width or more
   * gives the same result as shifting by width.
   */
  static int constantShiftAmount(Const amount, int width) {
    for (int i = Integer.SIZE - 1; i < amount.size(); i++)
      if (amount.get(i) == BitState.S1)
        return width;
    return Math.min(amount.asInt(), width);
  }

  /** Width of an operand: the &lt;port&gt;_WIDTH parameter if present, else the connected signal width. */
  private static int portWidth(Cell cell, String port) {
    String param = port + "_WIDTH";
    return cell.hasParam(param) ? cell.getParam(param).asInt() : cell.getPort(port).size();
  }
}
