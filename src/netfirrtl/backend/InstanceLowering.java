package netfirrtl.backend;

import java.util.Map;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.CellKind;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.SigSpec;
import netfirrtl.netlist.Wire;
import netfirrtl.util.FIRRTL;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers cells that instantiate another module of the design.
 * <p>
 * An output port connected to a whole wire drives that wire directly. Any other actual is driven through a fresh
 * wire registered in the driver map, since bits() and cat() are not legal connect sinks.
 */
public class InstanceLowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final TranslationContext ctx;
  private final NetlistModule module;
  private final ModuleSections sections;
  private final DriverMap drivers;
  private final SigExprBuilder exprs;
  private final FIRRTL lang;

  public InstanceLowering(TranslationContext ctx, NetlistModule module, ModuleSections sections, DriverMap drivers) {
    this.ctx = ctx;
    this.module = module;
    this.sections = sections;
    this.drivers = drivers;
    this.exprs = new SigExprBuilder(ctx);
    this.lang = ctx.getLang();
  }

  /**
   * Emits the inst statement and one connect per non-empty port connection.
   * An instance of a module missing from the design is skipped with a warning.
   */
  public void lower(Cell cell) throws NetlistLoweringException {
    NetlistModule instModule = ctx.getDesign().module(cell.getType());
    if (instModule == null) {
      ctx.warn(String.format("No instance for %s.%s", cell.getType(), cell.getName()));
      return;
    }

    String cellName = ctx.id(cell.getName());
    String instanceName = ctx.id(cell.getType());
    if (cell.getType().startsWith(CellKind.PARAMOD_PREFIX))
      instanceName = ParamodNames.demangle(instanceName);
    logger.debug("Instance {} of {} in module {}", cellName, instanceName, module.getName());

    sections.wireExprs.add(lang.CreateInst(cellName, instanceName));

    for (Map.Entry<String, SigSpec> conn : cell.getConnections().entrySet()) {
      SigSpec actual = conn.getValue();
      if (actual.isEmpty())
        continue;
      String portName = conn.getKey();
      Wire formal = instModule.wire(portName);
      if (formal == null) {
        ctx.warn(String.format("Instance port %s.%s not found in module %s; connection skipped", cell.getName(), portName, instModule.getName()));
        continue;
      }

      String formalExpr = lang.CreateSubfield(cellName, ctx.id(portName));
      boolean drivesActual;
      switch (formal.getDirection()) {
      case OUTPUT:
        drivesActual = true;
        break;
      case INPUT:
        drivesActual = false;
        break;
      case INOUT:
        if (ctx.getConfig().strict_inout_instance_ports)
          throw new NetlistLoweringException(String.format("Bidirectional port %s.%s on instance %s.%s", instModule.getName(), portName, module.getName(), cell.getName()));
        ctx.warn(String.format("Instance port %s.%s is bidirectional; treated as output", cell.getName(), portName));
        drivesActual = true;
        break;
      case NONE:
        ctx.warn(String.format("Instance port %s.%s has no direction; treated as input", cell.getName(), portName));
        drivesActual = false;
        break;
      default:
        throw new NetlistLoweringException(String.format("Unrecognized direction of instance port %s.%s", cell.getName(), portName));
      }

      if (!drivesActual) {
        sections.wireExprs.add(lang.CreateConnect(formalExpr, exprs.build(actual)));
      } else if (actual.chunks().size() == 1 && actual.chunks().get(0).isWholeWire()) {
        sections.wireExprs.add(lang.CreateConnect(exprs.build(actual), formalExpr));
      } else {
        String yId = ctx.getIds().fresh();
        sections.wireDecls.add(lang.CreateWireDecl(yId, actual.size()));
        sections.wireExprs.add(lang.CreateConnect(yId, formalExpr));
        drivers.register(yId, actual);
      }
    }
    sections.wireExprs.add("\n");
  }
}
