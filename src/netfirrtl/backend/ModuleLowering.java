package netfirrtl.backend;

import netfirrtl.netlist.Cell;
import netfirrtl.netlist.Connection;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.PortDirection;
import netfirrtl.netlist.Wire;
import netfirrtl.util.FIRRTL;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Lowers one netlist module into its FIRRTL text sections.
 */
public class ModuleLowering {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final TranslationContext ctx;
  private final NetlistModule module;
  private final FIRRTL lang;

  public ModuleLowering(TranslationContext ctx, NetlistModule module) {
    this.ctx = ctx;
    this.module = module;
    this.lang = ctx.getLang();
  }

  public ModuleSections run() throws NetlistLoweringException {
    logger.info("Lowering module {}", module.getName());
    ModuleSections sections = new ModuleSections();
    DriverMap drivers = new DriverMap(module.getName(), ctx.getConfig().strict_multiple_drivers);
    sections.header = lang.CreateModuleHeader(ctx.id(module.getName()));

    for (Wire port : module.ports()) {
      if (port.getDirection() == PortDirection.INOUT)
        throw new NetlistLoweringException(String.format("Module port %s.%s is inout", module.getName(), port.getName()));
      sections.portDecls.add(lang.CreatePortDecl(port.isPortInput(), ctx.id(port.getName()), port.getWidth()));
    }
    for (Wire wire : module.wires()) {
      if (ctx.getConfig().warn_on_init_attribute && wire.hasAttribute("init"))
        ctx.warn(String.format("Initial value (%s) for %s.%s not supported", wire.getAttributes().get("init"), module.getName(), wire.getName()));
      if (!wire.isPort())
        sections.wireDecls.add(lang.CreateWireDecl(ctx.id(wire.getName()), wire.getWidth()));
    }

    CellLowering cells = new CellLowering(ctx, module, sections, drivers);
    for (Cell cell : module.cells())
      cells.lower(cell);

    SigExprBuilder exprs = new SigExprBuilder(ctx);
    for (Connection conn : module.connections()) {
      String yId = ctx.getIds().fresh();
      sections.wireDecls.add(lang.CreateWireDecl(yId, conn.destination().size()));
      sections.cellExprs.add(lang.CreateConnect(yId, exprs.build(conn.source())));
      drivers.register(yId, conn.destination());
    }

    OutputWireResolver resolver = new OutputWireResolver(ctx, sections, drivers);
    for (Wire wire : module.wires()) {
      if (wire.isPortInput())
        continue;
      resolver.resolve(wire);
    }
    return sections;
  }
}
