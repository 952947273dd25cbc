package netfirrtl.backend;

import java.util.ArrayList;
import java.util.List;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.Wire;
import netfirrtl.util.FIRRTL;

/**
 * Assigns every non-input wire of a module from the expressions registered as its drivers.
 * Undriven bits read a shared 1-bit invalid marker wire, declared the first time a module needs it.
 */
public class OutputWireResolver {
  /**
   * A maximal slice of a wire fed by consecutive bits of one driver.
   * @param offset first wire bit
   * @param width number of wire bits
   * @param driver the driver of the first bit, or null for an undriven bit
   */
  public record Run(int offset, int width, DriverMap.Driver driver) {
    public boolean isDriven() { return driver != null; }
  }

  private final TranslationContext ctx;
  private final ModuleSections sections;
  private final DriverMap drivers;
  private final FIRRTL lang;
  private String markerId = null;

  public OutputWireResolver(TranslationContext ctx, ModuleSections sections, DriverMap drivers) {
    this.ctx = ctx;
    this.sections = sections;
    this.drivers = drivers;
    this.lang = ctx.getLang();
  }

  /**
   * Splits the wire into runs. Undriven bits each form a run of width 1.
   */
  public List<Run> runs(Wire wire) {
    List<Run> runs = new ArrayList<>();
    int cursor = 0;
    while (cursor < wire.getWidth()) {
      DriverMap.Driver start = drivers.get(new SigBit(wire, cursor));
      int chunkWidth = 1;
      if (start != null) {
        while (cursor + chunkWidth < wire.getWidth()) {
          DriverMap.Driver stop = drivers.get(new SigBit(wire, cursor + chunkWidth));
          if (stop == null || !stop.exprId().equals(start.exprId()) || stop.offset() != start.offset() + chunkWidth)
            break;
          chunkWidth++;
        }
      }
      runs.add(new Run(cursor, chunkWidth, start));
      cursor += chunkWidth;
    }
    return runs;
  }

  /**
   * Emits the assignment of wire, or marks it invalid if no bit of it is driven.
   */
  public void resolve(Wire wire) {
    String wireId = ctx.id(wire.getName());
    List<Run> runs = runs(wire);
    if (runs.stream().noneMatch(Run::isDriven)) {
      sections.wireDecls.add(lang.CreateInvalid(wireId));
      return;
    }

    String expr = "";
    for (Run run : runs) {
      String newExpr;
      if (!run.isDriven()) {
        newExpr = marker();
      } else {
        DriverMap.Driver driver = run.driver();
        if (driver.offset() == 0 && run.width() == driver.exprWidth())
          newExpr = driver.exprId();
        else
          newExpr = lang.CreateBits(driver.exprId(), driver.offset() + run.width() - 1, driver.offset());
      }
      expr = expr.isEmpty() ? newExpr : lang.CreateCat(newExpr, expr);
    }
    sections.wireExprs.add(lang.CreateConnect(wireId, expr));
  }

  private String marker() {
    if (markerId == null) {
      markerId = ctx.getIds().fresh();
      sections.wireDecls.add(lang.CreateWireDecl(markerId, 1));
      sections.wireDecls.add(lang.CreateInvalid(markerId));
    }
    return markerId;
  }
}
