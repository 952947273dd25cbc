package netfirrtl.passes;

import java.util.List;
import java.util.stream.Collectors;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.CellKind;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.Design;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.SigSpec;
import netfirrtl.netlist.Wire;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rewrites parallel multiplexers ($pmux) into balanced trees of $mux cells.
 * <p>
 * The select bits are split in halves recursively. Each tree node selects its low half if any select bit of that half is set.
 * A default input that is not fully undefined becomes one more data word, selected when no select bit is set.
 */
public class PmuxTreePass {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String NAME_PREFIX = "$pmuxtree$";

  private int autoidCounter = 0;

  /** Rewrites all $pmux cells of the design. Returns the number of cells replaced. */
  public int run(Design design) {
    int replaced = 0;
    for (NetlistModule module : design.modules())
      replaced += run(module);
    return replaced;
  }

  public int run(NetlistModule module) {
    List<Cell> pmuxCells = module.cells().stream().filter(cell -> cell.getKind() == CellKind.PMUX).collect(Collectors.toList());
    for (Cell cell : pmuxCells) {
      logger.debug("Converting {}.{} to a mux tree", module.getName(), cell.getName());
      SigSpec sigData = new SigSpec().append(cell.getPort("B"));
      SigSpec sigSel = new SigSpec().append(cell.getPort("S"));
      SigSpec sigDefault = cell.getPort("A");

      if (!sigDefault.isFullyUndef()) {
        sigData.append(sigDefault);
        if (!sigSel.isEmpty())
          sigSel.append(not(module, reduceOr(module, sigSel)));
      }

      SigSpec result;
      if (sigSel.isEmpty())
        result = sigDefault;
      else if (sigSel.size() == 1)
        result = sigData;
      else
        result = muxTree(module, sigData, sigSel, new SigSpec());
      module.connect(cell.getPort("Y"), result);
      module.remove(cell);
    }
    return pmuxCells.size();
  }

  /**
   * Builds the tree for the given data words and their select bits.
   * @param selOr collects the signals that are set iff one of sigSel is set
   */
  private SigSpec muxTree(NetlistModule module, SigSpec sigData, SigSpec sigSel, SigSpec selOr) {
    if (sigSel.size() == 1) {
      selOr.append(sigSel);
      return sigData;
    }

    int leftSize = sigSel.size() / 2;
    int leftSizeData = leftSize * (sigData.size() / sigSel.size());
    SigSpec leftData = sigData.extract(0, leftSizeData);
    SigSpec rightData = sigData.extract(leftSizeData, sigData.size() - leftSizeData);
    SigSpec leftSel = sigSel.extract(0, leftSize);
    SigSpec rightSel = sigSel.extract(leftSize, sigSel.size() - leftSize);

    SigSpec leftOr = new SigSpec();
    SigSpec leftResult = muxTree(module, leftData, leftSel, leftOr);
    SigSpec rightResult = muxTree(module, rightData, rightSel, selOr);

    SigSpec leftAny = reduceOr(module, leftOr);
    selOr.append(leftAny);
    return mux(module, rightResult, leftResult, leftAny);
  }

  private SigSpec reduceOr(NetlistModule module, SigSpec sigA) {
    Wire y = module.addWire(newId(module), 1);
    module.addCell(newId(module), CellKind.REDUCE_OR.getTag())
        .setParam("A_SIGNED", Const.fromBool(false))
        .setParam("A_WIDTH", Const.fromInt(sigA.size()))
        .setParam("Y_WIDTH", Const.fromInt(1))
        .setPort("A", sigA)
        .setPort("Y", new SigSpec(y));
    return new SigSpec(y);
  }

  private SigSpec not(NetlistModule module, SigSpec sigA) {
    Wire y = module.addWire(newId(module), 1);
    module.addCell(newId(module), CellKind.NOT.getTag())
        .setParam("A_SIGNED", Const.fromBool(false))
        .setParam("A_WIDTH", Const.fromInt(1))
        .setParam("Y_WIDTH", Const.fromInt(1))
        .setPort("A", sigA)
        .setPort("Y", new SigSpec(y));
    return new SigSpec(y);
  }

  private SigSpec mux(NetlistModule module, SigSpec sigA, SigSpec sigB, SigSpec sigS) {
    Wire y = module.addWire(newId(module), sigA.size());
    module.addCell(newId(module), CellKind.MUX.getTag())
        .setParam("WIDTH", Const.fromInt(sigA.size()))
        .setPort("A", sigA)
        .setPort("B", sigB)
        .setPort("S", sigS)
        .setPort("Y", new SigSpec(y));
    return new SigSpec(y);
  }

  private String newId(NetlistModule module) {
    String id;
    do {
      id = NAME_PREFIX + autoidCounter++;
    } while (module.wire(id) != null || module.cell(id) != null);
    return id;
  }
}
