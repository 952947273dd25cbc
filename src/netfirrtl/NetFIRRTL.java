package netfirrtl;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import netfirrtl.backend.ModuleLowering;
import netfirrtl.backend.ModuleSections;
import netfirrtl.backend.NetlistLoweringException;
import netfirrtl.backend.TranslationContext;
import netfirrtl.netlist.Design;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.Wire;
import netfirrtl.passes.PmuxTreePass;
import netfirrtl.ui.NetFIRRTLConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point of the lowering: writes a whole design as one FIRRTL circuit.
 */
public class NetFIRRTL {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private NetFIRRTLConfig cfg;
  private List<String> warnings = new ArrayList<>();

  public NetFIRRTL() { this(new NetFIRRTLConfig()); }

  public NetFIRRTL(NetFIRRTLConfig cfg) { this.cfg = cfg; }

  public void SetConfig(NetFIRRTLConfig cfg) { this.cfg = cfg; }
  public NetFIRRTLConfig GetConfig() { return cfg; }

  /** Recoverable problems reported by the last {@link #Write(Design, Writer)}. */
  public List<String> GetWarnings() { return Collections.unmodifiableList(warnings); }

  /**
   * Returns the top module: the explicitly set one, else the first with a true top attribute, else the last module.
   * @throws IllegalArgumentException if the design has no modules
   */
  public static NetlistModule SelectTop(Design design) {
    if (design.topModule() != null)
      return design.topModule();
    NetlistModule last = null;
    for (NetlistModule module : design.modules()) {
      if (module.getBoolAttribute("top"))
        return module;
      last = module;
    }
    if (last == null)
      throw new IllegalArgumentException("Design has no modules");
    return last;
  }

  /**
   * Lowers every module of the design, in design order, and writes the circuit.
   * Runs the pmuxtree pass first if configured; that pass modifies the design.
   * @throws NetlistLoweringException if a construct cannot be lowered; output may then be incomplete
   */
  public void Write(Design design, Writer out) throws NetlistLoweringException, IOException {
    if (cfg.run_pmuxtree)
      new PmuxTreePass().run(design);

    NetlistModule top = SelectTop(design);
    TranslationContext ctx = new TranslationContext(design, cfg);
    ctx.getIds().reset();
    // Module and port names are allocated first so they keep their spelling.
    for (NetlistModule module : design.modules()) {
      ctx.id(module.getName());
      for (Wire port : module.ports())
        ctx.id(port.getName());
    }

    logger.info("Writing circuit with top module {}", top.getName());
    out.write(ctx.getLang().CreateCircuitHeader(ctx.id(top.getName())));
    try {
      for (NetlistModule module : design.modules()) {
        ModuleSections sections = new ModuleLowering(ctx, module).run();
        sections.write(out);
      }
    } finally {
      warnings = new ArrayList<>(ctx.getWarnings());
    }
    out.flush();
  }
}
