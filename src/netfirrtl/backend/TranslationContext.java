package netfirrtl.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import netfirrtl.netlist.Design;
import netfirrtl.ui.NetFIRRTLConfig;
import netfirrtl.util.FIRRTL;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * State shared by all module passes of one design translation: identifiers, options and collected warnings.
 */
public class TranslationContext {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final Design design;
  private final NetFIRRTLConfig cfg;
  private final IdAllocator ids = new IdAllocator();
  private final FIRRTL lang = new FIRRTL();
  private final List<String> warnings = new ArrayList<>();

  public TranslationContext(Design design, NetFIRRTLConfig cfg) {
    this.design = design;
    this.cfg = cfg;
  }

  public Design getDesign() { return design; }
  public NetFIRRTLConfig getConfig() { return cfg; }
  public IdAllocator getIds() { return ids; }
  public FIRRTL getLang() { return lang; }

  /** Shorthand for {@link IdAllocator#canonicalize(String)}. */
  public String id(String internalId) { return ids.canonicalize(internalId); }

  /** Logs a recoverable problem and keeps it for the caller. */
  public void warn(String message) {
    logger.warn(message);
    warnings.add(message);
  }

  /** Recoverable problems reported so far, in order. */
  public List<String> getWarnings() { return Collections.unmodifiableList(warnings); }
}
