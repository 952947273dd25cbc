package netfirrtl.ui;

import java.io.InputStream;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

/**
 * Data-Class to hold tool options.
 */
public class NetFIRRTLConfig {

  /** Rewrite $pmux cells into $mux trees before lowering. */
  public boolean run_pmuxtree = true;

  /** Treat a wire bit driven by more than one cell or connection as a fatal error instead of keeping the last driver. */
  public boolean strict_multiple_drivers = false;
  /** Treat an instance port that is bidirectional in the referenced module as a fatal error instead of connecting it as an output. */
  public boolean strict_inout_instance_ports = false;

  public boolean warn_on_init_attribute = true;

  /**
   * Loads options from a YAML mapping whose keys are the field names above. An empty document yields the defaults.
   * @throws org.yaml.snakeyaml.error.YAMLException on malformed YAML or unknown keys
   */
  public static NetFIRRTLConfig load(InputStream in) {
    Yaml yaml = new Yaml(new Constructor(NetFIRRTLConfig.class, new LoaderOptions()));
    NetFIRRTLConfig cfg = yaml.load(in);
    return cfg != null ? cfg : new NetFIRRTLConfig();
  }
}
