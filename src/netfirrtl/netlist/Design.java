package netfirrtl.netlist;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Elaborated design: modules in iteration order, an optional explicit top module and a module selection.
 */
public class Design {
  private final LinkedHashMap<String, NetlistModule> modules = new LinkedHashMap<>();
  private String topModuleName = null;
  /** Selected module names; null means the whole design is selected. */
  private Set<String> selection = null;

  public NetlistModule addModule(String name) {
    if (modules.containsKey(name))
      throw new IllegalArgumentException("Design already has a module " + name);
    NetlistModule module = new NetlistModule(name);
    modules.put(name, module);
    return module;
  }

  /** Returns the module with the given name, or null. */
  public NetlistModule module(String name) { return modules.get(name); }

  public Collection<NetlistModule> modules() { return Collections.unmodifiableCollection(modules.values()); }

  /**
   * Explicitly designates the top module.
   * @throws IllegalArgumentException if no such module exists
   */
  public void setTopModule(String name) {
    if (!modules.containsKey(name))
      throw new IllegalArgumentException("No module named " + name);
    this.topModuleName = name;
  }

  /** The explicitly designated top module, or null. */
  public NetlistModule topModule() { return topModuleName == null ? null : modules.get(topModuleName); }

  /**
   * Restricts the selection to the given modules.
   */
  public void select(Collection<String> moduleNames) { this.selection = new LinkedHashSet<>(moduleNames); }

  public void selectAll() { this.selection = null; }

  public boolean isFullySelected() { return selection == null || selection.containsAll(modules.keySet()); }
}
