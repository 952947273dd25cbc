package netfirrtl.backend;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

/**
 * Generated text of one module, kept in the four sections of the output layout.
 * Each entry is one or more complete lines.
 */
public class ModuleSections {
  /** Module header line. */
  public String header = "";
  /** Port declarations, in port order. */
  public List<String> portDecls = new ArrayList<>();
  /** Wire and register declarations, including invalid markers. */
  public List<String> wireDecls = new ArrayList<>();
  /** Cell statements and memory blocks, in cell order. */
  public List<String> cellExprs = new ArrayList<>();
  /** Output wire resolution and instance connections. */
  public List<String> wireExprs = new ArrayList<>();

  /**
   * Writes the header followed by the four sections, separated by blank lines.
   */
  public void write(Writer out) throws IOException {
    out.write(header);
    for (String str : portDecls)
      out.write(str);
    out.write("\n");
    for (String str : wireDecls)
      out.write(str);
    out.write("\n");
    for (String str : cellExprs)
      out.write(str);
    out.write("\n");
    for (String str : wireExprs)
      out.write(str);
  }

  public boolean isEmpty() { return portDecls.isEmpty() && wireDecls.isEmpty() && cellExprs.isEmpty() && wireExprs.isEmpty(); }
}
