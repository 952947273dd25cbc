package netfirrtl.netlist;

/**
 * Direct assignment of source to destination, bypassing any cell. Both sides have the same width.
 */
public record Connection(SigSpec destination, SigSpec source) {
  public Connection {
    if (destination.size() != source.size())
      throw new IllegalArgumentException("Connection width mismatch: " + destination + " (" + destination.size() + ") = " + source + " (" +
                                         source.size() + ")");
  }
}
