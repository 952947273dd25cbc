package netfirrtl.backend;

/**
 * Fatal error during lowering. Aborts the translation of the whole design.
 */
public class NetlistLoweringException extends Exception {
  private static final long serialVersionUID = 1L;

  public NetlistLoweringException(String message) { super(message); }
}
