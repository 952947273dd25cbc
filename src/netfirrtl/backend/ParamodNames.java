package netfirrtl.backend;

/**
 * Derives the module name referenced by a parameterized module specialization tag.
 * <p>
 * Replaced characters:
 * <table>
 * <caption>separator characters of mangled tags</caption>
 * <tr><td>{@code \}</td><td>identifier escape</td></tr>
 * <tr><td>{@code =}</td><td>parameter assignment</td></tr>
 * <tr><td>{@code '}</td><td>sized constant marker</td></tr>
 * <tr><td>{@code $}</td><td>internal name marker</td></tr>
 * </table>
 * each becomes {@link #FILLER}. All other characters are kept.
 */
public final class ParamodNames {
  public static final char FILLER = '_';

  private ParamodNames() {}

  public static boolean isSeparator(char ch) { return ch == '\\' || ch == '=' || ch == '\'' || ch == '$'; }

  /**
   * Replaces the separator characters of a mangled type tag with {@link #FILLER}.
   */
  public static String demangle(String mangled) {
    StringBuilder ret = new StringBuilder(mangled.length());
    for (char ch : mangled.toCharArray())
      ret.append(isSeparator(ch) ? FILLER : ch);
    return ret.toString();
  }
}
