package netfirrtl.netlist;

/**
 * Logic value of a single constant bit.
 */
public enum BitState {
  S0('0'),
  S1('1'),
  Sx('x'),
  Sz('z');

  private final char symbol;

  BitState(char symbol) { this.symbol = symbol; }

  public char getSymbol() { return symbol; }

  /**
   * Parses a bit symbol as written by netlist dumps ('0', '1', 'x'/'X', 'z'/'Z').
   * @param c the symbol
   * @return the matching BitState
   * @throws IllegalArgumentException if the symbol is not a bit value
   */
  public static BitState fromSymbol(char c) {
    switch (c) {
    case '0':
      return S0;
    case '1':
      return S1;
    case 'x':
    case 'X':
      return Sx;
    case 'z':
    case 'Z':
      return Sz;
    default:
      throw new IllegalArgumentException("Unknown bit symbol '" + c + "'");
    }
  }
}
