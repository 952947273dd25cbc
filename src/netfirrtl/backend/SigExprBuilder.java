package netfirrtl.backend;

import netfirrtl.netlist.SigChunk;
import netfirrtl.netlist.SigSpec;
import netfirrtl.util.FIRRTL;

/**
 * Builds FIRRTL value expressions for signals.
 */
public class SigExprBuilder {
  private final IdAllocator ids;
  private final FIRRTL lang;

  public SigExprBuilder(TranslationContext ctx) { this(ctx.getIds(), ctx.getLang()); }

  public SigExprBuilder(IdAllocator ids, FIRRTL lang) {
    this.ids = ids;
    this.lang = lang;
  }

  /**
   * Returns the expression for sig: whole wires by name, partial wires as bits(), constants as hex literals,
   * each higher chunk wrapping the lower ones with cat(). Empty signals yield "".
   */
  public String build(SigSpec sig) {
    String expr = "";
    for (SigChunk chunk : sig.chunks()) {
      String newExpr;
      if (!chunk.isWire())
        newExpr = lang.CreateUIntLiteral(chunk.getData());
      else if (chunk.isWholeWire())
        newExpr = ids.canonicalize(chunk.getWire().getName());
      else
        newExpr = lang.CreateBits(ids.canonicalize(chunk.getWire().getName()), chunk.getOffset() + chunk.getWidth() - 1, chunk.getOffset());

      if (expr.isEmpty())
        expr = newExpr;
      else
        expr = lang.CreateCat(newExpr, expr);
    }
    return expr;
  }
}
