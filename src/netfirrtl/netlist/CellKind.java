package netfirrtl.netlist;

import java.util.HashMap;
import java.util.Map;

/**
 * Closed set of cell kinds known to the lowering.
 * Type tags that name another module map to {@link #INSTANCE}; unknown primitive tags map to {@link #UNRECOGNIZED}.
 */
public enum CellKind {
  NOT("$not", Category.UNARY),
  LOGIC_NOT("$logic_not", Category.UNARY),
  NEG("$neg", Category.UNARY),
  REDUCE_AND("$reduce_and", Category.UNARY),
  REDUCE_OR("$reduce_or", Category.UNARY),
  REDUCE_XOR("$reduce_xor", Category.UNARY),
  REDUCE_XNOR("$reduce_xnor", Category.UNARY),
  REDUCE_BOOL("$reduce_bool", Category.UNARY),

  ADD("$add", Category.BINARY),
  SUB("$sub", Category.BINARY),
  MUL("$mul", Category.BINARY),
  DIV("$div", Category.BINARY),
  MOD("$mod", Category.BINARY),
  AND("$and", Category.BINARY),
  OR("$or", Category.BINARY),
  XOR("$xor", Category.BINARY),
  EQ("$eq", Category.BINARY),
  EQX("$eqx", Category.BINARY),
  NE("$ne", Category.BINARY),
  NEX("$nex", Category.BINARY),
  LT("$lt", Category.BINARY),
  LE("$le", Category.BINARY),
  GT("$gt", Category.BINARY),
  GE("$ge", Category.BINARY),
  SHL("$shl", Category.BINARY),
  SSHL("$sshl", Category.BINARY),
  SHR("$shr", Category.BINARY),
  SSHR("$sshr", Category.BINARY),
  LOGIC_AND("$logic_and", Category.BINARY),
  LOGIC_OR("$logic_or", Category.BINARY),

  MUX("$mux", Category.MUX),
  PMUX("$pmux", Category.UNSUPPORTED),
  SHIFT("$shift", Category.SHIFT),
  SHIFTX("$shiftx", Category.SHIFTX),
  MEM("$mem", Category.MEMORY),
  MEMRD("$memrd", Category.MEMORY_PORT),
  MEMWR("$memwr", Category.MEMORY_PORT),
  DFF("$dff", Category.FLIPFLOP),

  INSTANCE(null, Category.INSTANCE),
  UNRECOGNIZED(null, Category.UNSUPPORTED);

  public enum Category { UNARY, BINARY, MUX, SHIFT, SHIFTX, MEMORY, MEMORY_PORT, FLIPFLOP, INSTANCE, UNSUPPORTED }

  /** Prefix of type tags that name a parameterized module specialization. */
  public static final String PARAMOD_PREFIX = "$paramod";

  private static final Map<String, CellKind> byTag = new HashMap<>();
  static {
    for (CellKind kind : values())
      if (kind.tag != null)
        byTag.put(kind.tag, kind);
  }

  private final String tag;
  private final Category category;

  CellKind(String tag, Category category) {
    this.tag = tag;
    this.category = category;
  }

  /** The primitive type tag, null for INSTANCE and UNRECOGNIZED. */
  public String getTag() { return tag; }
  public Category getCategory() { return category; }

  public boolean isShift() { return this == SHL || this == SSHL || this == SHR || this == SSHR; }

  /** Ops whose result is a single comparison or boolean bit. */
  public boolean isBoolean() {
    switch (this) {
    case LOGIC_NOT:
    case REDUCE_AND:
    case REDUCE_OR:
    case REDUCE_XOR:
    case REDUCE_XNOR:
    case REDUCE_BOOL:
    case EQ:
    case EQX:
    case NE:
    case NEX:
    case LT:
    case LE:
    case GT:
    case GE:
    case LOGIC_AND:
    case LOGIC_OR:
      return true;
    default:
      return false;
    }
  }

  /**
   * Classifies a cell type tag.
   * Tags not starting with '$', and parameterized module tags, refer to modules.
   */
  public static CellKind classify(String typeTag) {
    if (!typeTag.startsWith("$") || typeTag.startsWith(PARAMOD_PREFIX))
      return INSTANCE;
    return byTag.getOrDefault(typeTag, UNRECOGNIZED);
  }
}
