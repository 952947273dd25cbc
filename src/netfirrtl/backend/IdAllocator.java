package netfirrtl.backend;

import java.util.HashMap;
import java.util.HashSet;

/**
 * Maps netlist identifiers to unique FIRRTL identifiers and issues fresh synthetic ones.
 * One instance covers a whole design run, so names are unique design-wide.
 */
public class IdAllocator {
  private final HashSet<String> usedNames = new HashSet<>();
  private final HashMap<String, String> nameCache = new HashMap<>();
  private int autoidCounter = 0;

  /** Forgets all issued names and restarts the fresh counter. */
  public void reset() {
    usedNames.clear();
    nameCache.clear();
    autoidCounter = 0;
  }

  /**
   * Returns the FIRRTL identifier for a netlist identifier, allocating it on first use.
   * A leading '\' is dropped, characters outside [A-Za-z0-9_] and a leading digit become '_',
   * and '_' is appended until the name is unused.
   */
  public String canonicalize(String internalId) {
    String cached = nameCache.get(internalId);
    if (cached != null)
      return cached;

    String newId = sanitize(internalId);
    while (usedNames.contains(newId))
      newId += '_';

    nameCache.put(internalId, newId);
    usedNames.add(newId);
    return newId;
  }

  /**
   * Returns a new identifier of the form _&lt;n&gt; that has not been issued before.
   */
  public String fresh() {
    String newId;
    do {
      newId = "_" + autoidCounter++;
    } while (usedNames.contains(newId));
    usedNames.add(newId);
    return newId;
  }

  /** True iff the name was issued by {@link #canonicalize(String)} or {@link #fresh()}. */
  public boolean isUsed(String name) { return usedNames.contains(name); }

  static String sanitize(String internalId) {
    String id = internalId.startsWith("\\") ? internalId.substring(1) : internalId;
    if (id.isEmpty())
      return "_";
    char[] chars = id.toCharArray();
    for (int i = 0; i < chars.length; i++) {
      char ch = chars[i];
      if ('a' <= ch && ch <= 'z')
        continue;
      if ('A' <= ch && ch <= 'Z')
        continue;
      if ('0' <= ch && ch <= '9' && i != 0)
        continue;
      if (ch == '_')
        continue;
      chars[i] = '_';
    }
    return new String(chars);
  }
}
