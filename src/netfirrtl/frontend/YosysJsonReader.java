package netfirrtl.frontend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import netfirrtl.netlist.BitState;
import netfirrtl.netlist.Cell;
import netfirrtl.netlist.Const;
import netfirrtl.netlist.Design;
import netfirrtl.netlist.NetlistModule;
import netfirrtl.netlist.PortDirection;
import netfirrtl.netlist.SigBit;
import netfirrtl.netlist.SigSpec;
import netfirrtl.netlist.Wire;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Builds a {@link Design} from the JSON netlist format written by Yosys ({@code write_json}).
 * <p>
 * Nets are numbered in the JSON file. The first wire bit naming a net becomes its canonical bit (input ports first,
 * then the other ports, then the remaining netnames); every further bit naming the same net is connected to it.
 */
public class YosysJsonReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static final String SYNTHETIC_NET_PREFIX = "$net$";

  private static final Pattern BINARY_CONST = Pattern.compile("[01xz]+");

  private final ObjectMapper mapper = new ObjectMapper();

  public Design read(File file) throws IOException { return read(mapper.readTree(file)); }

  public Design read(Reader reader) throws IOException { return read(mapper.readTree(reader)); }

  public Design read(String json) throws IOException { return read(mapper.readTree(json)); }

  /**
   * @throws IOException if the document has no "modules" object
   */
  public Design read(JsonNode root) throws IOException {
    JsonNode modules = root.path("modules");
    if (!modules.isObject())
      throw new IOException("Not a Yosys JSON netlist: missing \"modules\" object");

    Design design = new Design();
    Iterator<Map.Entry<String, JsonNode>> it = modules.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      readModule(design.addModule(entry.getKey()), entry.getValue());
    }
    return design;
  }

  private void readModule(NetlistModule module, JsonNode moduleNode) throws IOException {
    logger.debug("Reading module {}", module.getName());
    readAttributes(moduleNode.path("attributes")).forEach(module::setAttribute);
    Map<Integer, SigBit> nets = new HashMap<>();

    // Ports keep their JSON order; input ports claim nets first so that aliases never drive an input.
    LinkedHashMap<Wire, JsonNode> portBits = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> ports = moduleNode.path("ports").fields();
    while (ports.hasNext()) {
      Map.Entry<String, JsonNode> entry = ports.next();
      JsonNode bits = entry.getValue().path("bits");
      if (bits.size() == 0) {
        logger.warn("Skipping zero-width port {}.{}", module.getName(), entry.getKey());
        continue;
      }
      PortDirection direction = PortDirection.fromName(entry.getValue().path("direction").asText(""));
      portBits.put(module.addPort(entry.getKey(), bits.size(), direction), bits);
    }
    for (Map.Entry<Wire, JsonNode> entry : portBits.entrySet())
      if (entry.getKey().getDirection() == PortDirection.INPUT)
        bindBits(module, nets, entry.getKey(), entry.getValue());
    for (Map.Entry<Wire, JsonNode> entry : portBits.entrySet())
      if (entry.getKey().getDirection() != PortDirection.INPUT)
        bindBits(module, nets, entry.getKey(), entry.getValue());

    Iterator<Map.Entry<String, JsonNode>> netnames = moduleNode.path("netnames").fields();
    while (netnames.hasNext()) {
      Map.Entry<String, JsonNode> entry = netnames.next();
      if (module.wire(entry.getKey()) != null)
        continue;
      JsonNode bits = entry.getValue().path("bits");
      if (bits.size() == 0)
        continue;
      Wire wire = module.addWire(entry.getKey(), bits.size());
      readAttributes(entry.getValue().path("attributes")).forEach(wire::setAttribute);
      bindBits(module, nets, wire, bits);
    }

    Iterator<Map.Entry<String, JsonNode>> cells = moduleNode.path("cells").fields();
    while (cells.hasNext()) {
      Map.Entry<String, JsonNode> entry = cells.next();
      JsonNode cellNode = entry.getValue();
      String type = cellNode.path("type").asText("");
      if (type.isEmpty())
        throw new IOException("Cell " + module.getName() + "." + entry.getKey() + " has no type");
      Cell cell = module.addCell(entry.getKey(), type);
      readAttributes(cellNode.path("parameters")).forEach(cell::setParam);
      readAttributes(cellNode.path("attributes")).forEach((key, value) -> cell.getAttributes().put(key, value));
      Iterator<Map.Entry<String, JsonNode>> conns = cellNode.path("connections").fields();
      while (conns.hasNext()) {
        Map.Entry<String, JsonNode> conn = conns.next();
        cell.setPort(conn.getKey(), readSig(module, nets, conn.getValue()));
      }
    }
  }

  /** Claims the nets of bits for wire, or connects wire bits to the nets' canonical bits and to constants. */
  private void bindBits(NetlistModule module, Map<Integer, SigBit> nets, Wire wire, JsonNode bits) throws IOException {
    for (int i = 0; i < bits.size(); i++) {
      JsonNode token = bits.get(i);
      SigBit bit = new SigBit(wire, i);
      if (token.isIntegralNumber()) {
        SigBit canonical = nets.putIfAbsent(token.asInt(), bit);
        if (canonical != null)
          module.connect(new SigSpec(bit), new SigSpec(canonical));
      } else {
        module.connect(new SigSpec(bit), new SigSpec(constBit(token.asText())));
      }
    }
  }

  private SigSpec readSig(NetlistModule module, Map<Integer, SigBit> nets, JsonNode bits) throws IOException {
    List<SigBit> ret = new ArrayList<>(bits.size());
    for (JsonNode token : bits) {
      if (token.isIntegralNumber()) {
        int netId = token.asInt();
        SigBit bit = nets.get(netId);
        if (bit == null) {
          bit = new SigBit(module.addWire(SYNTHETIC_NET_PREFIX + netId, 1), 0);
          nets.put(netId, bit);
        }
        ret.add(bit);
      } else {
        ret.add(constBit(token.asText()));
      }
    }
    return new SigSpec(ret);
  }

  private static SigBit constBit(String token) throws IOException {
    if (token.length() != 1 || "01xz".indexOf(token.charAt(0)) < 0)
      throw new IOException("Unknown bit token \"" + token + "\"");
    return new SigBit(BitState.fromSymbol(token.charAt(0)));
  }

  private static Map<String, Const> readAttributes(JsonNode obj) {
    Map<String, Const> out = new LinkedHashMap<>();
    if (!obj.isObject())
      return out;
    obj.fields().forEachRemaining(e -> out.put(e.getKey(), parseConst(e.getValue())));
    return out;
  }

  /**
   * Decodes a parameter or attribute value: a binary string (MSB first), an integer, or a string constant.
   * Yosys appends a space to string values that would otherwise read as binary.
   */
  static Const parseConst(JsonNode value) {
    if (value.isIntegralNumber())
      return Const.fromInt(value.asLong());
    String text = value.asText();
    if (BINARY_CONST.matcher(text).matches())
      return Const.fromBinaryString(text);
    if (text.endsWith(" ") && BINARY_CONST.matcher(text.substring(0, text.length() - 1)).matches())
      text = text.substring(0, text.length() - 1);
    return Const.fromString(text);
  }
}
