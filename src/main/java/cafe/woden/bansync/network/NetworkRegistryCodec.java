package cafe.woden.bansync.network;

import cafe.woden.bansync.network.api.Network;
import cafe.woden.bansync.util.IsoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the registry document to and from {@link Network}s.
 *
 * <p>Document shape: {@code {"<name>": {"owner": id, "servers": [id...], "created_at": iso}}}.
 * Ids may be stored as JSON strings or numbers. Rows without members or with a malformed shape are
 * not exposed as networks; they are kept as raw JSON and written back unchanged.
 */
final class NetworkRegistryCodec {

  private static final Logger log = LoggerFactory.getLogger(NetworkRegistryCodec.class);

  static final String EMPTY_DOCUMENT = "{}";

  private final ObjectMapper mapper;
  private final ZoneId legacyZone;

  NetworkRegistryCodec(ObjectMapper mapper, ZoneId legacyZone) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.legacyZone = legacyZone;
  }

  /** Registry rows split into readable networks and rows kept verbatim. */
  record RegistryDocument(Map<String, Network> networks, Map<String, JsonNode> unreadableRows) {

    boolean containsName(String name) {
      return networks.containsKey(name) || unreadableRows.containsKey(name);
    }
  }

  Map<String, Network> decode(String json) throws JsonProcessingException {
    return decodeDocument(json).networks();
  }

  RegistryDocument decodeDocument(String json) throws JsonProcessingException {
    Map<String, Network> out = new LinkedHashMap<>();
    Map<String, JsonNode> unreadable = new LinkedHashMap<>();
    RegistryDocument doc = new RegistryDocument(out, unreadable);
    String raw = Objects.toString(json, "").trim();
    if (raw.isEmpty()) return doc;

    JsonNode root = mapper.readTree(raw);
    if (root == null || root.isNull() || root.isMissingNode()) return doc;
    if (!root.isObject()) {
      throw new IllegalArgumentException("Registry document must be a JSON object");
    }

    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> e = fields.next();
      String name = e.getKey();
      JsonNode row = e.getValue();
      if (name == null || name.isEmpty() || row == null || !row.isObject()) {
        log.warn("[bansync] Skipping malformed registry row '{}'", name);
        unreadable.put(name, row);
        continue;
      }

      List<String> servers = readIds(row.get("servers"));
      if (servers.isEmpty()) {
        log.warn("[bansync] Skipping network '{}' with no readable member servers", name);
        unreadable.put(name, row);
        continue;
      }

      String owner = idText(row.get("owner"));
      Instant createdAt =
          IsoTimestamps.parse(textOrEmpty(row.get("created_at")), legacyZone)
              .orElseGet(
                  () -> {
                    log.warn("[bansync] Network '{}' has no readable created_at", name);
                    return Instant.EPOCH;
                  });
      out.put(name, new Network(name, owner, servers, createdAt));
    }
    return doc;
  }

  /** Writes {@code networks} followed by {@code unreadableRows}, the latter unchanged. */
  String encode(Map<String, Network> networks, Map<String, JsonNode> unreadableRows)
      throws JsonProcessingException {
    ObjectNode root = mapper.createObjectNode();
    if (networks != null) {
      for (Network n : networks.values()) {
        if (n == null || n.members().isEmpty()) continue;
        ObjectNode row = root.putObject(n.name());
        row.put("owner", n.ownerServerId());
        ArrayNode servers = row.putArray("servers");
        n.members().forEach(servers::add);
        row.put("created_at", IsoTimestamps.format(n.createdAt()));
      }
    }
    if (unreadableRows != null) {
      unreadableRows.forEach(
          (name, row) -> {
            if (!root.has(name)) root.set(name, row);
          });
    }
    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
  }

  private static List<String> readIds(JsonNode node) {
    List<String> ids = new ArrayList<>();
    if (node == null || !node.isArray()) return ids;
    for (JsonNode item : node) {
      String id = idText(item);
      if (!id.isEmpty()) ids.add(id);
    }
    return ids;
  }

  static String idText(JsonNode node) {
    if (node == null || node.isNull()) return "";
    if (node.isTextual() || node.isIntegralNumber()) return node.asText().trim();
    return "";
  }

  private static String textOrEmpty(JsonNode node) {
    return (node == null || !node.isTextual()) ? "" : node.asText();
  }
}
