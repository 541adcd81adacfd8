package cafe.woden.bansync.banlog;

import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.util.IsoTimestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps the ban log document to and from {@link BanRecord}s.
 *
 * <p>Document shape: a JSON array of objects with {@code user_id, user_name, reason,
 * initiator_server, initiator_server_name, initiator_user, initiator_user_name, timestamp,
 * networks}.
 */
final class BanLogCodec {

  private static final Logger log = LoggerFactory.getLogger(BanLogCodec.class);

  static final String EMPTY_DOCUMENT = "[]";

  private final ObjectMapper mapper;
  private final ZoneId legacyZone;

  BanLogCodec(ObjectMapper mapper, ZoneId legacyZone) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.legacyZone = legacyZone;
  }

  List<BanRecord> decode(String json) throws JsonProcessingException {
    List<BanRecord> out = new ArrayList<>();
    int index = 0;
    for (JsonNode row : readRoot(json)) {
      Optional<BanRecord> record = readRecord(row);
      if (record.isPresent()) {
        out.add(record.get());
      } else {
        log.warn("[bansync] Skipping malformed ban log entry #{}", index);
      }
      index++;
    }
    return out;
  }

  /**
   * Returns {@code json} with one row for {@code record} added at the end.
   *
   * <p>Existing rows are carried over as parsed, including rows {@link #decode} skips.
   */
  String append(String json, BanRecord record) throws JsonProcessingException {
    Objects.requireNonNull(record, "record");
    ArrayNode root = readRoot(json);
    ObjectNode row = root.addObject();
    row.put("user_id", record.userId());
    row.put("user_name", record.userDisplayName());
    row.put("reason", record.reason());
    row.put("initiator_server", record.initiatorServerId());
    row.put("initiator_server_name", record.initiatorServerName());
    row.put("initiator_user", record.initiatorActorId());
    row.put("initiator_user_name", record.initiatorActorName());
    row.put("timestamp", IsoTimestamps.format(record.timestamp()));
    ArrayNode networks = row.putArray("networks");
    record.networks().forEach(networks::add);
    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
  }

  private ArrayNode readRoot(String json) throws JsonProcessingException {
    String raw = Objects.toString(json, "").trim();
    if (raw.isEmpty()) return mapper.createArrayNode();

    JsonNode root = mapper.readTree(raw);
    if (root == null || root.isNull() || root.isMissingNode()) return mapper.createArrayNode();
    if (!root.isArray()) {
      throw new IllegalArgumentException("Ban log document must be a JSON array");
    }
    return (ArrayNode) root;
  }

  private Optional<BanRecord> readRecord(JsonNode row) {
    if (row == null || !row.isObject()) return Optional.empty();
    String userId = text(row.get("user_id"));
    if (userId.isEmpty()) return Optional.empty();
    Optional<Instant> ts = IsoTimestamps.parse(text(row.get("timestamp")), legacyZone);
    if (ts.isEmpty()) return Optional.empty();

    List<String> networks = new ArrayList<>();
    JsonNode n = row.get("networks");
    if (n != null && n.isArray()) {
      for (JsonNode item : n) {
        String name = text(item);
        if (!name.isEmpty()) networks.add(name);
      }
    }

    return Optional.of(
        new BanRecord(
            userId,
            text(row.get("user_name")),
            text(row.get("reason")),
            text(row.get("initiator_server")),
            text(row.get("initiator_server_name")),
            text(row.get("initiator_user")),
            text(row.get("initiator_user_name")),
            ts.get(),
            networks));
  }

  private static String text(JsonNode node) {
    if (node == null || node.isNull()) return "";
    if (node.isTextual() || node.isIntegralNumber()) return node.asText();
    return "";
  }
}
