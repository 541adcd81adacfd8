package cafe.woden.bansync.banlog;

import cafe.woden.bansync.banlog.api.BanLogAppendPort;
import cafe.woden.bansync.banlog.api.BanLogQueryPort;
import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.store.api.DocumentStore;
import cafe.woden.bansync.store.api.DocumentStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Append-only ban audit trail persisted as a single document. */
@Component
@ApplicationLayer
public class BanLogService implements BanLogAppendPort, BanLogQueryPort {

  private static final Logger log = LoggerFactory.getLogger(BanLogService.class);

  private final DocumentStore store;
  private final String documentName;
  private final BanLogCodec codec;

  public BanLogService(DocumentStore store, BanSyncProperties props, ObjectMapper mapper) {
    this.store = Objects.requireNonNull(store, "store");
    this.documentName = props.banLogDocument();
    this.codec = new BanLogCodec(mapper, props.zone());
  }

  public String documentName() {
    return documentName;
  }

  public String emptyDocument() {
    return BanLogCodec.EMPTY_DOCUMENT;
  }

  @Override
  public synchronized void append(BanRecord record) {
    Objects.requireNonNull(record, "record");
    String json;
    try {
      json = codec.append(store.read(documentName), record);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentStoreException(
          documentName, "Could not append to ban log document '" + documentName + "'", e);
    }
    store.overwrite(documentName, json);
    log.debug("[bansync] Appended ban of {} to '{}'", record.userId(), documentName);
  }

  @Override
  public List<BanRecord> recent(int limit) {
    if (limit < 0) throw new IllegalArgumentException("limit must be >= 0: " + limit);
    if (limit == 0) return List.of();
    List<BanRecord> records = load();
    // List.sort is stable, so equal timestamps keep append order.
    records.sort(Comparator.comparing(BanRecord::timestamp).reversed());
    return List.copyOf(records.subList(0, Math.min(limit, records.size())));
  }

  private synchronized List<BanRecord> load() {
    String json = store.read(documentName);
    try {
      return new ArrayList<>(codec.decode(json));
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentStoreException(
          documentName, "Ban log document '" + documentName + "' is not valid JSON", e);
    }
  }
}
