package cafe.woden.bansync.network;

import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.network.api.Network;
import cafe.woden.bansync.network.api.NetworkCreateResult;
import cafe.woden.bansync.network.api.NetworkJoinResult;
import cafe.woden.bansync.network.api.NetworkLeaveResult;
import cafe.woden.bansync.network.api.NetworkRegistryCommandPort;
import cafe.woden.bansync.network.api.NetworkRegistryQueryPort;
import cafe.woden.bansync.store.api.DocumentStore;
import cafe.woden.bansync.store.api.DocumentStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Network membership registry persisted as a single document.
 *
 * <p>Nothing is cached: each operation reads the document, and each mutation rewrites it in full.
 * Rows the codec cannot read are written back as they were, and their names stay taken.
 * Mutations are serialized on this instance so concurrent callers in one process cannot lose each
 * other's updates.
 */
@Component
@ApplicationLayer
public class NetworkRegistryService
    implements NetworkRegistryCommandPort, NetworkRegistryQueryPort {

  private static final Logger log = LoggerFactory.getLogger(NetworkRegistryService.class);

  private final DocumentStore store;
  private final String documentName;
  private final NetworkRegistryCodec codec;
  private final Clock clock;

  public NetworkRegistryService(
      DocumentStore store, BanSyncProperties props, ObjectMapper mapper, Clock clock) {
    this.store = Objects.requireNonNull(store, "store");
    this.documentName = props.networksDocument();
    this.codec = new NetworkRegistryCodec(mapper, props.zone());
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /** Document name and empty content, for startup initialization. */
  public String documentName() {
    return documentName;
  }

  public String emptyDocument() {
    return NetworkRegistryCodec.EMPTY_DOCUMENT;
  }

  @Override
  public synchronized NetworkCreateResult create(String networkName, String ownerServerId) {
    String name = requireName(networkName);
    String owner = requireId(ownerServerId);
    NetworkRegistryCodec.RegistryDocument doc = loadDocument();
    if (doc.containsName(name)) return NetworkCreateResult.ALREADY_EXISTS;

    doc.networks().put(name, Network.founded(name, owner, clock.instant()));
    persist(doc);
    log.info("[bansync] Network '{}' created by server {}", name, owner);
    return NetworkCreateResult.CREATED;
  }

  @Override
  public synchronized NetworkJoinResult join(String networkName, String serverId) {
    String name = requireName(networkName);
    String sid = requireId(serverId);
    NetworkRegistryCodec.RegistryDocument doc = loadDocument();
    Network current = doc.networks().get(name);
    if (current == null) return NetworkJoinResult.NOT_FOUND;
    if (current.hasMember(sid)) return NetworkJoinResult.ALREADY_MEMBER;

    doc.networks().put(name, current.withMember(sid));
    persist(doc);
    log.info("[bansync] Server {} joined network '{}'", sid, name);
    return NetworkJoinResult.JOINED;
  }

  @Override
  public synchronized NetworkLeaveResult leave(String networkName, String serverId) {
    String name = requireName(networkName);
    String sid = requireId(serverId);
    NetworkRegistryCodec.RegistryDocument doc = loadDocument();
    Map<String, Network> networks = doc.networks();
    Network current = networks.get(name);
    if (current == null) return NetworkLeaveResult.NOT_FOUND;
    if (!current.hasMember(sid)) return NetworkLeaveResult.NOT_MEMBER;

    Network next = current.withoutMember(sid);
    NetworkLeaveResult result;
    if (next.members().isEmpty()) {
      networks.remove(name);
      result = NetworkLeaveResult.DELETED;
    } else {
      networks.put(name, next);
      result = NetworkLeaveResult.LEFT;
    }
    persist(doc);
    if (result == NetworkLeaveResult.DELETED) {
      log.info(
          "[bansync] Server {} left network '{}'; network deleted (no servers left)", sid, name);
    } else {
      log.info("[bansync] Server {} left network '{}'", sid, name);
    }
    return result;
  }

  @Override
  public List<String> networksContaining(String serverId) {
    String sid = Objects.toString(serverId, "").trim();
    if (sid.isEmpty()) return List.of();
    List<String> names = new ArrayList<>();
    for (Network n : load().values()) {
      if (n.hasMember(sid)) names.add(n.name());
    }
    return List.copyOf(names);
  }

  @Override
  public Map<String, Network> snapshot() {
    return Collections.unmodifiableMap(load());
  }

  private Map<String, Network> load() {
    return loadDocument().networks();
  }

  private synchronized NetworkRegistryCodec.RegistryDocument loadDocument() {
    String json = store.read(documentName);
    try {
      return codec.decodeDocument(json);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DocumentStoreException(
          documentName, "Registry document '" + documentName + "' is not valid JSON", e);
    }
  }

  private void persist(NetworkRegistryCodec.RegistryDocument doc) {
    String json;
    try {
      json = codec.encode(doc.networks(), doc.unreadableRows());
    } catch (JsonProcessingException e) {
      throw new DocumentStoreException(
          documentName, "Could not serialize registry document '" + documentName + "'", e);
    }
    store.overwrite(documentName, json);
  }

  private static String requireName(String networkName) {
    if (networkName == null || networkName.isBlank()) {
      throw new IllegalArgumentException("network name is required");
    }
    return networkName;
  }

  private static String requireId(String serverId) {
    String id = Objects.toString(serverId, "").trim();
    if (id.isEmpty()) throw new IllegalArgumentException("server id is required");
    return id;
  }
}
