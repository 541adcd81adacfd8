package cafe.woden.bansync.network.api;

import org.jmolecules.architecture.layered.ApplicationLayer;

/**
 * Membership mutations.
 *
 * <p>Every call loads the full registry, applies the change in memory and rewrites the whole
 * document. Precondition violations are reported through the result and leave the document
 * untouched. Storage failures surface as {@code DocumentStoreException}.
 */
@ApplicationLayer
public interface NetworkRegistryCommandPort {

  NetworkCreateResult create(String networkName, String ownerServerId);

  NetworkJoinResult join(String networkName, String serverId);

  NetworkLeaveResult leave(String networkName, String serverId);
}
