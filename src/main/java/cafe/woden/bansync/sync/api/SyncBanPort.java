package cafe.woden.bansync.sync.api;

import org.jmolecules.architecture.layered.ApplicationLayer;

@ApplicationLayer
public interface SyncBanPort {

  /** Ban locally, propagate to every server sharing a network with the origin, and audit. */
  SyncBanOutcome syncBan(SyncBanRequest request);
}
