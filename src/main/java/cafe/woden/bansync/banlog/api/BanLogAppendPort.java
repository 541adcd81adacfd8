package cafe.woden.bansync.banlog.api;

import org.jmolecules.architecture.layered.ApplicationLayer;

/** Append-only write access to the ban log. */
@ApplicationLayer
public interface BanLogAppendPort {

  /**
   * Appends {@code record} and rewrites the full log document.
   *
   * @throws cafe.woden.bansync.store.api.DocumentStoreException if the log cannot be read or
   *     written
   */
  void append(BanRecord record);
}
