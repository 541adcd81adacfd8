package cafe.woden.bansync.network.api;

import java.util.List;
import java.util.Map;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Read operations over a fresh registry snapshot. */
@ApplicationLayer
public interface NetworkRegistryQueryPort {

  /**
   * Names of the networks {@code serverId} belongs to, in snapshot iteration order.
   *
   * <p>The order is stable within one snapshot only; callers must not rely on it across restarts.
   */
  List<String> networksContaining(String serverId);

  /** Full registry keyed by network name, in document order. */
  Map<String, Network> snapshot();
}
