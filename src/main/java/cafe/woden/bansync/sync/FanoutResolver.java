package cafe.woden.bansync.sync;

import cafe.woden.bansync.network.api.Network;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.jmolecules.architecture.layered.DomainLayer;
import org.springframework.stereotype.Component;

/**
 * Computes the fan-out of a ban.
 *
 * <p>Every network containing the origin is in scope; the targets are the union of their members
 * minus the origin. A server reachable through several shared networks appears once.
 */
@Component
@DomainLayer
public class FanoutResolver {

  public FanoutTargets targetsFor(String originServerId, Map<String, Network> registry) {
    String origin = Objects.toString(originServerId, "").trim();
    Set<String> networkNames = new LinkedHashSet<>();
    Set<String> targets = new LinkedHashSet<>();
    if (origin.isEmpty() || registry == null) return new FanoutTargets(networkNames, targets);

    for (Network n : registry.values()) {
      if (n == null || !n.hasMember(origin)) continue;
      networkNames.add(n.name());
      targets.addAll(n.members());
    }
    targets.remove(origin);
    return new FanoutTargets(networkNames, targets);
  }
}
