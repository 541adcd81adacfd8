package cafe.woden.bansync.sync;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Networks in scope for a ban and the distinct remote servers to actuate.
 *
 * <p>Both sets are deduplicated; their iteration order carries no meaning.
 */
public record FanoutTargets(Set<String> networkNames, Set<String> targetServerIds) {

  public FanoutTargets {
    networkNames =
        Collections.unmodifiableSet(
            networkNames == null ? new LinkedHashSet<>() : new LinkedHashSet<>(networkNames));
    targetServerIds =
        Collections.unmodifiableSet(
            targetServerIds == null ? new LinkedHashSet<>() : new LinkedHashSet<>(targetServerIds));
  }

  public boolean hasNetworks() {
    return !networkNames.isEmpty();
  }
}
