package cafe.woden.bansync.network.api;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.DomainLayer;

/**
 * A named group of servers sharing ban decisions.
 *
 * <p>{@code members} is ordered by join time and never contains duplicates. The owner is the
 * server that created the network; it is informational only and may no longer be a member.
 */
@DomainLayer
public record Network(String name, String ownerServerId, List<String> members, Instant createdAt) {

  public Network {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(createdAt, "createdAt");
    ownerServerId = Objects.toString(ownerServerId, "");
    List<String> distinct = new ArrayList<>();
    if (members != null) {
      for (String m : members) {
        if (m != null && !m.isBlank() && !distinct.contains(m)) distinct.add(m);
      }
    }
    members = List.copyOf(distinct);
  }

  public static Network founded(String name, String ownerServerId, Instant createdAt) {
    return new Network(name, ownerServerId, List.of(ownerServerId), createdAt);
  }

  public boolean hasMember(String serverId) {
    return members.contains(serverId);
  }

  public Network withMember(String serverId) {
    if (hasMember(serverId)) return this;
    List<String> next = new ArrayList<>(members);
    next.add(serverId);
    return new Network(name, ownerServerId, next, createdAt);
  }

  public Network withoutMember(String serverId) {
    List<String> next = new ArrayList<>(members);
    next.remove(serverId);
    return new Network(name, ownerServerId, next, createdAt);
  }
}
