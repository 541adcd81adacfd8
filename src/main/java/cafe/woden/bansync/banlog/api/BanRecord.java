package cafe.woden.bansync.banlog.api;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.jmolecules.architecture.layered.DomainLayer;

/**
 * One audit entry describing a single ban synchronization.
 *
 * <p>{@code networks} are the networks the initiating server belonged to when the ban was issued.
 * {@code userDisplayName} is best effort and may be a placeholder.
 */
@DomainLayer
public record BanRecord(
    String userId,
    String userDisplayName,
    String reason,
    String initiatorServerId,
    String initiatorServerName,
    String initiatorActorId,
    String initiatorActorName,
    Instant timestamp,
    List<String> networks) {

  public BanRecord {
    userId = Objects.toString(userId, "");
    userDisplayName = Objects.toString(userDisplayName, "");
    reason = Objects.toString(reason, "");
    initiatorServerId = Objects.toString(initiatorServerId, "");
    initiatorServerName = Objects.toString(initiatorServerName, "");
    initiatorActorId = Objects.toString(initiatorActorId, "");
    initiatorActorName = Objects.toString(initiatorActorName, "");
    Objects.requireNonNull(timestamp, "timestamp");
    networks = networks == null ? List.of() : List.copyOf(networks);
  }
}
