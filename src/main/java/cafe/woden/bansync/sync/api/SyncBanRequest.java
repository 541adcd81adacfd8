package cafe.woden.bansync.sync.api;

import java.util.Objects;

/**
 * A ban issued on {@code originServerId} by {@code actorId}, to be propagated to every network the
 * origin belongs to. Server and actor names are recorded in the audit log only.
 */
public record SyncBanRequest(
    String originServerId,
    String originServerName,
    String actorId,
    String actorName,
    String userId,
    String reason) {

  public SyncBanRequest {
    originServerId = Objects.toString(originServerId, "").trim();
    originServerName = Objects.toString(originServerName, "");
    actorId = Objects.toString(actorId, "").trim();
    actorName = Objects.toString(actorName, "");
    userId = Objects.toString(userId, "").trim();
    reason = reason == null ? "" : reason.trim();
    if (originServerId.isEmpty()) throw new IllegalArgumentException("originServerId is required");
    if (userId.isEmpty()) throw new IllegalArgumentException("userId is required");
  }

  public String reasonOr(String defaultReason) {
    return reason.isEmpty() ? defaultReason : reason;
  }
}
