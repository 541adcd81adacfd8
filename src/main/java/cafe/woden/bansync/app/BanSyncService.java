package cafe.woden.bansync.app;

import cafe.woden.bansync.app.api.CallerContext;
import cafe.woden.bansync.app.api.FailureKind;
import cafe.woden.bansync.app.api.LeaveOutcome;
import cafe.woden.bansync.app.api.OperationResult;
import cafe.woden.bansync.banlog.api.BanLogQueryPort;
import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.network.api.NetworkCreateResult;
import cafe.woden.bansync.network.api.NetworkJoinResult;
import cafe.woden.bansync.network.api.NetworkLeaveResult;
import cafe.woden.bansync.network.api.NetworkRegistryCommandPort;
import cafe.woden.bansync.network.api.NetworkRegistryQueryPort;
import cafe.woden.bansync.store.api.DocumentStoreException;
import cafe.woden.bansync.sync.api.PrivilegeOraclePort;
import cafe.woden.bansync.sync.api.SyncBanOutcome;
import cafe.woden.bansync.sync.api.SyncBanPort;
import cafe.woden.bansync.sync.api.SyncBanRequest;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Operation surface for the command layer.
 *
 * <p>Every operation checks the caller's privilege on its own server first and reports failures as
 * values; nothing thrown by the registry, the log or the store escapes.
 */
@Component
@ApplicationLayer
public class BanSyncService {

  private static final Logger log = LoggerFactory.getLogger(BanSyncService.class);

  private final NetworkRegistryCommandPort registryCommands;
  private final NetworkRegistryQueryPort registryQueries;
  private final BanLogQueryPort banLog;
  private final SyncBanPort syncBan;
  private final PrivilegeOraclePort privileges;

  public BanSyncService(
      NetworkRegistryCommandPort registryCommands,
      NetworkRegistryQueryPort registryQueries,
      BanLogQueryPort banLog,
      SyncBanPort syncBan,
      PrivilegeOraclePort privileges) {
    this.registryCommands = Objects.requireNonNull(registryCommands, "registryCommands");
    this.registryQueries = Objects.requireNonNull(registryQueries, "registryQueries");
    this.banLog = Objects.requireNonNull(banLog, "banLog");
    this.syncBan = Objects.requireNonNull(syncBan, "syncBan");
    this.privileges = Objects.requireNonNull(privileges, "privileges");
  }

  public OperationResult<String> createNetwork(CallerContext caller, String networkName) {
    return guarded(
        caller,
        networkName,
        () -> {
          NetworkCreateResult r = registryCommands.create(networkName, caller.serverId());
          if (r == NetworkCreateResult.ALREADY_EXISTS) {
            return OperationResult.failed(
                FailureKind.ALREADY_EXISTS, "Network '" + networkName + "' already exists.");
          }
          return OperationResult.ok(networkName);
        });
  }

  public OperationResult<String> joinNetwork(CallerContext caller, String networkName) {
    return guarded(
        caller,
        networkName,
        () -> {
          NetworkJoinResult r = registryCommands.join(networkName, caller.serverId());
          switch (r) {
            case NOT_FOUND:
              return OperationResult.failed(
                  FailureKind.NOT_FOUND, "Network '" + networkName + "' does not exist.");
            case ALREADY_MEMBER:
              return OperationResult.failed(
                  FailureKind.ALREADY_MEMBER,
                  "This server is already part of the '" + networkName + "' network.");
            default:
              return OperationResult.ok(networkName);
          }
        });
  }

  public OperationResult<LeaveOutcome> leaveNetwork(CallerContext caller, String networkName) {
    return guarded(
        caller,
        networkName,
        () -> {
          NetworkLeaveResult r = registryCommands.leave(networkName, caller.serverId());
          switch (r) {
            case NOT_FOUND:
              return OperationResult.failed(
                  FailureKind.NOT_FOUND, "Network '" + networkName + "' does not exist.");
            case NOT_MEMBER:
              return OperationResult.failed(
                  FailureKind.NOT_MEMBER,
                  "This server is not part of the '" + networkName + "' network.");
            case DELETED:
              return OperationResult.ok(LeaveOutcome.DELETED);
            default:
              return OperationResult.ok(LeaveOutcome.LEFT);
          }
        });
  }

  public OperationResult<List<String>> listNetworksFor(CallerContext caller) {
    return guarded(
        caller, () -> OperationResult.ok(registryQueries.networksContaining(caller.serverId())));
  }

  public OperationResult<List<BanRecord>> recentBans(CallerContext caller, int limit) {
    if (limit < 0) {
      return OperationResult.failed(FailureKind.INVALID_ARGUMENT, "Limit must not be negative.");
    }
    return guarded(caller, () -> OperationResult.ok(banLog.recent(limit)));
  }

  public SyncBanOutcome syncBan(CallerContext caller, String userId, String reason) {
    if (caller == null || caller.serverId().isEmpty()) {
      return new SyncBanOutcome.InvalidRequest("A server is required.");
    }
    if (userId == null || userId.isBlank()) {
      return new SyncBanOutcome.InvalidRequest("A user id is required.");
    }
    SyncBanRequest request =
        new SyncBanRequest(
            caller.serverId(),
            caller.serverName(),
            caller.actorId(),
            caller.actorName(),
            userId,
            reason);
    return syncBan.syncBan(request);
  }

  private <T> OperationResult<T> guarded(
      CallerContext caller, String networkName, Supplier<OperationResult<T>> action) {
    if (networkName == null || networkName.isBlank()) {
      return OperationResult.failed(FailureKind.INVALID_ARGUMENT, "A network name is required.");
    }
    return guarded(caller, action);
  }

  private <T> OperationResult<T> guarded(
      CallerContext caller, Supplier<OperationResult<T>> action) {
    if (caller == null || caller.serverId().isEmpty()) {
      return OperationResult.failed(FailureKind.INVALID_ARGUMENT, "A server is required.");
    }
    if (!isPrivileged(caller)) {
      return OperationResult.failed(
          FailureKind.PERMISSION_DENIED,
          "You need administrator permissions to use this command.");
    }
    try {
      return action.get();
    } catch (DocumentStoreException e) {
      log.warn("[bansync] Storage failure for server {}", caller.serverId(), e);
      return OperationResult.failed(FailureKind.PERSISTENCE_FAILURE, e.getMessage());
    }
  }

  private boolean isPrivileged(CallerContext caller) {
    try {
      return privileges.isPrivileged(caller.actorId(), caller.serverId());
    } catch (RuntimeException e) {
      log.warn(
          "[bansync] Privilege check for {} on {} failed; treating as denied",
          caller.actorId(),
          caller.serverId(),
          e);
      return false;
    }
  }
}
