package cafe.woden.bansync.sync;

import cafe.woden.bansync.banlog.api.BanLogAppendPort;
import cafe.woden.bansync.banlog.api.BanRecord;
import cafe.woden.bansync.config.BanSyncProperties;
import cafe.woden.bansync.config.ExecutorConfig;
import cafe.woden.bansync.network.api.NetworkRegistryQueryPort;
import cafe.woden.bansync.store.api.DocumentStoreException;
import cafe.woden.bansync.sync.api.BanActuatorException;
import cafe.woden.bansync.sync.api.BanActuatorPort;
import cafe.woden.bansync.sync.api.PrivilegeOraclePort;
import cafe.woden.bansync.sync.api.SyncBanOutcome;
import cafe.woden.bansync.sync.api.SyncBanPort;
import cafe.woden.bansync.sync.api.SyncBanReport;
import cafe.woden.bansync.sync.api.SyncBanRequest;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.core.Single;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs one ban synchronization end to end.
 *
 * <p>Order: privilege check, target resolution, display-name lookup, local ban, fan-out, audit.
 * The local ban is load-bearing: if it fails nothing else happens. Remote bans are isolated from
 * each other and from the local ban; a failed target is logged and not counted. Every target is
 * attempted exactly once before the audit record is written. Nothing is retried or rolled back.
 *
 * <p>An interrupt while waiting for the fan-out stops the wait: targets that have not reported are
 * counted as failed, the audit record is still written, and the interrupt flag is restored before
 * returning.
 */
@Component
@ApplicationLayer
public class BanPropagator implements SyncBanPort {

  private static final Logger log = LoggerFactory.getLogger(BanPropagator.class);

  private final PrivilegeOraclePort privileges;
  private final BanActuatorPort actuator;
  private final NetworkRegistryQueryPort registry;
  private final BanLogAppendPort banLog;
  private final FanoutResolver fanoutResolver;
  private final BanSyncProperties props;
  private final Clock clock;
  private final Scheduler fanoutScheduler;

  public BanPropagator(
      PrivilegeOraclePort privileges,
      BanActuatorPort actuator,
      NetworkRegistryQueryPort registry,
      BanLogAppendPort banLog,
      FanoutResolver fanoutResolver,
      BanSyncProperties props,
      Clock clock,
      @Qualifier(ExecutorConfig.BAN_FANOUT_EXECUTOR) ExecutorService fanoutExecutor) {
    this.privileges = Objects.requireNonNull(privileges, "privileges");
    this.actuator = Objects.requireNonNull(actuator, "actuator");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.banLog = Objects.requireNonNull(banLog, "banLog");
    this.fanoutResolver = Objects.requireNonNull(fanoutResolver, "fanoutResolver");
    this.props = Objects.requireNonNull(props, "props");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.fanoutScheduler =
        Schedulers.from(Objects.requireNonNull(fanoutExecutor, "fanoutExecutor"));
  }

  @Override
  public SyncBanOutcome syncBan(SyncBanRequest request) {
    Objects.requireNonNull(request, "request");
    String origin = request.originServerId();
    String userId = request.userId();

    if (!isPrivileged(request.actorId(), origin)) {
      log.info(
          "[bansync] Denied ban of {} by {} on {}: not privileged",
          userId,
          request.actorId(),
          origin);
      return new SyncBanOutcome.PermissionDenied();
    }

    FanoutTargets targets;
    try {
      targets = fanoutResolver.targetsFor(origin, registry.snapshot());
    } catch (DocumentStoreException e) {
      log.warn("[bansync] Could not read network registry for ban of {} on {}", userId, origin, e);
      return new SyncBanOutcome.RegistryUnavailable(e.getMessage());
    }
    if (!targets.hasNetworks()) {
      return new SyncBanOutcome.NoNetworks();
    }
    log.debug(
        "[bansync] Ban of {} from {}: networks={} targets={}",
        userId,
        origin,
        targets.networkNames(),
        targets.targetServerIds());

    Instant issuedAt = clock.instant();
    String reason = request.reasonOr(props.defaultReason());
    String displayName = resolveDisplayName(userId);

    try {
      Completable.defer(() -> actuator.banUser(origin, userId, props.localReasonPrefix() + reason))
          .blockingAwait();
    } catch (RuntimeException e) {
      restoreInterrupt(e);
      BanActuatorException.Kind kind = BanActuatorException.kindOf(e);
      String message = BanActuatorException.describe(e);
      log.warn("[bansync] Local ban of {} on {} failed ({}): {}", userId, origin, kind, message);
      return new SyncBanOutcome.LocalBanFailed(kind, message);
    }

    String remoteReason = props.remoteReasonPrefix(request.originServerName()) + reason;
    Fanout fanout = fanOut(targets.targetServerIds(), userId, remoteReason);
    try {
      return audit(request, targets, displayName, reason, issuedAt, fanout.results());
    } finally {
      if (fanout.interrupted()) Thread.currentThread().interrupt();
    }
  }

  private SyncBanOutcome audit(
      SyncBanRequest request,
      FanoutTargets targets,
      String displayName,
      String reason,
      Instant issuedAt,
      List<TargetBanResult> results) {
    String userId = request.userId();
    int remoteSuccesses = (int) results.stream().filter(TargetBanResult::succeeded).count();

    List<String> networkNames = List.copyOf(targets.networkNames());
    SyncBanReport report =
        new SyncBanReport(
            userId,
            displayName,
            1 + remoteSuccesses,
            networkNames.size(),
            networkNames,
            targets.targetServerIds().size());

    BanRecord record =
        new BanRecord(
            userId,
            displayName,
            reason,
            request.originServerId(),
            request.originServerName(),
            request.actorId(),
            request.actorName(),
            issuedAt,
            networkNames);
    try {
      banLog.append(record);
    } catch (DocumentStoreException e) {
      log.warn(
          "[bansync] Ban of {} was applied on {} servers but could not be recorded",
          userId,
          report.totalSuccessCount(),
          e);
      return new SyncBanOutcome.AuditFailed(report, e.getMessage());
    }

    log.info(
        "[bansync] Ban of {} initiated by {} synced to {} servers in {} networks",
        userId,
        request.actorName().isEmpty() ? request.actorId() : request.actorName(),
        report.totalSuccessCount(),
        report.networksAffected());
    return new SyncBanOutcome.Synced(report);
  }

  private boolean isPrivileged(String actorId, String serverId) {
    try {
      return privileges.isPrivileged(actorId, serverId);
    } catch (RuntimeException e) {
      log.warn(
          "[bansync] Privilege check for {} on {} failed; treating as denied",
          actorId,
          serverId,
          e);
      return false;
    }
  }

  private String resolveDisplayName(String userId) {
    String placeholder = "Unknown User (" + userId + ")";
    try {
      String name =
          Single.defer(() -> actuator.resolveUserDisplayName(userId))
              .onErrorReturnItem(placeholder)
              .blockingGet();
      return (name == null || name.isBlank()) ? placeholder : name;
    } catch (RuntimeException e) {
      restoreInterrupt(e);
      log.debug("[bansync] Display name lookup for {} failed", userId, e);
      return placeholder;
    }
  }

  private Fanout fanOut(Set<String> targetServerIds, String userId, String reason) {
    if (targetServerIds.isEmpty()) return new Fanout(List.of(), false);
    Map<String, TargetBanResult> reported = new ConcurrentHashMap<>();
    try {
      List<TargetBanResult> results =
          Flowable.fromIterable(targetServerIds)
              .flatMapSingle(
                  serverId ->
                      banOnTarget(serverId, userId, reason)
                          .doOnSuccess(r -> reported.put(serverId, r))
                          .subscribeOn(fanoutScheduler),
                  false,
                  props.fanoutParallelism())
              .toList()
              .blockingGet();
      return new Fanout(results, false);
    } catch (RuntimeException e) {
      if (!(e.getCause() instanceof InterruptedException)) throw e;
      log.warn(
          "[bansync] Interrupted while syncing ban of {}; {} of {} targets reported",
          userId,
          reported.size(),
          targetServerIds.size());
      List<TargetBanResult> results = new ArrayList<>();
      for (String serverId : targetServerIds) {
        TargetBanResult r = reported.get(serverId);
        results.add(r != null ? r : TargetBanResult.failure(serverId, e.getCause()));
      }
      return new Fanout(results, true);
    }
  }

  private Single<TargetBanResult> banOnTarget(String serverId, String userId, String reason) {
    return Completable.defer(() -> actuator.banUser(serverId, userId, reason))
        .toSingleDefault(TargetBanResult.success(serverId))
        .onErrorReturn(err -> TargetBanResult.failure(serverId, err))
        .doOnSuccess(
            r -> {
              if (r.succeeded()) {
                log.info("[bansync] Synced ban of {} to {}", userId, serverId);
              } else {
                log.warn(
                    "[bansync] Failed to sync ban of {} to {} ({}): {}",
                    userId,
                    serverId,
                    r.failureKind(),
                    r.message());
              }
            });
  }

  /** Blocking waits wrap {@link InterruptedException}, which clears the flag. */
  private static void restoreInterrupt(RuntimeException e) {
    if (e.getCause() instanceof InterruptedException) Thread.currentThread().interrupt();
  }

  private record Fanout(List<TargetBanResult> results, boolean interrupted) {}
}
