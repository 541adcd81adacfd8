package cafe.woden.bansync.sync.api;

import java.util.Objects;

/** Terminal state of one ban synchronization. */
public sealed interface SyncBanOutcome
    permits SyncBanOutcome.Synced,
        SyncBanOutcome.InvalidRequest,
        SyncBanOutcome.PermissionDenied,
        SyncBanOutcome.NoNetworks,
        SyncBanOutcome.RegistryUnavailable,
        SyncBanOutcome.LocalBanFailed,
        SyncBanOutcome.AuditFailed {

  /** Local ban applied, fan-out attempted, audit record written. */
  record Synced(SyncBanReport report) implements SyncBanOutcome {
    public Synced {
      Objects.requireNonNull(report, "report");
    }
  }

  /** The request was malformed (for example a blank user id). Nothing was touched. */
  record InvalidRequest(String message) implements SyncBanOutcome {}

  /** Caller lacks privilege on the origin server. Nothing was touched. */
  record PermissionDenied() implements SyncBanOutcome {}

  /** Origin belongs to no network. Nothing was touched. */
  record NoNetworks() implements SyncBanOutcome {}

  /** The registry could not be read. Nothing was touched. */
  record RegistryUnavailable(String message) implements SyncBanOutcome {}

  /** The ban did not take effect on the origin server; no fan-out, no audit record. */
  record LocalBanFailed(BanActuatorException.Kind kind, String message)
      implements SyncBanOutcome {}

  /**
   * Bans were applied (see {@code report}) but the audit record could not be persisted. The bans
   * stay in effect.
   */
  record AuditFailed(SyncBanReport report, String message) implements SyncBanOutcome {}
}
