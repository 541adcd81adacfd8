package cafe.woden.bansync.sync;

import cafe.woden.bansync.sync.api.BanActuatorException;

/** Outcome of one remote ban attempt; {@code failureKind} is null on success. */
record TargetBanResult(
    String serverId, boolean succeeded, BanActuatorException.Kind failureKind, String message) {

  static TargetBanResult success(String serverId) {
    return new TargetBanResult(serverId, true, null, "");
  }

  static TargetBanResult failure(String serverId, Throwable error) {
    return new TargetBanResult(
        serverId, false, BanActuatorException.kindOf(error), BanActuatorException.describe(error));
  }
}
