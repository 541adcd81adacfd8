package cafe.woden.bansync.app.api;

public enum LeaveOutcome {
  LEFT,
  /** The caller's server was the last member, so the network was removed. */
  DELETED
}
