package cafe.woden.bansync.network.api;

/** Outcome of a server leaving a network. */
public enum NetworkLeaveResult {
  /** The server left and the network still has members. */
  LEFT,
  /** The server was the last member; the network no longer exists. */
  DELETED,
  NOT_FOUND,
  NOT_MEMBER;

  public boolean succeeded() {
    return this == LEFT || this == DELETED;
  }
}
