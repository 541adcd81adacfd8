package cafe.woden.bansync.network.api;

public enum NetworkJoinResult {
  JOINED,
  NOT_FOUND,
  ALREADY_MEMBER
}
