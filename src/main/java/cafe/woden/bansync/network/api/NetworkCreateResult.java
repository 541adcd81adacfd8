package cafe.woden.bansync.network.api;

public enum NetworkCreateResult {
  CREATED,
  ALREADY_EXISTS
}
