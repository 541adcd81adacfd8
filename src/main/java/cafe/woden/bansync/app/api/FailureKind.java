package cafe.woden.bansync.app.api;

public enum FailureKind {
  PERMISSION_DENIED,
  INVALID_ARGUMENT,
  NOT_FOUND,
  ALREADY_EXISTS,
  ALREADY_MEMBER,
  NOT_MEMBER,
  PERSISTENCE_FAILURE
}
