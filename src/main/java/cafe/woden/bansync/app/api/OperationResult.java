package cafe.woden.bansync.app.api;

import java.util.Objects;

/** Success payload or a named failure. Operations return this instead of throwing. */
public sealed interface OperationResult<T> permits OperationResult.Ok, OperationResult.Failed {

  record Ok<T>(T value) implements OperationResult<T> {}

  record Failed<T>(FailureKind kind, String message) implements OperationResult<T> {
    public Failed {
      Objects.requireNonNull(kind, "kind");
      message = Objects.toString(message, "");
    }
  }

  static <T> OperationResult<T> ok(T value) {
    return new Ok<>(value);
  }

  static <T> OperationResult<T> failed(FailureKind kind, String message) {
    return new Failed<>(kind, message);
  }

  default boolean isOk() {
    return this instanceof Ok<?>;
  }
}
