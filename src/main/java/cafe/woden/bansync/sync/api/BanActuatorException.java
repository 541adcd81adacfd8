package cafe.woden.bansync.sync.api;

import java.util.Objects;

/** A ban could not be applied on a server. */
public class BanActuatorException extends RuntimeException {

  public enum Kind {
    /** The platform refused: missing ban permission on that server. */
    FORBIDDEN,
    /** The server could not be reached or is unknown to the platform connection. */
    UNREACHABLE,
    OTHER
  }

  private final Kind kind;

  public BanActuatorException(Kind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public BanActuatorException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }

  /** Classify an arbitrary failure, looking through wrapping exceptions. */
  public static Kind kindOf(Throwable error) {
    Throwable t = error;
    int depth = 0;
    while (t != null && depth++ < 16) {
      if (t instanceof BanActuatorException bae) return bae.kind();
      t = t.getCause();
    }
    return Kind.OTHER;
  }

  /** Best message for logs and user-facing replies. */
  public static String describe(Throwable error) {
    Throwable t = error;
    int depth = 0;
    while (t != null && depth++ < 16) {
      if (t instanceof BanActuatorException) return Objects.toString(t.getMessage(), "");
      t = t.getCause();
    }
    if (error == null) return "";
    String msg = error.getMessage();
    return (msg == null || msg.isBlank()) ? error.getClass().getSimpleName() : msg;
  }
}
