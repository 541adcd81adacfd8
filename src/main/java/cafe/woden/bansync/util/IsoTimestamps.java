package cafe.woden.bansync.util;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * ISO-8601 helpers for persisted documents.
 *
 * <p>Writes always use the UTC instant form ({@code 2024-05-01T12:00:00Z}). Reads also accept an
 * explicit offset and the offset-less local form that older documents contain; the latter is
 * interpreted in the supplied zone.
 */
public final class IsoTimestamps {

  private static final DateTimeFormatter DISPLAY =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private IsoTimestamps() {}

  public static String format(Instant instant) {
    return Objects.requireNonNull(instant, "instant").toString();
  }

  public static Optional<Instant> parse(String raw, ZoneId legacyZone) {
    String s = Objects.toString(raw, "").trim();
    if (s.isEmpty()) return Optional.empty();
    ZoneId zone = legacyZone == null ? ZoneId.systemDefault() : legacyZone;

    Optional<Instant> parsed = attempt(() -> Instant.parse(s));
    if (parsed.isEmpty()) parsed = attempt(() -> OffsetDateTime.parse(s).toInstant());
    if (parsed.isEmpty()) parsed = attempt(() -> LocalDateTime.parse(s).atZone(zone).toInstant());
    return parsed;
  }

  /** Human-facing rendering, seconds precision. */
  public static String display(Instant instant, ZoneId zone) {
    ZoneId z = zone == null ? ZoneId.systemDefault() : zone;
    return DISPLAY.format(Objects.requireNonNull(instant, "instant").atZone(z));
  }

  private static Optional<Instant> attempt(Supplier<Instant> parser) {
    try {
      return Optional.of(parser.get());
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
