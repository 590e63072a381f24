package notifier;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Local-time window during which a recipient does not want non-critical notifications.
 *
 * <p>Both bounds are inclusive and compared at minute precision. A window whose
 * {@code start} is after its {@code end} spans midnight (e.g. 22:00 to 06:00).
 *
 * @param start first quiet minute, in {@code zone}
 * @param end   last quiet minute, in {@code zone}
 * @param zone  the recipient's timezone
 */
public record QuietHours(LocalTime start, LocalTime end, ZoneId zone) {

  public QuietHours {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    zone = zone == null ? ZoneOffset.UTC : zone;
    start = start.truncatedTo(ChronoUnit.MINUTES);
    end = end.truncatedTo(ChronoUnit.MINUTES);
  }

  /**
   * Parses {@code HH:mm} bounds and a zone id.
   */
  public static QuietHours of(String start, String end, String zone) {
    return new QuietHours(LocalTime.parse(start), LocalTime.parse(end),
        zone == null || zone.isBlank() ? ZoneOffset.UTC : ZoneId.of(zone));
  }

  /**
   * Returns {@code true} if {@code instant}, viewed in this window's zone, falls inside the window.
   */
  public boolean contains(Instant instant) {
    LocalTime local = instant.atZone(zone).toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    if (start.isAfter(end)) {
      return !local.isBefore(start) || !local.isAfter(end);
    }
    return !local.isBefore(start) && !local.isAfter(end);
  }
}
