package notifier.rules;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Daily local-time window, inclusive at both ends, compared at minute precision.
 * A window with {@code start} after {@code end} wraps past midnight.
 *
 * @param start first minute of the window
 * @param end   last minute of the window
 * @param zone  zone the window is evaluated in; UTC when null
 */
public record TimeWindow(LocalTime start, LocalTime end, ZoneId zone) {

  public TimeWindow {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    zone = zone == null ? ZoneOffset.UTC : zone;
    start = start.truncatedTo(ChronoUnit.MINUTES);
    end = end.truncatedTo(ChronoUnit.MINUTES);
  }

  public static TimeWindow of(String start, String end) {
    return new TimeWindow(LocalTime.parse(start), LocalTime.parse(end), ZoneOffset.UTC);
  }

  public boolean contains(Instant instant) {
    LocalTime now = instant.atZone(zone).toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    if (start.isAfter(end)) {
      return !now.isBefore(start) || !now.isAfter(end);
    }
    return !now.isBefore(start) && !now.isAfter(end);
  }
}
