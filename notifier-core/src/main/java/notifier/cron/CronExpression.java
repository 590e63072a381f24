package notifier.cron;

import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;

/**
 * Parsed five-field cron expression: minute, hour, day-of-month, month, day-of-week.
 *
 * <p>Each field accepts {@code *}, single values, ranges {@code a-b}, steps
 * ({@code *}{@code /n}, {@code a-b/n}, {@code a/n}) and comma-separated lists of these.
 * Values outside a field's bounds are dropped; a field left with no values is an error.
 * Day-of-week {@code 7} means Sunday, same as {@code 0}.
 *
 * <p>A minute matches only when all five fields match; day-of-month and day-of-week
 * are combined with AND. Instances are immutable and thread-safe.
 */
public final class CronExpression {
  private final String expression;
  private final BitSet minutes;
  private final BitSet hours;
  private final BitSet daysOfMonth;
  private final BitSet months;
  private final BitSet daysOfWeek;

  private CronExpression(String expression, BitSet minutes, BitSet hours, BitSet daysOfMonth,
      BitSet months, BitSet daysOfWeek) {
    this.expression = expression;
    this.minutes = minutes;
    this.hours = hours;
    this.daysOfMonth = daysOfMonth;
    this.months = months;
    this.daysOfWeek = daysOfWeek;
  }

  /**
   * Parses an expression.
   *
   * @param expression the cron expression
   * @return the parsed expression
   * @throws InvalidCronException if the expression is malformed
   */
  public static CronExpression parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    String trimmed = expression.trim();
    String[] parts = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
    if (parts.length != 5) {
      throw new InvalidCronException(expression,
          "expected 5 fields (minute hour day month weekday), got " + parts.length);
    }
    BitSet minutes = parseField(expression, "minute", parts[0], 0, 59);
    BitSet hours = parseField(expression, "hour", parts[1], 0, 23);
    BitSet daysOfMonth = parseField(expression, "day-of-month", parts[2], 1, 31);
    BitSet months = parseField(expression, "month", parts[3], 1, 12);
    BitSet daysOfWeek = parseField(expression, "day-of-week", parts[4], 0, 7);
    if (daysOfWeek.get(7)) {
      daysOfWeek.clear(7);
      daysOfWeek.set(0);
    }
    return new CronExpression(trimmed, minutes, hours, daysOfMonth, months, daysOfWeek);
  }

  private static BitSet parseField(String expression, String name, String field, int min, int max) {
    BitSet values = new BitSet(max + 1);
    for (String part : field.split(",", -1)) {
      if (part.isEmpty()) {
        throw new InvalidCronException(expression, "empty list element in " + name + " field");
      }
      for (int value : expandPart(expression, name, part, min, max)) {
        if (value >= min && value <= max) {
          values.set(value);
        }
      }
    }
    if (values.isEmpty()) {
      throw new InvalidCronException(expression, name + " field '" + field + "' matches no values");
    }
    return values;
  }

  private static List<Integer> expandPart(String expression, String name, String part, int min, int max) {
    int slash = part.indexOf('/');
    String range = slash >= 0 ? part.substring(0, slash) : part;
    int step = 1;
    if (slash >= 0) {
      step = parseNumber(expression, name, part.substring(slash + 1));
      if (step <= 0) {
        throw new InvalidCronException(expression, "step must be positive in " + name + " field");
      }
    }
    if ("*".equals(range)) {
      return rangeOf(min, max, step, min, max);
    }
    int dash = range.indexOf('-');
    if (dash >= 0) {
      int start = parseNumber(expression, name, range.substring(0, dash));
      int end = parseNumber(expression, name, range.substring(dash + 1));
      return rangeOf(start, end, step, min, max);
    }
    int value = parseNumber(expression, name, range);
    return slash >= 0 ? rangeOf(value, max, step, min, max) : List.of(value);
  }

  /**
   * Values {@code start, start + step, ...} up to {@code end}, limited to {@code [min, max]}.
   * Bounds are clamped before expanding, so huge ranges stay cheap.
   */
  private static List<Integer> rangeOf(int start, int end, int step, int min, int max) {
    long first = start;
    if (first < min) {
      long skipped = (min - first + step - 1) / step;
      first += skipped * step;
    }
    long last = Math.min(end, max);
    List<Integer> values = new ArrayList<>();
    for (long v = first; v <= last; v += step) {
      values.add((int) v);
    }
    return values;
  }

  private static int parseNumber(String expression, String name, String token) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      throw new InvalidCronException(expression, "'" + token + "' is not a number in " + name + " field");
    }
  }

  /**
   * Returns {@code true} if the given local date-time (seconds ignored) satisfies all five fields.
   */
  public boolean matches(ZonedDateTime dateTime) {
    return minutes.get(dateTime.getMinute())
        && hours.get(dateTime.getHour())
        && matchesDay(dateTime.toLocalDate());
  }

  boolean matchesDay(LocalDate date) {
    return months.get(date.getMonthValue())
        && daysOfMonth.get(date.getDayOfMonth())
        && daysOfWeek.get(date.getDayOfWeek().getValue() % 7);
  }

  boolean matchesHour(int hour) {
    return hours.get(hour);
  }

  public String expression() {
    return expression;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CronExpression)) return false;
    CronExpression that = (CronExpression) o;
    return minutes.equals(that.minutes) && hours.equals(that.hours)
        && daysOfMonth.equals(that.daysOfMonth) && months.equals(that.months)
        && daysOfWeek.equals(that.daysOfWeek);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minutes, hours, daysOfMonth, months, daysOfWeek);
  }

  @Override
  public String toString() {
    return expression;
  }
}
