package notifier.cron;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Computes the next instant matching a cron expression in a timezone.
 *
 * <p>The search starts at the minute after {@code after} and walks forward in the
 * expression's timezone. Days and hours that cannot match are skipped whole; the
 * result is identical to a minute-by-minute scan. The search is bounded to one year;
 * exhausting it raises {@link NoUpcomingRunException} instead of guessing a fallback.
 *
 * <p>Parsed expressions are cached by their text, keeping the most recently used
 * {@link #DEFAULT_CACHE_SIZE} by default. This class is thread-safe.
 */
public final class CronEvaluator {
  /** Search horizon: one (leap) year. */
  public static final Duration HORIZON = Duration.ofDays(366);

  public static final int DEFAULT_CACHE_SIZE = 256;

  private final Map<String, CronExpression> cache;

  public CronEvaluator() {
    this(DEFAULT_CACHE_SIZE);
  }

  /**
   * @param cacheSize maximum number of parsed expressions kept; {@code 0} disables caching
   */
  public CronEvaluator(int cacheSize) {
    if (cacheSize < 0) {
      throw new IllegalArgumentException("cacheSize must be >= 0");
    }
    this.cache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, CronExpression> eldest) {
        return size() > cacheSize;
      }
    });
  }

  /**
   * Returns the first instant strictly after {@code after}, at a whole minute, that
   * satisfies {@code expression} when viewed in {@code zone}.
   *
   * @throws InvalidCronException   if the expression is malformed
   * @throws NoUpcomingRunException if nothing matches within {@link #HORIZON}
   */
  public Instant next(String expression, ZoneId zone, Instant after) {
    return next(parse(expression), zone, after);
  }

  public Instant next(CronExpression cron, ZoneId zone, Instant after) {
    Objects.requireNonNull(cron, "cron");
    Objects.requireNonNull(zone, "zone");
    Objects.requireNonNull(after, "after");

    Instant start = after.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
    Instant limit = start.plus(HORIZON);
    ZonedDateTime candidate = start.atZone(zone);

    while (candidate.toInstant().isBefore(limit)) {
      if (!cron.matchesDay(candidate.toLocalDate())) {
        candidate = candidate.toLocalDate().plusDays(1).atStartOfDay(zone);
        continue;
      }
      if (!cron.matchesHour(candidate.getHour())) {
        candidate = candidate.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        continue;
      }
      if (cron.matches(candidate)) {
        return candidate.toInstant();
      }
      candidate = candidate.plusMinutes(1);
    }
    throw new NoUpcomingRunException(cron.expression(), zone, after);
  }

  /**
   * Parses (or fetches from cache) an expression.
   *
   * @throws InvalidCronException if the expression is malformed
   */
  public CronExpression parse(String expression) {
    Objects.requireNonNull(expression, "expression");
    CronExpression cached = cache.get(expression);
    if (cached != null) {
      return cached;
    }
    CronExpression parsed = CronExpression.parse(expression);
    cache.putIfAbsent(expression, parsed);
    return parsed;
  }

  int cachedCount() {
    return cache.size();
  }

  /**
   * Returns {@code true} if the expression parses.
   */
  public boolean isValid(String expression) {
    try {
      parse(expression);
      return true;
    } catch (InvalidCronException e) {
      return false;
    }
  }
}
