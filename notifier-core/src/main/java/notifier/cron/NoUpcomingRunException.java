package notifier.cron;

import notifier.NotifierException;

import java.time.Instant;
import java.time.ZoneId;

/**
 * Thrown when a valid cron expression has no matching minute within the search horizon
 * (for example {@code 0 0 30 2 *}). Callers must disable or alert; they must not retry
 * the search in a loop.
 */
public class NoUpcomingRunException extends NotifierException {
  private final String expression;

  public NoUpcomingRunException(String expression, ZoneId zone, Instant after) {
    super("Cron expression '" + expression + "' has no run within one year after " + after
        + " in " + zone);
    this.expression = expression;
  }

  public String expression() {
    return expression;
  }
}
