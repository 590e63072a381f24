package notifier;

/**
 * Thrown when a schedule definition or update is rejected, e.g. because its cron
 * expression does not parse. Never coerced into a default schedule.
 */
public class InvalidScheduleException extends NotifierException {

  public InvalidScheduleException(String message) {
    super(message);
  }

  public InvalidScheduleException(String message, Throwable cause) {
    super(message, cause);
  }
}
