package notifier.cron;

import notifier.NotifierException;

/**
 * Thrown when a cron expression does not have five fields or a field yields no values.
 */
public class InvalidCronException extends NotifierException {
  private final String expression;

  public InvalidCronException(String expression, String reason) {
    super("Invalid cron expression '" + expression + "': " + reason);
    this.expression = expression;
  }

  public String expression() {
    return expression;
  }
}
