package notifier;

/**
 * Base class for the unchecked errors raised by the scheduler and dispatch APIs.
 */
public class NotifierException extends RuntimeException {

  public NotifierException(String message) {
    super(message);
  }

  public NotifierException(String message, Throwable cause) {
    super(message, cause);
  }
}
