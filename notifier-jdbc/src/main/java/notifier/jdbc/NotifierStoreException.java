package notifier.jdbc;

import notifier.NotifierException;

/**
 * Unchecked exception wrapping JDBC errors raised by the stores in this package.
 */
public final class NotifierStoreException extends NotifierException {
  public NotifierStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
