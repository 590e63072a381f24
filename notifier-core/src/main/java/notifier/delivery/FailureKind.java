package notifier.delivery;

/**
 * Classification of a delivery failure, for logs and metrics. Every kind is retried
 * the same way by {@link ProviderFailover}.
 */
public enum FailureKind {
  TIMEOUT,
  AUTHENTICATION,
  INVALID_ADDRESS,
  RATE_LIMITED,
  TRANSPORT,
  NOT_CONFIGURED,
  UNKNOWN
}
