/**
 * Delivery provider abstraction and the failover controller.
 *
 * <p>Providers wrap one transport and make one attempt per call. {@link
 * notifier.delivery.ProviderFailover} owns retries, ordering and backoff.
 */
package notifier.delivery;
