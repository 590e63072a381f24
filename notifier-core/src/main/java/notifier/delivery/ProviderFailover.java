package notifier.delivery;

import notifier.Channel;
import notifier.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Sends one message through an ordered list of providers, with rounds of retries.
 *
 * <p>Each round tries the providers in order and returns on the first success; a
 * failing provider is followed immediately by the next one. After a round in which
 * every provider failed, the controller sleeps {@code baseDelay * 2^(round-1)} (capped)
 * and starts the next round, up to {@code maxRetries} rounds. So with two failing
 * providers and {@code maxRetries = 3}, {@code send} is called six times.
 *
 * <p>A runtime exception thrown by a provider counts as a {@link FailureKind#UNKNOWN}
 * failure. If the sleeping thread is interrupted, the interrupt flag is restored and
 * the attempt ends as failed.
 *
 * <p>This class is stateless apart from its collaborators and is thread-safe.
 */
public final class ProviderFailover {
  private static final Logger logger = Logger.getLogger(ProviderFailover.class.getName());

  private final Sleeper sleeper;
  private final Duration maxDelay;
  private final MetricsExporter metrics;

  public ProviderFailover() {
    this(Sleeper.SYSTEM, ChannelRoute.DEFAULT.maxDelay(), MetricsExporter.NOOP);
  }

  /**
   * @param sleeper  pause implementation, replaced in tests
   * @param maxDelay default cap applied by {@link #sendWithFailover(List, OutboundMessage, int, Duration)}
   * @param metrics  metrics exporter
   */
  public ProviderFailover(Sleeper sleeper, Duration maxDelay, MetricsExporter metrics) {
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Sends {@code message} with up to {@code maxRetries} rounds over {@code providers}.
   *
   * <p>The pause after round {@code n} is {@code baseDelay * 2^(n-1)}, capped at this
   * instance's {@code maxDelay}. When {@code baseDelay} exceeds that cap, the cap is
   * raised to {@code baseDelay}, so the first pause is always the one requested.
   *
   * @param providers  providers in preference order
   * @param message    the message
   * @param maxRetries number of rounds, &ge; 1
   * @param baseDelay  pause after the first failed round
   * @return the attempt; never null and never thrown
   */
  public <M extends OutboundMessage> DeliveryAttempt sendWithFailover(
      List<? extends DeliveryProvider<? super M>> providers, M message, int maxRetries, Duration baseDelay) {
    Objects.requireNonNull(baseDelay, "baseDelay");
    Duration cap = baseDelay.compareTo(maxDelay) > 0 ? baseDelay : maxDelay;
    return sendWithFailover(providers, message, new ChannelRoute(maxRetries, baseDelay, cap));
  }

  /**
   * Sends {@code message} using the retry settings of {@code route}.
   */
  public <M extends OutboundMessage> DeliveryAttempt sendWithFailover(
      List<? extends DeliveryProvider<? super M>> providers, M message, ChannelRoute route) {
    Objects.requireNonNull(providers, "providers");
    Objects.requireNonNull(message, "message");
    Objects.requireNonNull(route, "route");
    Channel channel = message.channel();

    if (providers.isEmpty()) {
      logger.log(Level.WARNING, "No providers registered for channel {0}", channel);
      return DeliveryAttempt.failed(null, 0, new AllProvidersFailedException(channel, 0, null));
    }

    RetryPolicy retryPolicy = route.retryPolicy();
    DeliveryException lastError = null;
    String lastProvider = null;
    int sends = 0;

    for (int round = 1; round <= route.maxRetries(); round++) {
      for (DeliveryProvider<? super M> provider : providers) {
        lastProvider = provider.name();
        sends++;
        try {
          SendReceipt receipt = provider.send(message);
          if (sends > 1) {
            metrics.incrementFailover();
            logger.log(Level.INFO, "Delivered via {0} after {1} failed sends",
                new Object[] {provider.name(), sends - 1});
          }
          return DeliveryAttempt.delivered(provider.name(),
              receipt == null ? null : receipt.messageId(), sends);
        } catch (DeliveryException e) {
          lastError = e;
        } catch (RuntimeException e) {
          lastError = new DeliveryException(FailureKind.UNKNOWN,
              e.getMessage() != null ? e.getMessage() : e.getClass().getName(), e);
        }
        logger.log(Level.WARNING, "Provider {0} failed ({1}, round {2}/{3}): {4}",
            new Object[] {provider.name(), lastError.kind(), round, route.maxRetries(), lastError.getMessage()});
      }

      if (round < route.maxRetries()) {
        long delayMs = retryPolicy.computeDelayMs(round);
        if (delayMs > 0) {
          try {
            sleeper.sleep(Duration.ofMillis(delayMs));
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.log(Level.WARNING, "Interrupted between failover rounds for channel {0}", channel);
            break;
          }
        }
      }
    }

    AllProvidersFailedException failure = new AllProvidersFailedException(channel, sends, lastError);
    logger.log(Level.SEVERE, failure.getMessage());
    return DeliveryAttempt.failed(lastProvider, sends, failure);
  }
}
