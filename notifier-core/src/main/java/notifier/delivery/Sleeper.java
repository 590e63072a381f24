package notifier.delivery;

import java.time.Duration;

/**
 * Blocks the calling thread between failover rounds. Replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
