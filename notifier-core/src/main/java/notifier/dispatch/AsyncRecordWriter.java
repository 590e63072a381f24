package notifier.dispatch;

import notifier.DeliveryOutcome;
import notifier.DispatchRequest;
import notifier.spi.DispatchRecordStore;
import notifier.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes dispatch records to a {@link DispatchRecordStore} on a single background thread.
 *
 * <p>Records wait in a bounded queue. When the queue is full the record is dropped and a
 * warning logged; store failures are logged and never reach the dispatch caller.
 * {@link #close()} drains the queue for up to the configured timeout.
 */
public final class AsyncRecordWriter implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AsyncRecordWriter.class.getName());

  private static final long QUEUE_POLL_TIMEOUT_MS = 100;

  private final DispatchRecordStore store;
  private final BlockingQueue<PendingRecord> queue;
  private final ExecutorService worker;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final long drainTimeoutMs;

  private record PendingRecord(String dispatchId, DispatchRequest request, List<DeliveryOutcome> outcomes) {
  }

  public AsyncRecordWriter(DispatchRecordStore store, int capacity, long drainTimeoutMs) {
    this.store = Objects.requireNonNull(store, "store");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0");
    }
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.drainTimeoutMs = drainTimeoutMs;
    this.worker = Executors.newSingleThreadExecutor(new DaemonThreadFactory("notifier-records-"));
    worker.submit(this::workerLoop);
  }

  /**
   * Queues a record.
   *
   * @return {@code false} if the writer is closed or the queue is full
   */
  public boolean submit(String dispatchId, DispatchRequest request, List<DeliveryOutcome> outcomes) {
    if (!running.get()) {
      return false;
    }
    boolean accepted = queue.offer(new PendingRecord(dispatchId, request, List.copyOf(outcomes)));
    if (!accepted) {
      logger.log(Level.WARNING, "Record queue full, dropping record for dispatch {0}", dispatchId);
    }
    return accepted;
  }

  public int queued() {
    return queue.size();
  }

  private void workerLoop() {
    while (!Thread.currentThread().isInterrupted()) {
      try {
        PendingRecord record = queue.poll(QUEUE_POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        if (record == null) {
          if (!running.get()) {
            break;
          }
          continue;
        }
        write(record);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      } catch (Throwable t) {
        logger.log(Level.SEVERE, "Record writer loop error", t);
      }
    }
  }

  private void write(PendingRecord record) {
    try {
      store.saveDispatchResult(record.dispatchId(), record.request(), record.outcomes());
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to save dispatch record " + record.dispatchId(), e);
    }
  }

  /**
   * Stops accepting records and waits up to the drain timeout for queued ones.
   */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Record writer did not drain in time, {0} records lost", queue.size());
        worker.shutdownNow();
      }
    } catch (InterruptedException e) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
