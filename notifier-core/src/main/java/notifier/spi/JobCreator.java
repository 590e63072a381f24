package notifier.spi;

import notifier.JobDescriptor;

/**
 * Creates a unit of work in the external job system when a schedule fires.
 *
 * <p>Implementations may throw any runtime exception; the scheduler logs it, reports
 * it to listeners and leaves the schedule's {@code nextRun} unchanged so the next tick
 * retries.
 */
@FunctionalInterface
public interface JobCreator {

  /**
   * Creates a job.
   *
   * @param descriptor job type and parameters, including the firing schedule's metadata
   * @return the created job
   */
  Job createJob(JobDescriptor descriptor);
}
