package notifier.spi;

/**
 * Reports how many jobs a schedule currently has running.
 *
 * <p>Consulted only for schedules with {@code maxConcurrentRuns} set.
 */
@FunctionalInterface
public interface RunCounter {

  /** Counter that always reports zero running jobs. */
  RunCounter NONE = (jobType, scheduleId) -> 0;

  /**
   * @param jobType    the schedule's job type
   * @param scheduleId the schedule id
   * @return number of jobs in a running state
   */
  int countRunning(String jobType, String scheduleId);
}
