package notifier.spi;

import java.util.Objects;

/**
 * Handle of a job created by a {@link JobCreator}.
 *
 * @param id      job id assigned by the job system
 * @param jobType job type
 */
public record Job(String id, String jobType) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(jobType, "jobType");
  }
}
