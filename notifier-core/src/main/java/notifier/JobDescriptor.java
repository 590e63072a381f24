package notifier;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a schedule creates when it fires: a job type plus string parameters.
 *
 * @param jobType the job type understood by the {@link notifier.spi.JobCreator}
 * @param params  job parameters
 */
public record JobDescriptor(String jobType, Map<String, String> params) {

  public JobDescriptor {
    Objects.requireNonNull(jobType, "jobType");
    params = params == null || params.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(params));
  }

  public static JobDescriptor of(String jobType) {
    return new JobDescriptor(jobType, null);
  }

  /**
   * Returns a copy with {@code extra} merged over the existing parameters.
   */
  public JobDescriptor withParams(Map<String, String> extra) {
    Map<String, String> merged = new LinkedHashMap<>(params);
    merged.putAll(extra);
    return new JobDescriptor(jobType, merged);
  }
}
