package dev.dbos.cron.exceptions;

import dev.dbos.cron.job.JobKey;

/**
 * {@code NonExistentJobException} is thrown when a job is cancelled by key but either no live
 * timer is registered for that key, or the persisted record for it cannot be found.
 *
 * <p>Cancelling a job twice, or cancelling a one-shot job after it has fired, produces this
 * error. It is never ignored silently.
 */
public class NonExistentJobException extends RuntimeException {
  private final JobKey jobKey;

  public NonExistentJobException(JobKey jobKey) {
    this(jobKey, String.format("Job does not exist %s", jobKey));
  }

  public NonExistentJobException(JobKey jobKey, String message) {
    super(message);
    this.jobKey = jobKey;
  }

  public static NonExistentJobException noLiveTimer(JobKey jobKey) {
    return new NonExistentJobException(
        jobKey, String.format("No live timer for job %s", jobKey));
  }

  /** Key of the job that was targeted, but did not exist */
  public JobKey jobKey() {
    return jobKey;
  }
}
