package dev.dbos.cron.exceptions;

import dev.dbos.cron.job.JobKey;

/**
 * Wraps a failure raised by the action dispatcher while a job fires. It never escapes the timer
 * thread: persisted jobs record it as their error, ephemeral jobs only log it.
 */
public class JobDispatchException extends RuntimeException {
  private final JobKey jobKey;

  public JobDispatchException(JobKey jobKey, Throwable cause) {
    super(
        String.format(
            "Dispatch failed for job %s: %s",
            jobKey, cause.getMessage() != null ? cause.getMessage() : cause.toString()),
        cause);
    this.jobKey = jobKey;
  }

  public JobKey jobKey() {
    return jobKey;
  }

  /** Human readable reason stored on the job record. */
  public String reason() {
    var cause = getCause();
    return cause.getMessage() != null ? cause.getMessage() : cause.toString();
  }
}
