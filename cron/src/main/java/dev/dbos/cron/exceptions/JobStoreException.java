package dev.dbos.cron.exceptions;

import java.sql.SQLException;

/**
 * Thrown when the job store cannot be reached, or rejects a query or update, despite retries.
 * Creation and cancellation surface it to the caller; during launch it aborts recovery.
 */
public class JobStoreException extends RuntimeException {

  public JobStoreException(Throwable e) {
    super(
        String.format(
            "Job store access error:%s %s",
            e instanceof SQLException ? " " + ((SQLException) e).getSQLState() : "",
            e.getMessage()),
        e);
  }

  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
