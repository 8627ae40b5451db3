package dev.dbos.cron.exceptions;

/**
 * Thrown synchronously when a job request carries malformed fields or an unparsable time
 * specification. Nothing is persisted and no timer is registered.
 */
public class InvalidJobException extends RuntimeException {

  public InvalidJobException(String message) {
    super(message);
  }

  public InvalidJobException(String message, Throwable cause) {
    super(message, cause);
  }
}
