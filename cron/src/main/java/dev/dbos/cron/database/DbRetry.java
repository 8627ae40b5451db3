package dev.dbos.cron.database;

import dev.dbos.cron.exceptions.JobStoreException;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs job store operations, retrying the ones that failed for a transient reason with a
 * jittered exponential backoff. Anything else fails at once as a {@link JobStoreException}.
 */
public final class DbRetry {
  private static final Logger logger = LoggerFactory.getLogger(DbRetry.class);

  // lock_not_available, too_many_connections, query_canceled
  private static final Set<String> RETRIABLE_STATES = Set.of("55P03", "53300", "57014");
  // connection exceptions, transaction rollbacks
  private static final Set<String> RETRIABLE_CLASSES = Set.of("08", "40");

  private DbRetry() {}

  @FunctionalInterface
  public interface StoreCall<T, E extends Exception> {
    T execute() throws E;
  }

  @FunctionalInterface
  public interface StoreUpdate<E extends Exception> {
    void execute() throws E;
  }

  public record Options(
      Duration initialBackoff,
      Duration maxBackoff,
      int maxAttempts,
      Predicate<Throwable> retriablePredicate) {

    public Options {
      Objects.requireNonNull(initialBackoff, "initialBackoff must not be null");
      Objects.requireNonNull(maxBackoff, "maxBackoff must not be null");
      Objects.requireNonNull(retriablePredicate, "retriablePredicate must not be null");
      maxAttempts = Math.max(1, maxAttempts);
    }

    /** 5 attempts, backoff from 500ms doubling up to 10s. */
    public static Options defaults() {
      return new Options(
          Duration.ofMillis(500), Duration.ofSeconds(10), 5, DbRetry::isRetriableSql);
    }

    public Options withInitialBackoff(Duration d) {
      return new Options(d, maxBackoff, maxAttempts, retriablePredicate);
    }

    public Options withMaxBackoff(Duration d) {
      return new Options(initialBackoff, d, maxAttempts, retriablePredicate);
    }

    public Options withMaxAttempts(int n) {
      return new Options(initialBackoff, maxBackoff, n, retriablePredicate);
    }

    /** Pause before the retry following {@code attempt}, with a jitter of plus or minus half. */
    long backoffMillis(int attempt) {
      long base = initialBackoff.toMillis() << Math.min(attempt - 1, 20);
      long capped = Math.min(base, maxBackoff.toMillis());
      double jitter = 0.5 + ThreadLocalRandom.current().nextDouble();
      return Math.max(1L, (long) (capped * jitter));
    }
  }

  public static <T> T call(StoreCall<T, Exception> body) {
    return call(body, Options.defaults());
  }

  public static <T, E extends Exception> T call(StoreCall<T, E> body, Options opts) {
    Objects.requireNonNull(body, "body must not be null");
    Objects.requireNonNull(opts, "opts must not be null");

    for (int attempt = 1; ; attempt++) {
      try {
        return body.execute();
      } catch (Exception e) {
        if (!opts.retriablePredicate().test(e)) {
          throw e instanceof RuntimeException re ? re : new JobStoreException(e);
        }
        if (attempt >= opts.maxAttempts()) {
          throw new JobStoreException(
              "Job store operation failed after %d attempts".formatted(attempt), e);
        }

        long pause = opts.backoffMillis(attempt);
        logger.warn(
            "Job store operation failed (attempt {} of {}): {}. Retrying in {} ms",
            attempt,
            opts.maxAttempts(),
            e.getMessage(),
            pause);
        pause(pause, e);
      }
    }
  }

  public static <E extends Exception> void run(StoreUpdate<E> body) {
    run(body, Options.defaults());
  }

  public static <E extends Exception> void run(StoreUpdate<E> body, Options opts) {
    Objects.requireNonNull(body, "body must not be null");
    call(
        () -> {
          body.execute();
          return null;
        },
        opts);
  }

  private static void pause(long millis, Exception failure) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      var e = new JobStoreException("Interrupted while retrying a job store operation", failure);
      e.addSuppressed(ie);
      throw e;
    }
  }

  /**
   * Transient failures: {@link SQLTransientException}, {@link SQLRecoverableException}, or an
   * SQLState among connection exceptions, rollbacks and the Postgres lock, connection limit and
   * cancellation codes. The whole cause chain is inspected.
   */
  static boolean isRetriableSql(Throwable t) {
    for (Throwable cur = t; cur != null; cur = cur.getCause()) {
      if (cur instanceof SQLTransientException || cur instanceof SQLRecoverableException) {
        return true;
      }
      if (cur instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
        var state = sqlEx.getSQLState();
        if (RETRIABLE_STATES.contains(state)
            || (state.length() >= 2 && RETRIABLE_CLASSES.contains(state.substring(0, 2)))) {
          return true;
        }
      }
    }
    return false;
  }
}
