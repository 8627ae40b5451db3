package dev.dbos.cron.database;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.dbos.cron.exceptions.JobStoreException;

import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class DbRetryTest {

  private static final DbRetry.Options FAST =
      DbRetry.Options.defaults()
          .withInitialBackoff(Duration.ofMillis(1))
          .withMaxBackoff(Duration.ofMillis(5))
          .withMaxAttempts(3);

  @Test
  void transientFailuresAreRetried() {
    var attempts = new AtomicInteger();

    var result =
        DbRetry.call(
            () -> {
              if (attempts.incrementAndGet() < 3) {
                throw new SQLException("connection reset", "08006");
              }
              return "ok";
            },
            FAST);

    assertEquals("ok", result);
    assertEquals(3, attempts.get());
  }

  @Test
  void givesUpAfterMaxAttempts() {
    var attempts = new AtomicInteger();

    var e =
        assertThrows(
            JobStoreException.class,
            () ->
                DbRetry.run(
                    () -> {
                      attempts.incrementAndGet();
                      throw new SQLTransientConnectionException("pool exhausted");
                    },
                    FAST));

    assertEquals(3, attempts.get());
    assertInstanceOf(SQLTransientConnectionException.class, e.getCause());
  }

  @Test
  void permanentSqlFailureIsNotRetried() {
    var attempts = new AtomicInteger();
    var cause = new SQLException("relation does not exist", "42P01");

    var e =
        assertThrows(
            JobStoreException.class,
            () ->
                DbRetry.call(
                    () -> {
                      attempts.incrementAndGet();
                      throw cause;
                    },
                    FAST));

    assertEquals(1, attempts.get());
    assertSame(cause, e.getCause());
  }

  @Test
  void runtimeExceptionsPassThrough() {
    var cause = new IllegalStateException("bug");
    var e =
        assertThrows(
            IllegalStateException.class,
            () ->
                DbRetry.call(
                    () -> {
                      throw cause;
                    },
                    FAST));
    assertSame(cause, e);
  }

  @Test
  void retriableSqlStates() {
    assertTrue(DbRetry.isRetriableSql(new SQLException("deadlock", "40P01")));
    assertTrue(DbRetry.isRetriableSql(new SQLException("lock", "55P03")));
    assertTrue(DbRetry.isRetriableSql(new RuntimeException(new SQLException("x", "08001"))));
    assertFalse(DbRetry.isRetriableSql(new SQLException("syntax", "42601")));
    assertFalse(DbRetry.isRetriableSql(new SQLException("no state")));
    assertFalse(DbRetry.isRetriableSql(new IllegalArgumentException()));
  }
}
