package dev.dbos.cron;

import dev.dbos.cron.config.CronConfig;
import dev.dbos.cron.database.JobDatabase;

import java.util.concurrent.atomic.AtomicInteger;

import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Starts one Postgres container per test class. Subclasses are annotated with
 * {@code @Testcontainers(disabledWithoutDocker = true)} so they are skipped on hosts without
 * Docker.
 */
public class DbSetupTestBase {

  protected static final PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>("postgres:16-alpine");

  private static final AtomicInteger schemaCounter = new AtomicInteger();

  protected static CronConfig cronConfig;
  protected static HikariDataSource dataSource;

  @BeforeAll
  static void onetimeSetup() {
    postgres.start();
    cronConfig =
        CronConfig.defaults("crondbtest")
            .withDatabaseUrl(postgres.getJdbcUrl())
            .withDbUser(postgres.getUsername())
            .withDbPassword(postgres.getPassword())
            .withMaximumPoolSize(2);
    dataSource = JobDatabase.createDataSource(cronConfig);
  }

  @AfterAll
  static void afterAll() {
    dataSource.close();
    postgres.stop();
  }

  /** A schema name no other test uses, so tests never see each other's jobs. */
  protected static String freshSchema() {
    return "cron_test_" + schemaCounter.incrementAndGet();
  }
}
