package dev.dbos.cron.database;

import dev.dbos.cron.Constants;
import dev.dbos.cron.config.CronConfig;
import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobPatch;
import dev.dbos.cron.job.JobRecord;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/** {@link JobStore} backed by a Postgres table, reached through a HikariCP pool. */
public class JobDatabase implements JobStore, AutoCloseable {

  public static String sanitizeSchema(String schema) {
    schema =
        Objects.requireNonNullElse(schema, Constants.DB_SCHEMA)
            .replace("\0", "")
            .replace("\"", "\"\"");
    return "\"%s\"".formatted(schema);
  }

  private final HikariDataSource dataSource;
  private final String schema;
  private final JobsDAO jobsDAO;

  public JobDatabase(CronConfig config) {
    this(JobDatabase.createDataSource(config), Objects.requireNonNull(config).databaseSchema());
  }

  public JobDatabase(HikariDataSource dataSource, String schema) {
    this.schema = sanitizeSchema(schema);
    this.dataSource = Objects.requireNonNull(dataSource);
    this.jobsDAO = new JobsDAO(dataSource, this.schema);
  }

  @Override
  public void close() {
    dataSource.close();
  }

  @Override
  public JobRecord insert(JobRecord draft) {
    Objects.requireNonNull(draft, "draft must not be null");
    return DbRetry.call(() -> jobsDAO.insert(draft));
  }

  @Override
  public Optional<JobRecord> findById(long id) {
    return DbRetry.call(() -> jobsDAO.findById(id));
  }

  @Override
  public List<JobRecord> query(JobFilter filter, Instant now) {
    Objects.requireNonNull(now, "now must not be null");
    return DbRetry.call(() -> jobsDAO.query(filter, now));
  }

  @Override
  public List<JobRecord> listPending() {
    return DbRetry.call(() -> jobsDAO.listPending());
  }

  @Override
  public void patch(long id, JobPatch patch) {
    DbRetry.run(() -> jobsDAO.patch(id, patch));
  }

  public static HikariDataSource createDataSource(String url, String user, String password) {
    return createDataSource(url, user, password, 0, 0);
  }

  public static HikariDataSource createDataSource(
      String url, String user, String password, int poolSize, int timeout) {
    HikariConfig hikariConfig = new HikariConfig();
    hikariConfig.setJdbcUrl(url);
    hikariConfig.setUsername(user);
    hikariConfig.setPassword(password);
    hikariConfig.setMaximumPoolSize(poolSize > 0 ? poolSize : 2);
    if (timeout > 0) {
      hikariConfig.setConnectionTimeout(timeout);
    }

    return new HikariDataSource(hikariConfig);
  }

  public static HikariDataSource createDataSource(CronConfig config) {
    if (config.dataSource() != null) {
      return config.dataSource();
    }

    return createDataSource(
        config.databaseUrl(),
        config.dbUser(),
        config.dbPassword(),
        config.maximumPoolSize(),
        config.connectionTimeout());
  }
}
