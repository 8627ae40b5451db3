package dev.dbos.cron.migrations;

import dev.dbos.cron.Constants;
import dev.dbos.cron.config.CronConfig;
import dev.dbos.cron.database.JobDatabase;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.Objects;

import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Provisions the job table: database, schema, migration version table and numbered migrations. */
public class MigrationManager {

  private static final Logger logger = LoggerFactory.getLogger(MigrationManager.class);
  private static final List<String> IGNORABLE_SQL_STATES =
      List.of(
          "42P07", // duplicate_table
          "42710", // duplicate_object (e.g., index)
          "42701", // duplicate_column
          "42P06" // duplicate_schema
          );

  public static void runMigrations(CronConfig config) {
    Objects.requireNonNull(config, "CronConfig must not be null");

    if (config.dataSource() != null) {
      runMigrations(config.dataSource(), config.databaseSchema());
    } else {
      createDatabaseIfNotExists(config);
      try (var ds = JobDatabase.createDataSource(config)) {
        runMigrations(ds, config.databaseSchema());
      }
    }
  }

  public static void runMigrations(HikariDataSource ds, String schema) {
    Objects.requireNonNull(ds, "Data Source must not be null");
    schema = JobDatabase.sanitizeSchema(schema);

    try (var conn = ds.getConnection()) {
      ensureSchema(conn, schema);
      ensureMigrationTable(conn, schema);
      runJobMigrations(conn, schema, getMigrations(schema));
    } catch (SQLException e) {
      throw new RuntimeException("Failed to run migrations", e);
    }
  }

  public static void createDatabaseIfNotExists(CronConfig config) {
    Objects.requireNonNull(config, "CronConfig must not be null");
    if (config.dataSource() != null) {
      logger.debug("CronConfig specifies data source, skipping createDatabaseIfNotExists");
    } else {
      createDatabaseIfNotExists(config.databaseUrl(), config.dbUser(), config.dbPassword());
    }
  }

  public static void createDatabaseIfNotExists(String url, String user, String password) {
    Objects.requireNonNull(url, "database url must not be null");
    Objects.requireNonNull(user, "database user must not be null");
    Objects.requireNonNull(password, "database password must not be null");

    var pair = extractDbAndPostgresUrl(url);

    try (var adminDS = JobDatabase.createDataSource(pair.url(), user, password);
        var conn = adminDS.getConnection()) {
      try (var stmt = conn.prepareStatement("SELECT 1 FROM pg_database WHERE datname = ?")) {
        stmt.setString(1, pair.database());
        try (ResultSet rs = stmt.executeQuery()) {
          if (rs.next()) {
            logger.debug("Database '{}' already exists", pair.database());
            return;
          }
        }
      }

      logger.info("Creating '{}' database", pair.database());
      try (Statement stmt = conn.createStatement()) {
        stmt.executeUpdate("CREATE DATABASE \"" + pair.database() + "\"");
      }
    } catch (SQLException e) {
      logger.warn("Unable to create database {} through {}", pair.database(), pair.url(), e);
    }
  }

  public record UrlPair(String url, String database) {}

  public static UrlPair extractDbAndPostgresUrl(String url) {
    int qm = Objects.requireNonNull(url, "database url must not be null").indexOf('?');
    var base = qm >= 0 ? url.substring(0, qm) : url;
    var params = qm >= 0 ? url.substring(qm) : "";
    int slash = base.lastIndexOf('/');
    if (slash < "jdbc:postgresql://".length()) {
      throw new IllegalArgumentException(String.format("JDBC URL %s is not valid", url));
    }

    var newUrl = base.substring(0, slash + 1) + Constants.POSTGRES_DEFAULT_DB + params;
    var databaseName = base.substring(slash + 1);
    return new UrlPair(newUrl, databaseName);
  }

  static void ensureSchema(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute("CREATE SCHEMA IF NOT EXISTS %s".formatted(schema));
    }
  }

  static void ensureMigrationTable(Connection conn, String schema) throws SQLException {
    try (var stmt = conn.createStatement()) {
      stmt.execute(
          "CREATE TABLE IF NOT EXISTS %s.cron_migrations (version BIGINT NOT NULL PRIMARY KEY)"
              .formatted(schema));
    }
  }

  public static int getCurrentVersion(Connection conn, String schema) {
    Objects.requireNonNull(schema, "schema must not be null");
    var sql =
        "SELECT version FROM %s.cron_migrations ORDER BY version DESC limit 1".formatted(schema);
    try (var stmt = conn.createStatement();
        var rs = stmt.executeQuery(sql)) {
      if (rs.next()) {
        return rs.getInt("version");
      }
    } catch (SQLException e) {
      logger.warn("SQLException thrown querying cron_migrations table", e);
    }

    return 0;
  }

  static void runJobMigrations(Connection conn, String schema, List<String> migrations) {
    var lastApplied = getCurrentVersion(conn, schema);

    for (var i = 0; i < migrations.size(); i++) {
      var migrationIndex = i + 1;
      if (migrationIndex <= lastApplied) {
        continue;
      }

      logger.info("Applying cron job schema migration {}", migrationIndex);
      try (var stmt = conn.createStatement()) {
        stmt.execute(migrations.get(i));
      } catch (SQLException e) {
        if (IGNORABLE_SQL_STATES.contains(e.getSQLState())) {
          logger.warn(
              "Ignoring migration {} error; Migration was likely already applied", migrationIndex);
        } else {
          throw new RuntimeException("Failed to run migration %d".formatted(migrationIndex), e);
        }
      }

      try {
        int rowCount;
        var updateSQL = "UPDATE %s.cron_migrations SET version = ?".formatted(schema);
        try (var stmt = conn.prepareStatement(updateSQL)) {
          stmt.setLong(1, migrationIndex);
          rowCount = stmt.executeUpdate();
        }

        if (rowCount == 0) {
          var insertSql = "INSERT INTO %s.cron_migrations (version) VALUES (?)".formatted(schema);
          try (var stmt = conn.prepareStatement(insertSql)) {
            stmt.setLong(1, migrationIndex);
            stmt.executeUpdate();
          }
        }
      } catch (SQLException e) {
        throw new RuntimeException("Failed to update cron migration version", e);
      }

      lastApplied = migrationIndex;
    }
  }

  public static List<String> getMigrations(String schema) {
    Objects.requireNonNull(schema);
    return List.of(migration1, migration2).stream().map(m -> m.formatted(schema)).toList();
  }

  static final String migration1 =
      """
      CREATE TABLE %1$s.cron_jobs (
          id BIGSERIAL PRIMARY KEY,
          cron TEXT NOT NULL,
          run_at_epoch_ms BIGINT,
          "user" TEXT,
          slash TEXT,
          text TEXT,
          action TEXT,
          channel TEXT,
          conversation_with JSONB,
          conversation_as TEXT,
          args JSONB,
          done BOOLEAN,
          error TEXT,
          created_at BIGINT NOT NULL DEFAULT (EXTRACT(epoch FROM now()) * 1000.0)::bigint
      );

      CREATE INDEX cron_jobs_pending_idx ON %1$s.cron_jobs ("user", run_at_epoch_ms)
          WHERE done IS NULL;
      """;

  static final String migration2 =
      """
      ALTER TABLE %1$s.cron_jobs ADD COLUMN session_id TEXT;
      """;
}
