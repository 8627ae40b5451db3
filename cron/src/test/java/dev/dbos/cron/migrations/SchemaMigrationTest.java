package dev.dbos.cron.migrations;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.dbos.cron.DbSetupTestBase;
import dev.dbos.cron.database.JobDatabase;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
@org.junit.jupiter.api.Timeout(value = 2, unit = java.util.concurrent.TimeUnit.MINUTES)
class SchemaMigrationTest extends DbSetupTestBase {

  @Test
  void createsJobTable() throws Exception {
    var schema = freshSchema();

    MigrationManager.runMigrations(dataSource, schema);

    try (Connection conn = dataSource.getConnection()) {
      var columns = columns(conn, schema, "cron_jobs");
      assertTrue(
          columns.containsAll(
              Set.of(
                  "id",
                  "cron",
                  "run_at_epoch_ms",
                  "user",
                  "slash",
                  "text",
                  "action",
                  "channel",
                  "conversation_with",
                  "conversation_as",
                  "args",
                  "done",
                  "error",
                  "created_at",
                  "session_id")),
          columns.toString());
      assertEquals(2, MigrationManager.getCurrentVersion(conn, JobDatabase.sanitizeSchema(schema)));
    }
  }

  @Test
  void migrationsAreIdempotent() throws Exception {
    var schema = freshSchema();

    MigrationManager.runMigrations(dataSource, schema);
    assertDoesNotThrow(() -> MigrationManager.runMigrations(dataSource, schema));

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(2, MigrationManager.getCurrentVersion(conn, JobDatabase.sanitizeSchema(schema)));
    }
  }

  @Test
  void runMigrationsFromConfig() throws Exception {
    var schema = freshSchema();

    MigrationManager.runMigrations(cronConfig.withDatabaseSchema(schema));

    try (Connection conn = dataSource.getConnection()) {
      assertTrue(columns(conn, schema, "cron_jobs").contains("session_id"));
    }
  }

  private static Set<String> columns(Connection conn, String schema, String table)
      throws SQLException {
    Set<String> columns = new HashSet<>();
    try (var rs = conn.getMetaData().getColumns(null, schema, table, null)) {
      while (rs.next()) {
        columns.add(rs.getString("COLUMN_NAME"));
      }
    }
    return columns;
  }
}
