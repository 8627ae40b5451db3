package dev.dbos.cron.database;

import dev.dbos.cron.Constants;
import dev.dbos.cron.execution.TimeSpecResolver;
import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.JobPatch;
import dev.dbos.cron.job.JobRecord;
import dev.dbos.cron.job.JobTarget;
import dev.dbos.cron.job.PostingMode;
import dev.dbos.cron.job.Routing;
import dev.dbos.cron.json.JSONUtil;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

import javax.sql.DataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class JobsDAO {

  private static final Logger logger = LoggerFactory.getLogger(JobsDAO.class);

  // The order of columns here is critical for mapRow
  private static final String COLUMNS =
      """
        id, cron, "user", slash, text, action,
        channel, conversation_with, conversation_as, session_id,
        args, done, error
      """;

  private final DataSource dataSource;
  private final String schema;

  JobsDAO(DataSource dataSource, String schema) {
    this.dataSource = Objects.requireNonNull(dataSource);
    this.schema = Objects.requireNonNull(schema);
  }

  private String table() {
    return "%s.%s".formatted(schema, Constants.JOBS_TABLE);
  }

  JobRecord insert(JobRecord draft) throws SQLException {
    final String sql =
        """
          INSERT INTO %s (
            cron, run_at_epoch_ms, "user", slash, text, action,
            channel, conversation_with, conversation_as, session_id,
            args, created_at
          ) VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB), ?, ?, CAST(? AS JSONB), ?)
          RETURNING id
        """
            .formatted(table());

    var target = draft.target();
    var routing = draft.routing();
    var runAt = TimeSpecResolver.parseInstant(draft.timeSpec());

    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setString(1, draft.timeSpec());
      if (runAt.isPresent()) {
        stmt.setLong(2, runAt.get().toEpochMilli());
      } else {
        stmt.setNull(2, Types.BIGINT);
      }
      stmt.setString(3, draft.user());
      stmt.setString(4, target.command());
      if (target instanceof JobTarget.Action action) {
        stmt.setNull(5, Types.VARCHAR);
        stmt.setString(6, action.action());
        stmt.setString(11, JSONUtil.toJson(action.args()));
      } else {
        stmt.setString(5, ((JobTarget.Command) target).text());
        stmt.setNull(6, Types.VARCHAR);
        stmt.setNull(11, Types.VARCHAR);
      }
      stmt.setString(7, routing.channel());
      stmt.setString(8, JSONUtil.canonicalList(routing.participants()));
      stmt.setString(9, routing.postingMode().value());
      stmt.setString(10, routing.sessionId());
      stmt.setLong(12, System.currentTimeMillis());

      try (ResultSet rs = stmt.executeQuery()) {
        if (!rs.next()) {
          throw new SQLException("Insert into %s returned no id".formatted(table()));
        }
        long id = rs.getLong(1);
        logger.debug("Inserted job {} ({})", id, draft.timeSpec());
        return draft.withKey(JobKey.persisted(id));
      }
    }
  }

  Optional<JobRecord> findById(long id) throws SQLException {
    final String sql = "SELECT %s FROM %s WHERE id = ?".formatted(COLUMNS, table());
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      stmt.setLong(1, id);
      try (ResultSet rs = stmt.executeQuery()) {
        return rs.next() ? Optional.of(mapRow(rs)) : Optional.empty();
      }
    }
  }

  List<JobRecord> listPending() throws SQLException {
    final String sql =
        "SELECT %s FROM %s WHERE done IS NULL ORDER BY id".formatted(COLUMNS, table());
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql);
        ResultSet rs = stmt.executeQuery()) {
      List<JobRecord> jobs = new ArrayList<>();
      while (rs.next()) {
        jobs.add(mapRow(rs));
      }
      return jobs;
    }
  }

  List<JobRecord> query(JobFilter filter, Instant now) throws SQLException {
    if (filter == null) {
      filter = new JobFilter();
    }

    StringJoiner whereConditions = new StringJoiner(" AND ");
    List<Object> parameters = new ArrayList<>();

    // only jobs still waiting to run can be cancelled
    whereConditions.add("done IS NULL");
    whereConditions.add("(run_at_epoch_ms IS NULL OR run_at_epoch_ms >= ?)");
    parameters.add(now.toEpochMilli());

    if (filter.user() != null) {
      whereConditions.add("\"user\" = ?");
      parameters.add(filter.user());
    }
    if (filter.command() != null) {
      whereConditions.add("slash = ?");
      parameters.add(filter.command());
    }
    if (filter.action() != null) {
      whereConditions.add("action = ?");
      parameters.add(filter.action());
    }
    if (filter.participants() != null) {
      whereConditions.add("conversation_with = CAST(? AS JSONB)");
      parameters.add(JSONUtil.canonicalList(filter.participants()));
    }
    whereConditions.add("conversation_as = ?");
    parameters.add(filter.postingMode().value());

    final String sql =
        "SELECT %s FROM %s WHERE %s ORDER BY id".formatted(COLUMNS, table(), whereConditions);
    logger.debug("Job query {}", sql);

    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      for (int i = 0; i < parameters.size(); i++) {
        stmt.setObject(i + 1, parameters.get(i));
      }
      try (ResultSet rs = stmt.executeQuery()) {
        List<JobRecord> jobs = new ArrayList<>();
        while (rs.next()) {
          jobs.add(mapRow(rs));
        }
        return jobs;
      }
    }
  }

  void patch(long id, JobPatch patch) throws SQLException {
    Objects.requireNonNull(patch, "patch must not be null");

    StringJoiner assignments = new StringJoiner(", ");
    List<Object> parameters = new ArrayList<>();
    if (patch.done() != null) {
      assignments.add("done = ?");
      parameters.add(patch.done());
    }
    if (patch.error() != null) {
      assignments.add("error = ?");
      parameters.add(patch.error());
    }
    if (parameters.isEmpty()) {
      return;
    }

    final String sql = "UPDATE %s SET %s WHERE id = ?".formatted(table(), assignments);
    try (Connection conn = dataSource.getConnection();
        PreparedStatement stmt = conn.prepareStatement(sql)) {
      int idx = 1;
      for (var param : parameters) {
        stmt.setObject(idx++, param);
      }
      stmt.setLong(idx, id);
      int rows = stmt.executeUpdate();
      if (rows == 0) {
        logger.warn("Patch of job {} matched no row", id);
      }
    }
  }

  private static JobRecord mapRow(ResultSet rs) throws SQLException {
    long id = rs.getLong("id");
    var target =
        JobTarget.of(
            rs.getString("slash"),
            rs.getString("text"),
            rs.getString("action"),
            JSONUtil.toMap(rs.getString("args")));
    var postingMode = rs.getString("conversation_as");
    var routing =
        new Routing(
            rs.getString("channel"),
            JSONUtil.toStringList(rs.getString("conversation_with")),
            postingMode == null ? PostingMode.BOT : PostingMode.fromValue(postingMode),
            rs.getString("session_id"));
    boolean doneValue = rs.getBoolean("done");
    Boolean done = rs.wasNull() ? null : doneValue;
    return new JobRecord(
        JobKey.persisted(id),
        rs.getString("cron"),
        rs.getString("user"),
        target,
        routing,
        done,
        rs.getString("error"));
  }
}
