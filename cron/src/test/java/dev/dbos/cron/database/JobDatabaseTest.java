package dev.dbos.cron.database;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.dbos.cron.DbSetupTestBase;
import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.JobPatch;
import dev.dbos.cron.job.JobRecord;
import dev.dbos.cron.job.JobTarget;
import dev.dbos.cron.job.PostingMode;
import dev.dbos.cron.job.Routing;
import dev.dbos.cron.migrations.MigrationManager;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
@org.junit.jupiter.api.Timeout(value = 2, unit = java.util.concurrent.TimeUnit.MINUTES)
class JobDatabaseTest extends DbSetupTestBase {

  private static final Instant NOW = Instant.parse("2025-01-01T12:00:00Z");
  private static final String YEARLY = "0 0 1 1 *";

  private JobDatabase db;

  @BeforeEach
  void setup() {
    var schema = freshSchema();
    MigrationManager.runMigrations(dataSource, schema);
    db = new JobDatabase(dataSource, schema);
  }

  private JobRecord insert(String time, String user, JobTarget target, Routing routing) {
    return db.insert(JobRecord.draft(time, user, target, routing));
  }

  private JobRecord ping(String time, String user) {
    return insert(time, user, new JobTarget.Command("ping", "hi"), Routing.channel("C1"));
  }

  @Test
  void insertAndFind() {
    var routing =
        Routing.channel("C42")
            .withParticipants(List.of("U3", "U2"))
            .withPostingMode(PostingMode.USER)
            .withSessionId("session-1");
    var target = new JobTarget.Command("ping", "hi");
    var inserted = insert("2099-01-01T00:00:00Z", "U1", target, routing);

    assertInstanceOf(JobKey.Persisted.class, inserted.key());
    var job = db.findById(inserted.id()).orElseThrow();
    assertEquals("2099-01-01T00:00:00Z", job.timeSpec());
    assertEquals("U1", job.user());
    assertEquals(target, job.target());
    assertEquals("C42", job.routing().channel());
    assertEquals(List.of("U2", "U3"), job.routing().participants());
    assertEquals(PostingMode.USER, job.routing().postingMode());
    assertEquals("session-1", job.routing().sessionId());
    assertTrue(job.isPending());
    assertNull(job.error());
  }

  @Test
  void actionJobsKeepTheirArgs() {
    var target = new JobTarget.Action("deploy", "rollback", Map.of("version", "1.2.3", "n", 2));
    var inserted = insert(YEARLY, "U1", target, Routing.none());

    var job = db.findById(inserted.id()).orElseThrow();
    var action = assertInstanceOf(JobTarget.Action.class, job.target());
    assertEquals("deploy", action.command());
    assertEquals("rollback", action.action());
    assertEquals(Map.of("version", "1.2.3", "n", 2), action.args());
    assertEquals(PostingMode.BOT, job.routing().postingMode());
    assertEquals(List.of(), job.routing().participants());
  }

  @Test
  void findUnknownId() {
    assertTrue(db.findById(12345).isEmpty());
  }

  @Test
  void idsAreDistinct() {
    var first = ping(YEARLY, "U1");
    var second = ping(YEARLY, "U1");
    assertTrue(second.id() > first.id());
  }

  @Test
  void patchOnlyWritesGivenFields() {
    var job = ping(YEARLY, "U1");

    db.patch(job.id(), new JobPatch(null, "transient"));
    var patched = db.findById(job.id()).orElseThrow();
    assertTrue(patched.isPending());
    assertEquals("transient", patched.error());

    db.patch(job.id(), JobPatch.failed("Killed by command"));
    patched = db.findById(job.id()).orElseThrow();
    assertEquals(Boolean.FALSE, patched.done());
    assertEquals("Killed by command", patched.error());
  }

  @Test
  void patchUnknownIdIsIgnored() {
    db.patch(12345, JobPatch.succeeded());
    assertTrue(db.findById(12345).isEmpty());
  }

  @Test
  void listPending() {
    var pending = ping(YEARLY, "U1");
    var succeeded = ping("2020-01-01T00:00:00Z", "U1");
    db.patch(succeeded.id(), JobPatch.succeeded());
    var failed = ping(YEARLY, "U2");
    db.patch(failed.id(), JobPatch.failed("network down"));
    var stale = ping("2020-01-01T00:00:00Z", "U2");

    var ids = db.listPending().stream().map(JobRecord::id).toList();
    assertEquals(List.of(pending.id(), stale.id()), ids);
  }

  @Test
  void queryOnlySelectsFutureOrRecurringJobs() {
    var recurring = ping(YEARLY, "U1");
    var future = ping("2025-01-01T12:00:01Z", "U1");
    var exactlyNow = ping("2025-01-01T12:00:00Z", "U1");
    ping("2025-01-01T11:59:59Z", "U1");
    var done = ping(YEARLY, "U1");
    db.patch(done.id(), JobPatch.succeeded());

    var ids = db.query(new JobFilter(), NOW).stream().map(JobRecord::id).toList();
    assertEquals(List.of(recurring.id(), future.id(), exactlyNow.id()), ids);
  }

  @Test
  void queryCombinesFilters() {
    var target = new JobTarget.Action("deploy", "rollback", Map.of());
    var routing = Routing.channel("C1").withParticipants(List.of("U7", "U8"));
    var match = insert(YEARLY, "U1", target, routing);
    insert(YEARLY, "U2", target, routing);
    insert(YEARLY, "U1", new JobTarget.Action("deploy", "promote", Map.of()), routing);
    insert(YEARLY, "U1", new JobTarget.Command("deploy", "now"), routing);
    insert(YEARLY, "U1", target, routing.withParticipants(List.of("U7")));
    insert(YEARLY, "U1", target, routing.withPostingMode(PostingMode.USER));

    var filter =
        new JobFilter()
            .withUser("U1")
            .withCommand("deploy")
            .withAction("rollback")
            .withParticipants(List.of("U8", "U7"));

    var ids = db.query(filter, NOW).stream().map(JobRecord::id).toList();
    assertEquals(List.of(match.id()), ids);
  }

  @Test
  void queryAppliesPostingMode() {
    var routing = Routing.channel("C1").withPostingMode(PostingMode.USER);
    var asUser = insert(YEARLY, "U1", new JobTarget.Command("ping", null), routing);
    var asBot = ping(YEARLY, "U1");

    assertEquals(List.of(asBot.id()), ids(JobFilter.forUser("U1")));
    assertEquals(
        List.of(asUser.id()), ids(JobFilter.forUser("U1").withPostingMode(PostingMode.USER)));
  }

  private List<Long> ids(JobFilter filter) {
    return db.query(filter, NOW).stream().map(JobRecord::id).toList();
  }
}
