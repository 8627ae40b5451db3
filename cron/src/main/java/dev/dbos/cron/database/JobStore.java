package dev.dbos.cron.database;

import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobPatch;
import dev.dbos.cron.job.JobRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable table of job records. Implementations report failures as {@link
 * dev.dbos.cron.exceptions.JobStoreException}.
 */
public interface JobStore {

  /** Persists a draft record and returns it with its assigned key. */
  JobRecord insert(JobRecord draft);

  Optional<JobRecord> findById(long id);

  /**
   * Pending records matching {@code filter} that are recurring or whose one-shot time is at or
   * after {@code now}.
   */
  List<JobRecord> query(JobFilter filter, Instant now);

  /** All records that have not reached a terminal state. */
  List<JobRecord> listPending();

  void patch(long id, JobPatch patch);
}
