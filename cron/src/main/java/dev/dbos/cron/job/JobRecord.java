package dev.dbos.cron.job;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A schedulable unit of work as kept by the job store. {@code key} is null for a draft that has
 * not been inserted yet. {@code done} is tri-state: null while pending, true once a one-shot job
 * succeeded, false after a failure or a cancellation (see {@code error}).
 */
public record JobRecord(
    @Nullable JobKey key,
    String timeSpec,
    String user,
    JobTarget target,
    Routing routing,
    @Nullable Boolean done,
    @Nullable String error) {

  public JobRecord {
    Objects.requireNonNull(timeSpec, "timeSpec must not be null");
    Objects.requireNonNull(target, "target must not be null");
    routing = routing == null ? Routing.none() : routing;
  }

  public static JobRecord draft(String timeSpec, String user, JobTarget target, Routing routing) {
    return new JobRecord(null, timeSpec, user, target, routing, null, null);
  }

  public JobRecord withKey(JobKey v) {
    return new JobRecord(v, timeSpec, user, target, routing, done, error);
  }

  public JobRecord withPatch(JobPatch patch) {
    return new JobRecord(
        key,
        timeSpec,
        user,
        target,
        routing,
        patch.done() != null ? patch.done() : done,
        patch.error() != null ? patch.error() : error);
  }

  public boolean isPending() {
    return done == null;
  }

  /** The store-assigned id of a persisted job. */
  public long id() {
    if (key instanceof JobKey.Persisted p) {
      return p.id();
    }
    throw new IllegalStateException("Job %s has no persisted id".formatted(key));
  }
}
