package dev.dbos.cron.execution;

import dev.dbos.cron.database.JobStore;
import dev.dbos.cron.exceptions.InvalidJobException;
import dev.dbos.cron.exceptions.JobDispatchException;
import dev.dbos.cron.exceptions.NonExistentJobException;
import dev.dbos.cron.job.CancellationReport;
import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.JobPatch;
import dev.dbos.cron.job.JobRecord;
import dev.dbos.cron.job.JobRequest;
import dev.dbos.cron.job.JobTarget;
import dev.dbos.cron.job.TimeSpec;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the lifecycle of jobs: persists and arms new jobs, runs them when their timer fires and
 * records the outcome, and cancels them one by one or by search.
 */
public class JobController {

  private static final Logger logger = LoggerFactory.getLogger(JobController.class);

  static final int MAX_TIME_SPEC_LENGTH = 50;
  static final int MAX_FIELD_LENGTH = 255;

  private final JobStore store;
  private final TimerRegistry registry;
  private final ActionDispatcher dispatcher;
  private final Executor cancelExecutor;
  private final Clock clock;

  public JobController(
      JobStore store,
      TimerRegistry registry,
      ActionDispatcher dispatcher,
      Executor cancelExecutor,
      Clock clock) {
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.registry = Objects.requireNonNull(registry, "registry must not be null");
    this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    this.cancelExecutor = Objects.requireNonNull(cancelExecutor, "cancelExecutor must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null").withZone(ZoneOffset.UTC);
  }

  /**
   * Persists a new job and arms its timer.
   *
   * @return the id assigned by the store
   * @throws InvalidJobException if the request is malformed; nothing is persisted
   * @throws dev.dbos.cron.exceptions.JobStoreException if the insert fails; no timer is armed
   */
  public long create(JobRequest request) {
    var draft = validate(request);
    var job = store.insert(draft);
    activate(job, request.time());
    logger.info("Scheduled job {} @ {}", job.key(), job.timeSpec());
    return job.id();
  }

  /** Arms a job that lives only in memory. It is not recovered after a restart. */
  public JobKey.Ephemeral createEphemeral(JobRequest request) {
    var key = JobKey.ephemeral();
    activate(validate(request).withKey(key), request.time());
    logger.info("Set timer {} @ {}", key, request.time().persistedForm());
    return key;
  }

  /** Registers the timer of an existing job. */
  public JobKey activate(JobRecord job, TimeSpec time) {
    var key = Objects.requireNonNull(job.key(), "job must have a key to be activated");
    registry.register(key, time, () -> fire(job, time));
    logger.debug("Activated job {} with {}", key, time);
    return key;
  }

  void fire(JobRecord job, TimeSpec time) {
    logger.info(
        "Executing job {} : @{} / {} / {}",
        job.key(),
        job.user(),
        job.target().command(),
        describe(job.target()));

    CompletableFuture<Void> outcome;
    try {
      outcome = dispatch(job);
    } catch (RuntimeException e) {
      outcome = CompletableFuture.failedFuture(e);
    }

    outcome.whenComplete(
        (ignored, error) -> {
          if (error == null) {
            succeeded(job, time);
          } else {
            failed(job, new JobDispatchException(job.key(), unwrap(error)));
          }
        });
  }

  private CompletableFuture<Void> dispatch(JobRecord job) {
    CompletableFuture<Void> result;
    if (job.target() instanceof JobTarget.Action action) {
      result =
          dispatcher.emitAction(
              job.user(), action.command(), action.action(), action.args(), job.routing());
    } else {
      var command = (JobTarget.Command) job.target();
      result = dispatcher.emitCommand(job.user(), command.command(), command.text(), job.routing());
    }
    return result != null ? result : CompletableFuture.completedFuture(null);
  }

  private void succeeded(JobRecord job, TimeSpec time) {
    // recurring jobs stay pending until they are cancelled
    if (time.isOneShot() && job.key() instanceof JobKey.Persisted p) {
      recordOutcome(p.id(), JobPatch.succeeded());
    }
    logger.debug("Job {} executed", job.key());
  }

  private void failed(JobRecord job, JobDispatchException e) {
    logger.error("Job {} failed", job.key(), e);
    if (job.key() instanceof JobKey.Persisted p) {
      recordOutcome(p.id(), JobPatch.failed(e.reason()));
    }
  }

  private void recordOutcome(long id, JobPatch patch) {
    try {
      store.patch(id, patch);
    } catch (RuntimeException e) {
      logger.error("Unable to record outcome {} of job {}", patch, id, e);
    }
  }

  /**
   * Stops the timer of a job and, for a persisted job, marks its record as failed with {@code
   * message}.
   *
   * @throws NonExistentJobException if the job has no live timer, or no persisted record
   */
  public void cancel(JobKey key, String message) {
    Objects.requireNonNull(key, "key must not be null");
    registry.stop(key);

    if (key instanceof JobKey.Persisted p) {
      store.findById(p.id()).orElseThrow(() -> new NonExistentJobException(key));
      store.patch(p.id(), JobPatch.failed(message));
    }
    logger.info("Cancelled job {}: {}", key, message);
  }

  /**
   * Cancels every pending job matching {@code filter}. The cancellations run concurrently and
   * this call waits for all of them; one failing does not prevent the others.
   */
  public CancellationReport cancelMatching(JobFilter filter, String message) {
    Objects.requireNonNull(filter, "filter must not be null");
    var jobs = store.query(filter, clock.instant());
    logger.debug("Cancelling {} jobs matching {}", jobs.size(), filter);

    Map<Long, CompletableFuture<Void>> pending = new LinkedHashMap<>();
    for (var job : jobs) {
      var key = job.key();
      pending.put(
          job.id(), CompletableFuture.runAsync(() -> cancel(key, message), cancelExecutor));
    }

    CompletableFuture.allOf(pending.values().toArray(new CompletableFuture<?>[0]))
        .exceptionally(e -> null)
        .join();

    List<Long> cancelled = new ArrayList<>();
    Map<Long, Throwable> failures = new LinkedHashMap<>();
    pending.forEach(
        (id, future) -> {
          try {
            future.join();
            cancelled.add(id);
          } catch (CompletionException e) {
            var cause = unwrap(e);
            logger.warn("Unable to cancel job {}: {}", id, cause.getMessage());
            failures.put(id, cause);
          }
        });
    return new CancellationReport(cancelled, failures);
  }

  JobRecord validate(JobRequest request) {
    Objects.requireNonNull(request, "request must not be null");
    if (request.time() == null) {
      throw new InvalidJobException("Job time must not be null");
    }
    checkLength("time", request.time().persistedForm(), MAX_TIME_SPEC_LENGTH, true);
    if (request.time() instanceof TimeSpec.Recurring recurring) {
      Optional<ZonedDateTime> next;
      try {
        next = CronPatterns.nextExecution(recurring.pattern(), ZonedDateTime.now(clock));
      } catch (IllegalArgumentException e) {
        throw new InvalidJobException(
            "Invalid recurring pattern '%s': %s".formatted(recurring.pattern(), e.getMessage()),
            e);
      }
      if (next.isEmpty()) {
        throw new InvalidJobException(
            "Recurring pattern '%s' never matches".formatted(recurring.pattern()));
      }
    }
    checkLength("user", request.user(), MAX_FIELD_LENGTH, true);
    checkLength("command", request.command(), MAX_FIELD_LENGTH, true);
    checkLength("action", request.action(), MAX_FIELD_LENGTH, false);
    if (request.routing() != null) {
      checkLength("channel", request.routing().channel(), MAX_FIELD_LENGTH, false);
    }
    return request.toDraft();
  }

  private static void checkLength(String field, String value, int max, boolean required) {
    if (value == null) {
      if (required) {
        throw new InvalidJobException("Job %s is required".formatted(field));
      }
      return;
    }
    if (value.isEmpty() || value.length() > max) {
      throw new InvalidJobException(
          "Job %s must be between 1 and %d characters, got %d"
              .formatted(field, max, value.length()));
    }
  }

  private static String describe(JobTarget target) {
    if (target instanceof JobTarget.Action action) {
      return action.action();
    }
    return ((JobTarget.Command) target).text();
  }

  private static Throwable unwrap(Throwable t) {
    while ((t instanceof CompletionException || t instanceof ExecutionException)
        && t.getCause() != null) {
      t = t.getCause();
    }
    return t;
  }
}
