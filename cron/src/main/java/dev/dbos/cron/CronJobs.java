package dev.dbos.cron;

import dev.dbos.cron.config.CronConfig;
import dev.dbos.cron.database.JobDatabase;
import dev.dbos.cron.database.JobStore;
import dev.dbos.cron.exceptions.InvalidJobException;
import dev.dbos.cron.execution.ActionDispatcher;
import dev.dbos.cron.execution.ExecutorTimerRegistry;
import dev.dbos.cron.execution.JobController;
import dev.dbos.cron.execution.RecoveryService;
import dev.dbos.cron.execution.TimeSpecResolver;
import dev.dbos.cron.execution.TimerRegistry;
import dev.dbos.cron.job.CancellationReport;
import dev.dbos.cron.job.JobFilter;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.JobRecord;
import dev.dbos.cron.job.JobRequest;
import dev.dbos.cron.job.Routing;
import dev.dbos.cron.job.TimeSpec;
import dev.dbos.cron.migrations.MigrationManager;

import java.time.Clock;
import java.time.DateTimeException;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the scheduler. {@link #launch()} re-arms the jobs still pending in the store;
 * after that, jobs are scheduled with {@code scheduleTask} (persisted) or {@code setTimer}
 * (in memory only) and cancelled by id, key or search.
 */
public class CronJobs implements AutoCloseable {

  private static final Logger logger = LoggerFactory.getLogger(CronJobs.class);

  private final CronConfig config;
  private final JobStore store;
  private final @Nullable JobDatabase ownedDatabase;
  private final TimerRegistry registry;
  private final ExecutorService cancelExecutor;
  private final JobController controller;
  private final RecoveryService recoveryService;
  private final AtomicBoolean launched = new AtomicBoolean(false);
  private final AtomicBoolean shutDown = new AtomicBoolean(false);

  /** Scheduler backed by the Postgres database described by {@code config}. */
  public CronJobs(@NonNull CronConfig config, @NonNull ActionDispatcher dispatcher) {
    this(
        config,
        dispatcher,
        new JobDatabase(checkDatabaseConfig(config)),
        true,
        null,
        Clock.systemUTC());
  }

  /** Scheduler over a caller-provided store; the store is not migrated nor closed. */
  public CronJobs(
      @NonNull CronConfig config, @NonNull ActionDispatcher dispatcher, @NonNull JobStore store) {
    this(config, dispatcher, store, false, null, Clock.systemUTC());
  }

  CronJobs(
      CronConfig config,
      ActionDispatcher dispatcher,
      JobStore store,
      @Nullable TimerRegistry registry,
      Clock clock) {
    this(config, dispatcher, store, false, registry, clock);
  }

  private CronJobs(
      CronConfig config,
      ActionDispatcher dispatcher,
      JobStore store,
      boolean ownsStore,
      @Nullable TimerRegistry registry,
      Clock clock) {
    this.config = Objects.requireNonNull(config, "config must not be null");
    this.store = Objects.requireNonNull(store, "store must not be null");
    this.ownedDatabase = ownsStore ? (JobDatabase) store : null;
    this.registry =
        registry != null ? registry : new ExecutorTimerRegistry(config.schedulerThreads(), clock);
    this.cancelExecutor = Executors.newCachedThreadPool();
    this.controller =
        new JobController(store, this.registry, dispatcher, cancelExecutor, clock);
    this.recoveryService = new RecoveryService(store, controller, new TimeSpecResolver(clock));
  }

  private static CronConfig checkDatabaseConfig(CronConfig config) {
    Objects.requireNonNull(config, "config must not be null");
    if (config.dataSource() == null) {
      Objects.requireNonNull(config.databaseUrl(), "CronConfig.databaseUrl must not be null");
      Objects.requireNonNull(config.dbUser(), "CronConfig.dbUser must not be null");
      Objects.requireNonNull(config.dbPassword(), "CronConfig.dbPassword must not be null");
    }
    return config;
  }

  public CronConfig config() {
    return config;
  }

  /**
   * Migrates the job table if configured to, starts the timers and re-arms every pending job.
   * Scheduling requests are accepted once this returns.
   *
   * @throws dev.dbos.cron.exceptions.JobStoreException if pending jobs cannot be loaded
   * @throws IllegalStateException if this instance was shut down; create a new one instead
   */
  public void launch() {
    if (shutDown.get()) {
      throw new IllegalStateException(
          "CronJobs %s was shut down and cannot be launched again".formatted(config.appName()));
    }
    if (launched.get()) {
      logger.warn("CronJobs {} is already launched", config.appName());
      return;
    }

    logger.info("Launching CronJobs {}", config.appName());
    if (ownedDatabase != null && config.migrate()) {
      MigrationManager.runMigrations(config);
    }

    registry.start();
    try {
      int recovered = recoveryService.recover();
      logger.info("CronJobs {} launched, {} jobs recovered", config.appName(), recovered);
    } catch (RuntimeException e) {
      logger.error("Recovery failed, CronJobs {} not launched", config.appName(), e);
      registry.shutdown();
      throw e;
    }
    launched.set(true);
  }

  /** Stops every timer and releases the resources of this instance, which cannot be relaunched. */
  public void shutdown() {
    shutDown.set(true);
    if (launched.compareAndSet(true, false)) {
      logger.info("Shutting down CronJobs {}", config.appName());
    }
    registry.shutdown();
    cancelExecutor.shutdownNow();
    // an injected data source belongs to the caller
    if (ownedDatabase != null && config.dataSource() == null) {
      ownedDatabase.close();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public boolean isLaunched() {
    return launched.get();
  }

  private void ensureLaunched() {
    if (!launched.get()) {
      throw new IllegalStateException("CronJobs %s is not launched".formatted(config.appName()));
    }
  }

  /**
   * Schedules a command, or an action of that command, and persists it so it survives restarts.
   *
   * @param time an instant, a date/time, an ISO-8601 string, or a recurring cron pattern
   * @return the id of the job
   */
  public long scheduleTask(
      @NonNull Object time,
      @NonNull String user,
      @NonNull String command,
      @Nullable String text,
      @Nullable String action,
      @Nullable Map<String, Object> args,
      @Nullable Routing routing) {
    return scheduleTask(request(time, user, command, text, action, args, routing));
  }

  public long scheduleTask(@NonNull JobRequest request) {
    ensureLaunched();
    return controller.create(request);
  }

  /**
   * Schedules a command or an action in memory only. The timer is lost on restart.
   *
   * @return the key to cancel the timer with
   */
  public JobKey.Ephemeral setTimer(
      @NonNull Object time,
      @NonNull String user,
      @NonNull String command,
      @Nullable String text,
      @Nullable String action,
      @Nullable Map<String, Object> args,
      @Nullable Routing routing) {
    return setTimer(request(time, user, command, text, action, args, routing));
  }

  public JobKey.Ephemeral setTimer(@NonNull JobRequest request) {
    ensureLaunched();
    return controller.createEphemeral(request);
  }

  private static JobRequest request(
      Object time,
      String user,
      String command,
      String text,
      String action,
      Map<String, Object> args,
      Routing routing) {
    return new JobRequest(resolveTime(time), user, command, text, action, args, routing);
  }

  private static TimeSpec resolveTime(Object time) {
    try {
      return TimeSpecResolver.resolve(time);
    } catch (IllegalArgumentException | DateTimeException e) {
      throw new InvalidJobException("Invalid job time %s: %s".formatted(time, e.getMessage()), e);
    }
  }

  public void cancel(long id) {
    cancel(JobKey.persisted(id), null);
  }

  public void cancel(long id, @Nullable String message) {
    cancel(JobKey.persisted(id), message);
  }

  public void cancel(@NonNull JobKey key) {
    cancel(key, null);
  }

  /**
   * Cancels one job. A persisted job is marked failed with {@code message}, or the configured
   * default message.
   *
   * @throws dev.dbos.cron.exceptions.NonExistentJobException if the job has no live timer
   */
  public void cancel(@NonNull JobKey key, @Nullable String message) {
    ensureLaunched();
    controller.cancel(key, messageOrDefault(message));
  }

  public CancellationReport cancel(@NonNull JobFilter filter) {
    return cancel(filter, null);
  }

  /** Cancels every pending job matching {@code filter}. */
  public CancellationReport cancel(@NonNull JobFilter filter, @Nullable String message) {
    ensureLaunched();
    var report = controller.cancelMatching(filter, messageOrDefault(message));
    logger.info(
        "Cancelled {} of {} jobs matching {}", report.cancelled().size(), report.matched(), filter);
    return report;
  }

  private String messageOrDefault(@Nullable String message) {
    return message != null ? message : config.defaultCancelMessage();
  }

  public Optional<JobRecord> getJob(long id) {
    return store.findById(id);
  }

  public Set<JobKey> liveTimers() {
    return registry.liveKeys();
  }
}
