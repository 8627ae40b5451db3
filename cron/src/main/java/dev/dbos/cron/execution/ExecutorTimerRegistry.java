package dev.dbos.cron.execution;

import dev.dbos.cron.exceptions.NonExistentJobException;
import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.TimeSpec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import com.cronutils.model.time.ExecutionTime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TimerRegistry} over a {@link ScheduledExecutorService}. Recurring patterns are evaluated
 * on the UTC clock whatever the default time zone of the host.
 */
public class ExecutorTimerRegistry implements TimerRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ExecutorTimerRegistry.class);

  private final int poolSize;
  private final Clock clock;
  private final AtomicReference<ScheduledExecutorService> scheduler = new AtomicReference<>();
  private final ConcurrentHashMap<JobKey, TimerHandle> timers = new ConcurrentHashMap<>();

  public ExecutorTimerRegistry(int poolSize) {
    this(poolSize, Clock.systemUTC());
  }

  public ExecutorTimerRegistry(int poolSize, Clock clock) {
    if (poolSize < 1) {
      throw new IllegalArgumentException("poolSize must be at least 1");
    }
    this.poolSize = poolSize;
    this.clock = Objects.requireNonNull(clock).withZone(ZoneOffset.UTC);
  }

  @Override
  public void start() {
    if (this.scheduler.get() == null) {
      var scheduler = Executors.newScheduledThreadPool(poolSize);
      if (!this.scheduler.compareAndSet(null, scheduler)) {
        scheduler.shutdown();
      }
    }
  }

  @Override
  public void shutdown() {
    var scheduler = this.scheduler.getAndSet(null);
    for (var handle : timers.values()) {
      handle.stop();
    }
    timers.clear();
    if (scheduler != null) {
      List<Runnable> notRun = scheduler.shutdownNow();
      logger.debug("Shutting down timer registry. Tasks not run {}", notRun.size());
    }
  }

  @Override
  public TimerHandle register(JobKey key, TimeSpec timeSpec, Runnable onFire) {
    Objects.requireNonNull(onFire, "onFire must not be null");
    if (scheduler.get() == null) {
      throw new IllegalStateException("Timer registry is not running");
    }

    var handle = new TimerHandle(key, timeSpec);
    if (timers.putIfAbsent(key, handle) != null) {
      throw new IllegalStateException("A timer is already registered for job %s".formatted(key));
    }

    try {
      if (timeSpec instanceof TimeSpec.At at) {
        scheduleOnce(handle, at.instant(), onFire);
      } else {
        scheduleRecurring(handle, ((TimeSpec.Recurring) timeSpec).pattern(), onFire);
      }
    } catch (RuntimeException e) {
      timers.remove(key, handle);
      handle.stop();
      throw e;
    }
    return handle;
  }

  @Override
  public void stop(JobKey key) {
    var handle = timers.remove(key);
    if (handle == null) {
      throw NonExistentJobException.noLiveTimer(key);
    }
    handle.stop();
    logger.debug("Stopped timer {}", key);
  }

  @Override
  public Optional<TimerHandle> get(JobKey key) {
    return Optional.ofNullable(timers.get(key));
  }

  @Override
  public Set<JobKey> liveKeys() {
    return Set.copyOf(timers.keySet());
  }

  private void scheduleOnce(TimerHandle handle, Instant fireTime, Runnable onFire) {
    long delayMs = Duration.between(clock.instant(), fireTime).toMillis();
    logger.debug("Scheduling {} once @ {}", handle.key(), fireTime);

    Runnable task =
        () -> {
          // a stopped timer is no longer in the map
          if (!timers.remove(handle.key(), handle)) {
            return;
          }
          handle.fired();
          runCallback(handle, onFire);
        };
    handle.arm(fireTime);
    handle.scheduled(
        scheduler().schedule(task, delayMs < 0 ? 0 : delayMs, TimeUnit.MILLISECONDS));
  }

  private void scheduleRecurring(TimerHandle handle, String pattern, Runnable onFire) {
    var executionTime = ExecutionTime.forCron(CronPatterns.parse(pattern));
    if (executionTime.nextExecution(ZonedDateTime.now(clock)).isEmpty()) {
      throw new IllegalArgumentException("Pattern '%s' never matches".formatted(pattern));
    }

    var task =
        new Runnable() {
          ZonedDateTime lastTime = ZonedDateTime.now(clock);

          void schedule() {
            // never earlier than the previous run, so an early wakeup cannot fire twice
            var now = ZonedDateTime.now(clock);
            var from = now.isAfter(lastTime) ? now : lastTime;
            var next = executionTime.nextExecution(from);
            if (next.isEmpty()) {
              logger.warn("Pattern {} of job {} has no next execution", pattern, handle.key());
              timers.remove(handle.key(), handle);
              return;
            }

            var nextTime = next.get();
            lastTime = nextTime;
            var localScheduler = scheduler.get();
            if (localScheduler == null || handle.isStopped()) {
              return;
            }
            long delayMs = Duration.between(now, nextTime).toMillis();
            logger.debug("Scheduling {} @ {}", handle.key(), nextTime);
            handle.arm(nextTime.toInstant());
            handle.scheduled(
                localScheduler.schedule(this, delayMs < 0 ? 0 : delayMs, TimeUnit.MILLISECONDS));
          }

          @Override
          public void run() {
            if (handle.isStopped() || scheduler.get() == null) {
              return;
            }
            try {
              handle.fired();
              runCallback(handle, onFire);
            } finally {
              schedule();
            }
          }
        };

    task.schedule();
  }

  private void runCallback(TimerHandle handle, Runnable onFire) {
    try {
      onFire.run();
    } catch (Exception e) {
      logger.error("Timer callback of job {} failed", handle.key(), e);
    }
  }

  private ScheduledExecutorService scheduler() {
    var localScheduler = scheduler.get();
    if (localScheduler == null) {
      throw new IllegalStateException("Timer registry is not running");
    }
    return localScheduler;
  }
}
