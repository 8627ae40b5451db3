package dev.dbos.cron.execution;

import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.TimeSpec;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicInteger;

/** A live timer of the registry. */
public final class TimerHandle {

  private final JobKey key;
  private final TimeSpec timeSpec;
  private final AtomicInteger fireCount = new AtomicInteger();

  private volatile ScheduledFuture<?> future;
  private volatile Instant nextFireTime;
  private volatile boolean stopped;

  TimerHandle(JobKey key, TimeSpec timeSpec) {
    this.key = Objects.requireNonNull(key, "key must not be null");
    this.timeSpec = Objects.requireNonNull(timeSpec, "timeSpec must not be null");
  }

  public JobKey key() {
    return key;
  }

  public TimeSpec timeSpec() {
    return timeSpec;
  }

  public boolean isOneShot() {
    return timeSpec.isOneShot();
  }

  /** When the timer fires next, empty once a one-shot timer fired or the timer was stopped. */
  public Optional<Instant> nextFireTime() {
    return stopped ? Optional.empty() : Optional.ofNullable(nextFireTime);
  }

  public int fireCount() {
    return fireCount.get();
  }

  public boolean isStopped() {
    return stopped;
  }

  void arm(Instant fireTime) {
    this.nextFireTime = fireTime;
  }

  void scheduled(ScheduledFuture<?> future) {
    this.future = future;
    // stop() may have raced with the reschedule
    if (stopped) {
      future.cancel(false);
    }
  }

  void fired() {
    fireCount.incrementAndGet();
    if (isOneShot()) {
      nextFireTime = null;
    }
  }

  void stop() {
    stopped = true;
    var current = future;
    if (current != null) {
      current.cancel(false);
    }
  }

  @Override
  public String toString() {
    return "TimerHandle[key=%s, timeSpec=%s, nextFireTime=%s, fireCount=%d, stopped=%s]"
        .formatted(key, timeSpec, nextFireTime, fireCount.get(), stopped);
  }
}
