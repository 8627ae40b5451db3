package dev.dbos.cron.execution;

import dev.dbos.cron.job.JobKey;
import dev.dbos.cron.job.TimeSpec;

import java.util.Optional;
import java.util.Set;

/**
 * Owns the live in-memory timers, one per in-flight job. It holds no business logic: {@code
 * onFire} runs once for a one-shot time and at every match of a recurring pattern.
 */
public interface TimerRegistry {

  void start();

  /** Stops every timer and the underlying scheduler. */
  void shutdown();

  /**
   * Starts a timer for {@code key}. A one-shot timer leaves the registry when it fires.
   *
   * @throws IllegalStateException if {@code key} already has a live timer, or the registry is
   *     not running
   * @throws IllegalArgumentException if a recurring pattern cannot be parsed
   */
  TimerHandle register(JobKey key, TimeSpec timeSpec, Runnable onFire);

  /**
   * Stops the timer of {@code key} and removes it from the registry.
   *
   * @throws dev.dbos.cron.exceptions.NonExistentJobException if {@code key} has no live timer
   */
  void stop(JobKey key);

  Optional<TimerHandle> get(JobKey key);

  default boolean isLive(JobKey key) {
    return get(key).isPresent();
  }

  Set<JobKey> liveKeys();
}
