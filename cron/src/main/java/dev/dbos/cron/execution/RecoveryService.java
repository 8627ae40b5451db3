package dev.dbos.cron.execution;

import dev.dbos.cron.database.JobStore;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds the in-memory timers after a restart. Every pending record is re-armed; one-shot
 * times that passed while the process was down fire shortly after recovery instead of being
 * dropped.
 */
public class RecoveryService {

  private static final Logger logger = LoggerFactory.getLogger(RecoveryService.class);

  private final JobStore store;
  private final JobController controller;
  private final TimeSpecResolver resolver;

  public RecoveryService(JobStore store, JobController controller, TimeSpecResolver resolver) {
    this.store = Objects.requireNonNull(store);
    this.controller = Objects.requireNonNull(controller);
    this.resolver = Objects.requireNonNull(resolver);
  }

  /**
   * Re-arms all pending jobs. A store failure propagates: without it nothing is known about the
   * jobs in flight. A job that cannot be re-armed is logged and skipped.
   *
   * @return the number of jobs re-armed
   */
  public int recover() {
    var pending = store.listPending();

    if (pending.isEmpty()) {
      logger.info("No jobs to recover");
      return 0;
    }
    logger.info("Recovering {} jobs", pending.size());

    int recovered = 0;
    for (var job : pending) {
      var time = resolver.resolveForRecovery(job.timeSpec());
      logger.info("Requeuing job {} with {}", job.key(), time);
      try {
        controller.activate(job, time);
        recovered++;
      } catch (RuntimeException e) {
        logger.error("Unable to requeue job {} ({})", job.key(), job.timeSpec(), e);
      }
    }

    if (recovered < pending.size()) {
      logger.warn("Recovered {} of {} pending jobs", recovered, pending.size());
    } else {
      logger.debug("All pending jobs recovered");
    }
    return recovered;
  }
}
