package dev.dbos.cron.job;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a batch cancellation. Jobs are cancelled independently, so some may fail while the
 * others are cancelled.
 */
public record CancellationReport(List<Long> cancelled, Map<Long, Throwable> failures) {

  public CancellationReport {
    cancelled = List.copyOf(cancelled);
    failures = Map.copyOf(failures);
  }

  public boolean isComplete() {
    return failures.isEmpty();
  }

  public int matched() {
    return cancelled.size() + failures.size();
  }
}
