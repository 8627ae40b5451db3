package dev.dbos.cron.job;

import java.time.Instant;
import java.util.Objects;

/**
 * Normalized time of a job: either a single instant or a recurring cron pattern. The persisted
 * form is the ISO-8601 instant or the raw pattern.
 */
public sealed interface TimeSpec permits TimeSpec.At, TimeSpec.Recurring {

  static At at(Instant instant) {
    return new At(instant);
  }

  static Recurring cron(String pattern) {
    return new Recurring(pattern);
  }

  String persistedForm();

  boolean isOneShot();

  record At(Instant instant) implements TimeSpec {
    public At {
      Objects.requireNonNull(instant, "instant must not be null");
    }

    @Override
    public String persistedForm() {
      return instant.toString();
    }

    @Override
    public boolean isOneShot() {
      return true;
    }
  }

  record Recurring(String pattern) implements TimeSpec {
    public Recurring {
      Objects.requireNonNull(pattern, "pattern must not be null");
    }

    @Override
    public String persistedForm() {
      return pattern;
    }

    @Override
    public boolean isOneShot() {
      return false;
    }
  }
}
