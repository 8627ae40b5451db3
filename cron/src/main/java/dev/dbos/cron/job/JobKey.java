package dev.dbos.cron.job;

import java.util.Objects;
import java.util.UUID;

/**
 * Identity of a scheduled job. Persisted jobs carry the id assigned by the job store; ephemeral
 * jobs live only in memory and are identified by a random token.
 */
public sealed interface JobKey permits JobKey.Persisted, JobKey.Ephemeral {

  static Persisted persisted(long id) {
    return new Persisted(id);
  }

  static Ephemeral ephemeral() {
    return new Ephemeral(UUID.randomUUID());
  }

  record Persisted(long id) implements JobKey {
    @Override
    public String toString() {
      return Long.toString(id);
    }
  }

  record Ephemeral(UUID token) implements JobKey {
    public Ephemeral {
      Objects.requireNonNull(token, "token must not be null");
    }

    @Override
    public String toString() {
      return "ephemeral-" + token;
    }
  }
}
