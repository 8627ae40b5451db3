package dev.dbos.cron.job;

import org.jspecify.annotations.Nullable;

/** Partial update of a job record. Only the non-null fields are written. */
public record JobPatch(@Nullable Boolean done, @Nullable String error) {

  public static JobPatch succeeded() {
    return new JobPatch(true, null);
  }

  public static JobPatch failed(String error) {
    return new JobPatch(false, error);
  }
}
