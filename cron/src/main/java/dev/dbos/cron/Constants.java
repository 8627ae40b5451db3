package dev.dbos.cron;

import java.time.Duration;

public class Constants {

  public static final String DB_SCHEMA = "cron";
  public static final String JOBS_TABLE = "cron_jobs";
  public static final String POSTGRES_DEFAULT_DB = "postgres";

  public static final String POSTGRES_PASSWORD_ENV_VAR = "PGPASSWORD";
  public static final String POSTGRES_USER_ENV_VAR = "PGUSER";
  public static final String JDBC_URL_ENV_VAR = "CRON_JDBC_URL";

  public static final String DEFAULT_CANCEL_MESSAGE = "Killed by command";
  public static final int DEFAULT_SCHEDULER_THREADS = 4;

  // Stale one-shot jobs found during recovery are re-armed this far in the future
  public static final Duration STALE_JOB_DELAY = Duration.ofSeconds(1);
}
