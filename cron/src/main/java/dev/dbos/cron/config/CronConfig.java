package dev.dbos.cron.config;

import dev.dbos.cron.Constants;

import com.zaxxer.hikari.HikariDataSource;

public record CronConfig(
    String appName,
    String databaseUrl,
    String dbUser,
    String dbPassword,
    int maximumPoolSize,
    int connectionTimeout,
    HikariDataSource dataSource,
    boolean migrate,
    String databaseSchema,
    int schedulerThreads,
    String defaultCancelMessage) {

  public CronConfig {
    if (appName == null || appName.isEmpty()) {
      throw new IllegalArgumentException("CronConfig.appName must not be null or empty");
    }
    if (databaseSchema != null && databaseSchema.isEmpty()) {
      throw new IllegalArgumentException(
          "CronConfig.databaseSchema must not be empty if specified");
    }
    if (schedulerThreads < 1) {
      throw new IllegalArgumentException("CronConfig.schedulerThreads must be at least 1");
    }
    if (defaultCancelMessage == null || defaultCancelMessage.isEmpty()) {
      throw new IllegalArgumentException(
          "CronConfig.defaultCancelMessage must not be null or empty");
    }
  }

  public static CronConfig defaults(String appName) {
    return new CronConfig(
        appName, null, null, null, 3, // maximumPoolSize default
        30000, // connectionTimeout default
        null, true, // migrate
        null, Constants.DEFAULT_SCHEDULER_THREADS, Constants.DEFAULT_CANCEL_MESSAGE);
  }

  public static CronConfig defaultsFromEnv(String appName) {
    String databaseUrl = System.getenv(Constants.JDBC_URL_ENV_VAR);
    String dbUser = System.getenv(Constants.POSTGRES_USER_ENV_VAR);
    if (dbUser == null || dbUser.isEmpty()) dbUser = "postgres";
    String dbPassword = System.getenv(Constants.POSTGRES_PASSWORD_ENV_VAR);
    return defaults(appName)
        .withDatabaseUrl(databaseUrl)
        .withDbUser(dbUser)
        .withDbPassword(dbPassword);
  }

  public CronConfig withAppName(String v) {
    return new CronConfig(
        v,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withDatabaseUrl(String v) {
    return new CronConfig(
        appName,
        v,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withDbUser(String v) {
    return new CronConfig(
        appName,
        databaseUrl,
        v,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withDbPassword(String v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        v,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withMaximumPoolSize(int v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        v,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withConnectionTimeout(int v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        v,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withDataSource(HikariDataSource v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        v,
        migrate,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withMigrate(boolean v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        v,
        databaseSchema,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withDatabaseSchema(String v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        v,
        schedulerThreads,
        defaultCancelMessage);
  }

  public CronConfig withSchedulerThreads(int v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        v,
        defaultCancelMessage);
  }

  public CronConfig withDefaultCancelMessage(String v) {
    return new CronConfig(
        appName,
        databaseUrl,
        dbUser,
        dbPassword,
        maximumPoolSize,
        connectionTimeout,
        dataSource,
        migrate,
        databaseSchema,
        schedulerThreads,
        v);
  }

  public CronConfig disableMigrate() {
    return withMigrate(false);
  }

  // Override toString to mask the DB password
  @Override
  public String toString() {
    return "CronConfig[appName=%s, databaseUrl=%s, dbUser=%s, dbPassword=***, maximumPoolSize=%d, connectionTimeout=%d, dataSource=%s, migrate=%s, databaseSchema=%s, schedulerThreads=%d, defaultCancelMessage=%s]"
        .formatted(
            appName,
            databaseUrl,
            dbUser,
            maximumPoolSize,
            connectionTimeout,
            dataSource,
            migrate,
            databaseSchema,
            schedulerThreads,
            defaultCancelMessage);
  }
}
