package dev.dbos.cron.execution;

import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

/**
 * Parses recurring patterns. Six fields are read with a leading seconds field, as in {@code
 * "0 30 9 * * MON-FRI"}; five fields as classic Unix cron, as in {@code "30 9 * * 1-5"}.
 */
public final class CronPatterns {

  private static final CronParser secondsParser =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING53));
  private static final CronParser unixParser =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

  private CronPatterns() {}

  /**
   * @throws IllegalArgumentException if the pattern is not a valid cron expression
   */
  public static Cron parse(String pattern) {
    Objects.requireNonNull(pattern, "pattern must not be null");
    var trimmed = pattern.trim();
    var parser = trimmed.split("\\s+").length == 5 ? unixParser : secondsParser;
    return parser.parse(trimmed).validate();
  }

  /**
   * First match of {@code pattern} strictly after {@code from}. Empty for a pattern that parses
   * but never matches, such as February 30th.
   *
   * @throws IllegalArgumentException if the pattern is not a valid cron expression
   */
  public static Optional<ZonedDateTime> nextExecution(String pattern, ZonedDateTime from) {
    return ExecutionTime.forCron(parse(pattern)).nextExecution(from);
  }
}
