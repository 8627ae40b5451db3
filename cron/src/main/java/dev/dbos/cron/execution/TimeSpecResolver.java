package dev.dbos.cron.execution;

import dev.dbos.cron.Constants;
import dev.dbos.cron.job.TimeSpec;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns the raw time of a job into a {@link TimeSpec}. Requests are resolved as given; records
 * read back during recovery are re-derived from their persisted string, and one-shot times that
 * already passed are moved to just after the recovery.
 */
public class TimeSpecResolver {

  // 2026-01-01 10:00
  private static final DateTimeFormatter SPACED_LOCAL_DATE_TIME =
      new DateTimeFormatterBuilder()
          .append(DateTimeFormatter.ISO_LOCAL_DATE)
          .appendLiteral(' ')
          .append(DateTimeFormatter.ISO_LOCAL_TIME)
          .toFormatter();

  private static final List<Function<String, Instant>> PARSERS =
      List.of(
          Instant::parse,
          s -> OffsetDateTime.parse(s).toInstant(),
          s -> ZonedDateTime.parse(s).toInstant(),
          s -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC),
          s -> LocalDateTime.parse(s, SPACED_LOCAL_DATE_TIME).toInstant(ZoneOffset.UTC),
          s -> LocalDate.parse(s).atStartOfDay(ZoneOffset.UTC).toInstant());

  private final Clock clock;

  public TimeSpecResolver() {
    this(Clock.systemUTC());
  }

  public TimeSpecResolver(Clock clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  /**
   * Resolves a time as passed to a scheduling request: an {@link Instant}, a zoned or offset
   * date-time, a {@link Date}, epoch milliseconds, an existing {@link TimeSpec}, or a string. A
   * string holding a date/time is a one-shot time, any other string a recurring pattern.
   */
  public static TimeSpec resolve(Object raw) {
    Objects.requireNonNull(raw, "time must not be null");
    if (raw instanceof TimeSpec spec) {
      return spec;
    }
    if (raw instanceof Instant instant) {
      return TimeSpec.at(instant);
    }
    if (raw instanceof Date date) {
      return TimeSpec.at(date.toInstant());
    }
    if (raw instanceof Long epochMillis) {
      return TimeSpec.at(Instant.ofEpochMilli(epochMillis));
    }
    if (raw instanceof TemporalAccessor temporal) {
      return TimeSpec.at(Instant.from(temporal));
    }
    if (raw instanceof String str) {
      return parseInstant(str).<TimeSpec>map(TimeSpec::at).orElseGet(() -> TimeSpec.cron(str));
    }
    throw new IllegalArgumentException(
        "Unsupported time value of type %s".formatted(raw.getClass().getName()));
  }

  /**
   * Classifies a persisted time: a date/time in the past becomes now plus one second, a future
   * one is kept, anything else is taken as a recurring pattern without validation.
   */
  public TimeSpec resolveForRecovery(String persisted) {
    Objects.requireNonNull(persisted, "persisted time must not be null");
    var parsed = parseInstant(persisted);
    if (parsed.isEmpty()) {
      return TimeSpec.cron(persisted);
    }
    var now = clock.instant();
    if (parsed.get().isBefore(now)) {
      return TimeSpec.at(now.plus(Constants.STALE_JOB_DELAY));
    }
    return TimeSpec.at(parsed.get());
  }

  /**
   * Parses an ISO-8601 instant, offset or zoned date-time. Local date-times, with a {@code T} or a
   * space between date and time, and dates are taken as UTC.
   */
  public static Optional<Instant> parseInstant(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    var text = value.trim();
    for (var parser : PARSERS) {
      var parsed = tryParse(parser, text);
      if (parsed.isPresent()) {
        return parsed;
      }
    }
    return Optional.empty();
  }

  private static Optional<Instant> tryParse(Function<String, Instant> parser, String text) {
    try {
      return Optional.of(parser.apply(text));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }
}
