package dev.dbos.cron.job;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Argument to batch cancellation, specifying which pending jobs to target. Every non-null field
 * must match; the job store combines them into a single conjunctive predicate. Only pending jobs
 * that are recurring, or whose one-shot time has not passed, are ever selected.
 *
 * <p>{@code participants} matches the stored list by canonical JSON equality, so the order of the
 * participants does not matter. {@code postingMode} defaults to {@link PostingMode#BOT} and is
 * always applied.
 */
public record JobFilter(
    @Nullable String user,
    @Nullable String command,
    @Nullable String action,
    @Nullable List<String> participants,
    PostingMode postingMode) {

  public JobFilter {
    participants = participants == null ? null : List.copyOf(participants);
    postingMode = postingMode == null ? PostingMode.BOT : postingMode;
  }

  public JobFilter() {
    this(null, null, null, null, PostingMode.BOT);
  }

  public static JobFilter forUser(String user) {
    return new JobFilter().withUser(user);
  }

  /** Restrict cancellation to jobs acting for {@code user}. */
  public JobFilter withUser(String v) {
    return new JobFilter(v, command, action, participants, postingMode);
  }

  /** Restrict cancellation to jobs replaying {@code command}. */
  public JobFilter withCommand(String v) {
    return new JobFilter(user, v, action, participants, postingMode);
  }

  public JobFilter withAction(String v) {
    return new JobFilter(user, command, v, participants, postingMode);
  }

  public JobFilter withParticipants(List<String> v) {
    return new JobFilter(user, command, action, v, postingMode);
  }

  public JobFilter withPostingMode(PostingMode v) {
    return new JobFilter(user, command, action, participants, v);
  }
}
