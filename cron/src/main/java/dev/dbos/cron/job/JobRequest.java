package dev.dbos.cron.job;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/** A request to schedule a command or an action at a given time. */
public record JobRequest(
    TimeSpec time,
    @Nullable String user,
    @Nullable String command,
    @Nullable String text,
    @Nullable String action,
    @Nullable Map<String, Object> args,
    @Nullable Routing routing) {

  public static JobRequest at(TimeSpec time) {
    return new JobRequest(time, null, null, null, null, null, null);
  }

  public JobRequest withUser(String v) {
    return new JobRequest(time, v, command, text, action, args, routing);
  }

  public JobRequest withCommand(String v) {
    return new JobRequest(time, user, v, text, action, args, routing);
  }

  public JobRequest withText(String v) {
    return new JobRequest(time, user, command, v, action, args, routing);
  }

  public JobRequest withAction(String v) {
    return new JobRequest(time, user, command, text, v, args, routing);
  }

  public JobRequest withArgs(Map<String, Object> v) {
    return new JobRequest(time, user, command, text, action, v, routing);
  }

  public JobRequest withRouting(Routing v) {
    return new JobRequest(time, user, command, text, action, args, v);
  }

  /**
   * Fills every unset field from the invocation that schedules the job. Routing is taken as a
   * whole: an explicit routing on the request replaces the context's one entirely.
   */
  public JobRequest withDefaultsFrom(InvocationContext ctx) {
    return new JobRequest(
        time,
        user != null ? user : ctx.user(),
        command != null ? command : ctx.command(),
        text != null ? text : ctx.text(),
        action != null ? action : ctx.action(),
        args != null ? args : ctx.args(),
        routing != null ? routing : ctx.routing());
  }

  public JobTarget target() {
    return JobTarget.of(command, text, action, args);
  }

  /** Draft record to persist; the time is stored in its persisted form. */
  public JobRecord toDraft() {
    return JobRecord.draft(time.persistedForm(), user, target(), routing);
  }
}
