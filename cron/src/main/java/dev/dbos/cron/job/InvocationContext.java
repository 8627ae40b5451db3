package dev.dbos.cron.job;

import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * The command invocation that is scheduling a job. Requests built inside a command handler fall
 * back to these values for every field they leave unset.
 */
public record InvocationContext(
    String user,
    String command,
    @Nullable String text,
    @Nullable String action,
    @Nullable Map<String, Object> args,
    Routing routing) {

  public InvocationContext {
    routing = routing == null ? Routing.none() : routing;
  }
}
