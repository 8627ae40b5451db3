package dev.dbos.cron.job;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * What a job invokes when it fires. A {@link Command} replays a slash command with its text; an
 * {@link Action} triggers a named action of that command with structured arguments.
 */
public sealed interface JobTarget permits JobTarget.Command, JobTarget.Action {

  String command();

  /**
   * Picks the action path when an action name is present, the command path otherwise.
   */
  static JobTarget of(
      String command,
      @Nullable String text,
      @Nullable String action,
      @Nullable Map<String, Object> args) {
    if (action != null && !action.isEmpty()) {
      return new Action(command, action, args);
    }
    return new Command(command, text);
  }

  record Command(String command, @Nullable String text) implements JobTarget {}

  record Action(String command, String action, Map<String, Object> args) implements JobTarget {
    public Action {
      Objects.requireNonNull(action, "action must not be null");
      args = args == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(args));
    }
  }
}
