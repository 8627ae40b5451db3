package dev.dbos.cron.execution;

import dev.dbos.cron.job.Routing;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Performs the side effect of a job when it fires. Both calls are asynchronous; a failure is
 * reported either by throwing or by completing the returned future exceptionally.
 */
public interface ActionDispatcher {

  CompletableFuture<Void> emitCommand(String user, String command, String text, Routing routing);

  CompletableFuture<Void> emitAction(
      String user, String command, String action, Map<String, Object> args, Routing routing);
}
