package dev.dbos.cron.job;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * Where the output of a job goes: the channel, the other participants of the conversation, the
 * identity posting the message and, optionally, the session that scheduled it.
 */
public record Routing(
    @Nullable String channel,
    List<String> participants,
    PostingMode postingMode,
    @Nullable String sessionId) {

  public Routing {
    participants = participants == null ? List.of() : List.copyOf(participants);
    postingMode = postingMode == null ? PostingMode.BOT : postingMode;
  }

  public static Routing none() {
    return new Routing(null, null, null, null);
  }

  public static Routing channel(String channel) {
    return none().withChannel(channel);
  }

  public Routing withChannel(String v) {
    return new Routing(v, participants, postingMode, sessionId);
  }

  public Routing withParticipants(List<String> v) {
    return new Routing(channel, v, postingMode, sessionId);
  }

  public Routing withPostingMode(PostingMode v) {
    return new Routing(channel, participants, v, sessionId);
  }

  public Routing withSessionId(String v) {
    return new Routing(channel, participants, postingMode, v);
  }
}
