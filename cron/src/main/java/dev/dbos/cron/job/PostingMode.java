package dev.dbos.cron.job;

/** Whether an outgoing message is posted as the bot identity or as the human operator. */
public enum PostingMode {
  BOT("bot"),
  USER("user");

  private final String value;

  PostingMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  public static PostingMode fromValue(String value) {
    for (var mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new IllegalArgumentException("Unknown posting mode: " + value);
  }
}
