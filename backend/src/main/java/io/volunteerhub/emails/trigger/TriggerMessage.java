package io.volunteerhub.emails.trigger;

/** Message shown to whoever caused a trigger to run. */
public record TriggerMessage(Level level, String text) {

  public enum Level {
    INFO,
    WARNING
  }

  public static TriggerMessage info(String text) {
    return new TriggerMessage(Level.INFO, text);
  }

  public static TriggerMessage warning(String text) {
    return new TriggerMessage(Level.WARNING, text);
  }
}
