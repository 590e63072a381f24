package notifier;

import java.util.Locale;

/**
 * Delivery medium. A recipient may be reachable on several channels, ranked by priority.
 */
public enum Channel {
  EMAIL,
  CHAT,
  WEBHOOK,
  SMS;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Channel parse(String value) {
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    // "slack" is accepted as an alias for the chat channel
    if ("SLACK".equals(normalized)) {
      return CHAT;
    }
    return valueOf(normalized);
  }
}
