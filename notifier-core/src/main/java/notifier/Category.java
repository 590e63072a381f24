package notifier;

import java.util.Locale;

/**
 * Fixed set of notification categories recipients can opt into.
 */
public enum Category {
  DIGEST,
  ALERT,
  SYSTEM,
  USER,
  JOB;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Category parse(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
