package notifier;

import java.util.Locale;

/**
 * Notification severity, ordered from least to most urgent.
 *
 * <p>Ordering is by declaration: {@code LOW < MEDIUM < HIGH < CRITICAL}.
 */
public enum Severity {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL;

  /**
   * Returns {@code true} if this severity is the same as or more urgent than {@code minimum}.
   *
   * @param minimum the threshold; {@code null} means no threshold
   * @return whether this severity passes the threshold
   */
  public boolean isAtLeast(Severity minimum) {
    return minimum == null || compareTo(minimum) >= 0;
  }

  public static Severity parse(String value) {
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
