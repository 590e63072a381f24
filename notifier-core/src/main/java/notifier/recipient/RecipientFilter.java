package notifier.recipient;

import notifier.DispatchRequest;
import notifier.NoEligibleRecipientsException;
import notifier.QuietHours;
import notifier.Recipient;
import notifier.RecipientPreferences;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Removes recipients whose preferences reject a request.
 *
 * <p>A recipient is dropped when it has not opted into the request's category, when the
 * severity is below its minimum, when the current time falls inside its quiet hours
 * (unless the request is CRITICAL), or when it has no enabled channel.
 */
public final class RecipientFilter {
  private static final Logger logger = Logger.getLogger(RecipientFilter.class.getName());

  private final Clock clock;

  public RecipientFilter() {
    this(Clock.systemUTC());
  }

  public RecipientFilter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Filters the request's own recipients.
   */
  public List<Recipient> filter(DispatchRequest request) {
    return filter(request, request.recipients());
  }

  /**
   * @return the eligible recipients, in input order; possibly empty
   */
  public List<Recipient> filter(DispatchRequest request, List<Recipient> recipients) {
    Instant now = clock.instant();
    List<Recipient> eligible = new ArrayList<>(recipients.size());
    for (Recipient recipient : recipients) {
      String reason = rejection(request, recipient.preferences(), now);
      if (reason == null) {
        eligible.add(recipient);
      } else {
        logger.log(Level.FINE, "Recipient {0} filtered from dispatch {1}: {2}",
            new Object[] {recipient.id(), request.id(), reason});
      }
    }
    return eligible;
  }

  /**
   * Like {@link #filter(DispatchRequest, List)}, but fails on an empty result.
   *
   * @throws NoEligibleRecipientsException if every recipient was filtered out
   */
  public List<Recipient> requireEligible(DispatchRequest request, List<Recipient> recipients) {
    List<Recipient> eligible = filter(request, recipients);
    if (eligible.isEmpty()) {
      throw new NoEligibleRecipientsException(request.id(), recipients.size());
    }
    return eligible;
  }

  private static String rejection(DispatchRequest request, RecipientPreferences prefs, Instant now) {
    if (!prefs.acceptsCategory(request.category())) {
      return "category " + request.category() + " not enabled";
    }
    if (!request.severity().isAtLeast(prefs.minimumSeverity())) {
      return "severity " + request.severity() + " below minimum " + prefs.minimumSeverity();
    }
    QuietHours quietHours = prefs.quietHours();
    if (quietHours != null && !request.isCritical() && quietHours.contains(now)) {
      return "quiet hours";
    }
    if (!prefs.hasEnabledChannel()) {
      return "no enabled channels";
    }
    return null;
  }
}
