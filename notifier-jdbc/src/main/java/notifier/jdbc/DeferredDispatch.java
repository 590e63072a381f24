package notifier.jdbc;

import notifier.DispatchRequest;
import notifier.Recipient;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A stored request waiting for its scheduled time.
 *
 * <p>Only recipient ids are persisted; preferences and addresses are resolved again when
 * the request is resubmitted, so changes made in the meantime take effect.
 *
 * @param request      the stored request, without recipients or schedule
 * @param recipientIds ids of the recipients that were eligible when it was deferred
 * @param scheduledFor when it becomes due
 */
public record DeferredDispatch(DispatchRequest request, List<String> recipientIds, Instant scheduledFor) {

  public DeferredDispatch {
    Objects.requireNonNull(request, "request");
    Objects.requireNonNull(scheduledFor, "scheduledFor");
    recipientIds = List.copyOf(recipientIds);
  }

  public String id() {
    return request.id();
  }

  /**
   * Rebuilds the request for resubmission. Recipients the resolver no longer knows
   * (returns {@code null} for) are dropped. The original {@code scheduledFor} is kept: once
   * due it no longer defers the request, and it stops delay rules from deferring it again.
   */
  public DispatchRequest toRequest(Function<String, Recipient> resolver) {
    List<Recipient> recipients = new ArrayList<>(recipientIds.size());
    for (String recipientId : recipientIds) {
      Recipient recipient = resolver.apply(recipientId);
      if (recipient != null) {
        recipients.add(recipient);
      }
    }
    return request.withRecipients(recipients).withScheduledFor(scheduledFor);
  }
}
